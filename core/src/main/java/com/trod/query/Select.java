package com.trod.query;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.trod.model.Field;
import com.trod.model.Model;
import com.trod.model.ModelClass;
import com.trod.model.Table;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * SELECT against the table of one model. Every chaining method returns a new statement.
 *
 * <p>Reads end in {@link #first()} or {@link #all()}, which decode rows into records of the
 * model, or in {@link #firstMap()} and {@link #allMaps()}, which return generic mappings. See
 * {@link ResultCodec} for what a read returns when nothing matches.
 *
 * @param <R> the model record type
 */
public final class Select<R extends Model> implements Statement {

  private final ModelClass<R> modelClass;
  private final ImmutableList<Field> columns;
  private final boolean distinct;
  @Nullable private final Predicate where;
  private final ImmutableList<Order> orderBy;
  @Nullable private final Integer limit;
  private final int offset;
  private final boolean single;

  /**
   * Creates a select.
   *
   * @param columns the projected fields; empty selects every field in declaration order
   */
  public Select(@Nonnull ModelClass<R> modelClass, @Nonnull List<Field> columns, boolean distinct) {
    this(
        modelClass,
        projection(modelClass.getTable(), columns),
        distinct,
        null,
        ImmutableList.of(),
        null,
        0,
        false);
  }

  private Select(
      ModelClass<R> modelClass,
      ImmutableList<Field> columns,
      boolean distinct,
      @Nullable Predicate where,
      ImmutableList<Order> orderBy,
      @Nullable Integer limit,
      int offset,
      boolean single) {
    this.modelClass = Objects.requireNonNull(modelClass);
    this.columns = columns;
    this.distinct = distinct;
    this.where = where;
    this.orderBy = orderBy;
    this.limit = limit;
    this.offset = offset;
    this.single = single;
  }

  private static ImmutableList<Field> projection(Table table, List<Field> columns) {
    if (columns.isEmpty()) {
      return table.getFields();
    }
    return columns.stream()
        .map(field -> Statements.checkField(table, field))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns a select restricted by {@code predicate}, AND-ed with any existing condition. */
  @Nonnull
  public Select<R> where(@Nonnull Predicate predicate) {
    Statements.checkFields(getTable(), predicate);
    return new Select<>(
        modelClass, columns, distinct, where == null ? predicate : where.and(predicate), orderBy,
        limit, offset, single);
  }

  @Nonnull
  public Select<R> orderBy(@Nonnull Order... orders) {
    ImmutableList.Builder<Order> terms = ImmutableList.<Order>builder().addAll(orderBy);
    for (Order order : orders) {
      Statements.checkField(getTable(), order.field());
      terms.add(order);
    }
    return new Select<>(
        modelClass, columns, distinct, where, terms.build(), limit, offset, single);
  }

  @Nonnull
  public Select<R> limit(int limit) {
    Preconditions.checkArgument(limit >= 0, "limit must not be negative");
    return new Select<>(modelClass, columns, distinct, where, orderBy, limit, offset, single);
  }

  @Nonnull
  public Select<R> offset(int offset) {
    Preconditions.checkArgument(offset >= 0, "offset must not be negative");
    return new Select<>(modelClass, columns, distinct, where, orderBy, limit, offset, single);
  }

  /**
   * Fetches the first matching row as a record. When nothing matches, the future completes with a
   * fresh, unpopulated record rather than null.
   */
  @Nonnull
  public CompletableFuture<R> first() {
    return fetchOne().thenApply(raw -> ResultCodec.loadOne(raw, modelClass));
  }

  /** Fetches the first matching row as a mapping; empty when nothing matches. */
  @Nonnull
  public CompletableFuture<Map<String, Object>> firstMap() {
    return fetchOne().thenApply(ResultCodec::loadOneAsMap);
  }

  /** Fetches every matching row as records; an empty result when nothing matches. */
  @Nonnull
  public CompletableFuture<FetchResult<R>> all() {
    return fetchAll().thenApply(raw -> ResultCodec.loadAll(raw, modelClass));
  }

  /** Fetches every matching row as mappings. */
  @Nonnull
  public CompletableFuture<FetchResult<Map<String, Object>>> allMaps() {
    return fetchAll().thenApply(ResultCodec::loadAllAsMaps);
  }

  private CompletableFuture<Object> fetchOne() {
    int oneLimit = limit == null ? 1 : Math.min(limit, 1);
    Select<R> one =
        new Select<>(modelClass, columns, distinct, where, orderBy, oneLimit, offset, true);
    return getTable().driver().fetch(one);
  }

  private CompletableFuture<Object> fetchAll() {
    return getTable().driver().fetch(this);
  }

  @Nonnull
  public ModelClass<R> getModelClass() {
    return modelClass;
  }

  @Override
  public Table getTable() {
    return modelClass.getTable();
  }

  @Nonnull
  public ImmutableList<Field> getColumns() {
    return columns;
  }

  public boolean isDistinct() {
    return distinct;
  }

  @Nonnull
  public Optional<Predicate> getWhere() {
    return Optional.ofNullable(where);
  }

  @Nonnull
  public ImmutableList<Order> getOrderBy() {
    return orderBy;
  }

  @Nonnull
  public OptionalInt getLimit() {
    return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
  }

  public int getOffset() {
    return offset;
  }

  /**
   * Whether the driver should answer with a single mapping (possibly empty) instead of a list.
   * Set on the statement issued by {@link #first()} and {@link #firstMap()}.
   */
  public boolean isSingle() {
    return single;
  }

  @Override
  public <T> T accept(StatementVisitor<T> visitor) {
    return visitor.visitSelect(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("table", getTable().getName())
        .add("columns", columns.stream().map(Field::getName).toList())
        .add("distinct", distinct ? Boolean.TRUE : null)
        .add("where", where)
        .add("orderBy", orderBy.isEmpty() ? null : orderBy)
        .add("limit", limit)
        .add("offset", offset == 0 ? null : offset)
        .toString();
  }
}
