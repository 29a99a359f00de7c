package com.trod.query;

import com.google.common.base.MoreObjects;
import com.trod.errors.InvalidRowException;
import com.trod.errors.UnknownFieldException;
import com.trod.model.Table;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** UPDATE setting field values on the rows matching an optional condition. */
public final class Update implements Statement {

  private final Table table;
  private final Map<String, Object> values;
  @Nullable private final Predicate where;

  /**
   * Creates an update.
   *
   * @param values field name to new value; null values set the column to NULL
   * @throws InvalidRowException if {@code values} is empty
   * @throws UnknownFieldException if a key is not a field of {@code table}
   */
  public Update(@Nonnull Table table, @Nonnull Map<String, ?> values) {
    this(table, ordered(table, values), null);
  }

  private Update(Table table, Map<String, Object> values, @Nullable Predicate where) {
    this.table = Objects.requireNonNull(table);
    this.values = values;
    this.where = where;
  }

  private static Map<String, Object> ordered(Table table, Map<String, ?> values) {
    if (values.isEmpty()) {
      throw new InvalidRowException("Update needs at least one value");
    }
    for (String key : values.keySet()) {
      if (!table.hasField(key)) {
        throw new UnknownFieldException(table.getName(), key);
      }
    }
    Map<String, Object> ordered = new LinkedHashMap<>();
    for (String column : table.getColumns()) {
      if (values.containsKey(column)) {
        ordered.put(column, values.get(column));
      }
    }
    return Collections.unmodifiableMap(ordered);
  }

  /** Returns an update restricted by {@code predicate}, AND-ed with any existing condition. */
  @Nonnull
  public Update where(@Nonnull Predicate predicate) {
    Statements.checkFields(table, predicate);
    return new Update(table, values, where == null ? predicate : where.and(predicate));
  }

  @Override
  public Table getTable() {
    return table;
  }

  /** The values to set, in table declaration order. */
  @Nonnull
  public Map<String, Object> getValues() {
    return values;
  }

  @Nonnull
  public Optional<Predicate> getWhere() {
    return Optional.ofNullable(where);
  }

  @Nonnull
  public CompletableFuture<ExecutionOutcome> execute() {
    return table.driver().execute(this);
  }

  @Override
  public <T> T accept(StatementVisitor<T> visitor) {
    return visitor.visitUpdate(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("table", table.getName())
        .add("values", values)
        .add("where", where)
        .toString();
  }
}
