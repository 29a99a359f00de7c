package com.trod.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.trod.driver.Alteration;
import com.trod.driver.DdlOptions;
import com.trod.driver.TableInfo;
import com.trod.query.Delete;
import com.trod.query.ExecutionOutcome;
import com.trod.query.FetchResult;
import com.trod.query.Insert;
import com.trod.query.Replace;
import com.trod.query.RowBatch;
import com.trod.query.Select;
import com.trod.query.Update;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * A registered model: its immutable {@link Table}, a factory for its records, and the class-level
 * operations that build statements against the table.
 *
 * @param <R> the record type
 */
public final class ModelClass<R extends Model> {

  private final String name;
  private final Table table;
  private final Function<ModelClass<R>, R> factory;

  ModelClass(String name, Table table, Function<ModelClass<R>, R> factory) {
    this.name = name;
    this.table = table;
    this.factory = factory;
  }

  /** Starts the definition of an untyped model whose records are plain {@link Model}s. */
  public static ModelDefinition<Model> define(@Nonnull String name) {
    return new ModelDefinition<>(name, Model::new);
  }

  /**
   * Starts the definition of a typed model.
   *
   * @param factory creates empty records; typed models pass their no-argument constructor
   */
  public static <R extends Model> ModelDefinition<R> define(
      @Nonnull String name, @Nonnull Supplier<R> factory) {
    Objects.requireNonNull(factory);
    return new ModelDefinition<>(name, modelClass -> factory.get());
  }

  @Nonnull
  public String getName() {
    return name;
  }

  @Nonnull
  public Table getTable() {
    return table;
  }

  /** Shorthand for {@code getTable().field(name)}. */
  @Nonnull
  public Field field(@Nonnull String fieldName) {
    return table.field(fieldName);
  }

  /** Creates an empty record of this model. */
  @Nonnull
  public R newInstance() {
    R record = factory.apply(this);
    Preconditions.checkState(
        record.getModelClass() == this,
        "Factory of model `%s` built a record of model `%s`",
        name,
        record.getModelClass().getName());
    return record;
  }

  public CompletableFuture<ExecutionOutcome> createTable() {
    return table.create(DdlOptions.defaults());
  }

  public CompletableFuture<ExecutionOutcome> createTable(@Nonnull DdlOptions options) {
    return table.create(options);
  }

  public CompletableFuture<ExecutionOutcome> dropTable() {
    return table.drop(DdlOptions.defaults());
  }

  public CompletableFuture<ExecutionOutcome> dropTable(@Nonnull DdlOptions options) {
    return table.drop(options);
  }

  /** Applies a schema change. */
  public ExecutionOutcome alter(@Nonnull Alteration alteration) {
    return table.alter(alteration);
  }

  /** Describes the current schema. */
  public TableInfo show() {
    return table.show();
  }

  /**
   * Reads the record with the given primary key. When no row matches, the future completes with
   * a fresh, unpopulated record.
   */
  public CompletableFuture<R> get(@Nonnull Object id) {
    return select().where(table.getPrimaryKey().field().eq(id)).first();
  }

  /** Reads the records whose primary key is one of {@code ids}. */
  public CompletableFuture<FetchResult<R>> getMany(
      @Nonnull Collection<?> ids, @Nonnull Field... columns) {
    return select(columns).where(table.getPrimaryKey().field().in(ids)).all();
  }

  /** Insert of one record's {@link Model#snapshot() snapshot}. */
  public Insert add(@Nonnull R record) {
    return new Insert(table, RowBatch.of(table, record.snapshot()));
  }

  /** Insert of several records' snapshots. */
  public Insert addMany(@Nonnull Collection<? extends R> records) {
    List<ImmutableMap<String, Object>> rows =
        records.stream().map(Model::snapshot).collect(ImmutableList.toImmutableList());
    return new Insert(table, RowBatch.ofMaps(table, rows));
  }

  /** Select of the given fields, or of every field when none is given. */
  public Select<R> select(@Nonnull Field... columns) {
    return new Select<>(this, Arrays.asList(columns), false);
  }

  public Select<R> selectDistinct(@Nonnull Field... columns) {
    return new Select<>(this, Arrays.asList(columns), true);
  }

  /** Insert of one row given as field name to value. */
  public Insert insert(@Nonnull Map<String, ?> row) {
    return new Insert(table, RowBatch.of(table, row));
  }

  /** Insert of several rows given as mappings. */
  public Insert insertMany(@Nonnull List<? extends Map<String, ?>> rows) {
    return new Insert(table, RowBatch.ofMaps(table, rows));
  }

  /** Insert of positional rows aligned with {@code columns}. */
  public Insert insertMany(@Nonnull List<? extends List<?>> tuples, @Nonnull Field... columns) {
    return new Insert(table, RowBatch.ofTuples(table, RowBatch.columnsOf(columns), tuples));
  }

  public Update update(@Nonnull Map<String, ?> values) {
    return new Update(table, values);
  }

  public Delete delete() {
    return new Delete(table);
  }

  /** Replace of one row given as field name to value. */
  public Replace replace(@Nonnull Map<String, ?> row) {
    return new Replace(table, RowBatch.of(table, row));
  }

  @Override
  public String toString() {
    return "<Model " + name + "(table '" + table.getName() + "')>";
  }
}
