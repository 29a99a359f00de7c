package com.trod.model;

import com.google.common.collect.ImmutableMap;
import com.trod.errors.ImmutablePrimaryKeyException;
import com.trod.errors.RemoveWithoutKeyException;
import com.trod.errors.UnknownFieldException;
import com.trod.query.Delete;
import com.trod.query.ExecutionOutcome;
import com.trod.query.Replace;
import com.trod.query.RowBatch;
import com.trod.util.JsonUtil;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A record of a model: the field values of one logical row.
 *
 * <p>Values are held by field name and constrained by the model's {@link Table}. Reading a
 * declared field that was never set returns {@code null}. The public write path rejects
 * undeclared names and, when the primary key is AUTO_INCREMENT, the primary key itself; the key
 * is only written by the result loader or when a save reports the generated value.
 *
 * <p>Typed models extend this class and expose accessors over {@link #get}:
 *
 * <pre>
 * public final class Person extends Model {
 *   public static final ModelClass&lt;Person&gt; MODEL =
 *       ModelClass.define("Person", Person::new)
 *           .database(db)
 *           .table("person")
 *           .field("id", Field.bigint().primaryKey().autoIncrement())
 *           .field("name", Field.varchar(45))
 *           .register();
 *
 *   public Person() {
 *     super(MODEL);
 *   }
 *
 *   public String getName() {
 *     return (String) get("name");
 *   }
 * }
 * </pre>
 */
public class Model {

  private final ModelClass<?> modelClass;
  private final Map<String, Object> values = new LinkedHashMap<>();

  protected Model(@Nonnull ModelClass<?> modelClass) {
    this.modelClass = Objects.requireNonNull(modelClass);
  }

  @Nonnull
  public ModelClass<?> getModelClass() {
    return modelClass;
  }

  @Nonnull
  public Table getTable() {
    return modelClass.getTable();
  }

  /**
   * Returns the value of a field, or null when it has not been set.
   *
   * @throws UnknownFieldException if the table does not declare the field
   */
  @Nullable
  public Object get(@Nonnull String name) {
    if (values.containsKey(name)) {
      return values.get(name);
    }
    if (getTable().hasField(name)) {
      return null;
    }
    throw new UnknownFieldException(getTable().getName(), name);
  }

  /** Typed variant of {@link #get(String)}. */
  @Nullable
  public <T> T get(@Nonnull String name, @Nonnull Class<T> type) {
    return type.cast(get(name));
  }

  /**
   * Sets a field value.
   *
   * @return this record
   * @throws UnknownFieldException if the table does not declare the field
   * @throws ImmutablePrimaryKeyException if the field is an AUTO_INCREMENT primary key
   */
  public Model set(@Nonnull String name, @Nullable Object value) {
    checkWritable(name);
    values.put(name, value);
    return this;
  }

  /**
   * Sets several field values through the public write path. Every name is checked before any
   * value is written, so a rejected name leaves the record unchanged.
   */
  public Model setAll(@Nonnull Map<String, ?> fieldValues) {
    fieldValues.keySet().forEach(this::checkWritable);
    values.putAll(fieldValues);
    return this;
  }

  private void checkWritable(String name) {
    PrimaryKey primaryKey = getTable().getPrimaryKey();
    if (primaryKey.auto() && primaryKey.name().equals(name)) {
      throw new ImmutablePrimaryKeyException(
          String.format(
              "AUTO_INCREMENT table `%s` does not allow modifying primary key `%s`",
              getTable().getName(), name));
    }
    if (!getTable().hasField(name)) {
      throw new UnknownFieldException(getTable().getName(), name);
    }
  }

  /** Trusted write used by {@link Loader} and key write-back; no checks. */
  void load(String name, @Nullable Object value) {
    values.put(name, value);
  }

  /** Whether a value, possibly null, has been assigned to the field. */
  public boolean isSet(@Nonnull String name) {
    return values.containsKey(name);
  }

  /** Returns the current primary-key value, or null when unset. */
  @Nullable
  public Object getPrimaryKeyValue() {
    return values.get(getTable().getPrimaryKey().name());
  }

  /** The assigned values in assignment order. */
  @Nonnull
  public Map<String, Object> values() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Returns the values to persist, in declaration order: each field's value, or the result of its
   * default producer when no value is set. Fields that remain null are left out.
   */
  @Nonnull
  public ImmutableMap<String, Object> snapshot() {
    ImmutableMap.Builder<String, Object> snapshot = ImmutableMap.builder();
    for (Field field : getTable().getFields()) {
      Object value = values.get(field.getName());
      if (value == null && field.hasDefault()) {
        value = field.produceDefault();
      }
      if (value != null) {
        snapshot.put(field.getName(), value);
      }
    }
    return snapshot.build();
  }

  /**
   * Saves this record with REPLACE semantics. When the driver reports a generated key, it is
   * written back to the primary-key field.
   */
  @Nonnull
  public CompletableFuture<ExecutionOutcome> save() {
    Replace replace = new Replace(getTable(), RowBatch.of(getTable(), snapshot()));
    return replace
        .execute()
        .thenApply(
            outcome -> {
              PrimaryKey primaryKey = getTable().getPrimaryKey();
              if (primaryKey.auto() && outcome.lastId() != null) {
                load(primaryKey.name(), outcome.lastId());
              }
              return outcome;
            });
  }

  /**
   * Deletes the row of this record by its primary key.
   *
   * @throws RemoveWithoutKeyException if the primary key is unset; raised before any I/O
   */
  @Nonnull
  public CompletableFuture<ExecutionOutcome> remove() {
    PrimaryKey primaryKey = getTable().getPrimaryKey();
    Object key = getPrimaryKeyValue();
    if (key == null) {
      throw new RemoveWithoutKeyException(
          String.format(
              "Cannot remove a `%s` record whose primary key `%s` is unset",
              modelClass.getName(), primaryKey.name()));
    }
    return new Delete(getTable()).where(primaryKey.field().eq(key)).execute();
  }

  /** Renders the assigned values as a JSON object. */
  @Nonnull
  public String toJson() {
    return JsonUtil.toJson(values);
  }

  @Override
  public String toString() {
    return String.format(
        "<%s(table '%s': %s)>",
        modelClass.getName(), getTable().getName(), getTable().getComment().orElse(null));
  }
}
