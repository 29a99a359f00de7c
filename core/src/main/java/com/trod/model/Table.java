package com.trod.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.trod.driver.Alteration;
import com.trod.driver.DdlOptions;
import com.trod.driver.Driver;
import com.trod.driver.TableInfo;
import com.trod.errors.DuplicateFieldNameException;
import com.trod.errors.UnknownFieldException;
import com.trod.query.ExecutionOutcome;
import com.trod.util.JsonUtil;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable schema metadata of one model, produced once by {@link SchemaRegistrar}.
 *
 * <p>Field order is declaration order. It is the default column order of every statement built
 * against the table. A table can be read concurrently without locking; nothing mutates it after
 * registration.
 */
public final class Table {

  private final String name;
  @Nullable private final Database database;
  private final ImmutableMap<String, Field> fields;
  private final PrimaryKey primaryKey;
  private final ImmutableList<Index> indexes;
  @Nullable private final String charset;
  @Nullable private final String comment;

  Table(
      @Nonnull String name,
      @Nullable Database database,
      @Nonnull ImmutableMap<String, Field> fields,
      @Nonnull PrimaryKey primaryKey,
      @Nonnull ImmutableList<Index> indexes,
      @Nullable String charset,
      @Nullable String comment) {
    this.name = Objects.requireNonNull(name);
    this.database = database;
    this.fields = Objects.requireNonNull(fields);
    this.primaryKey = Objects.requireNonNull(primaryKey);
    this.indexes = Objects.requireNonNull(indexes);
    this.charset = charset;
    this.comment = comment;
  }

  @Nonnull
  public String getName() {
    return name;
  }

  /** Returns the bound database, if the model declared one. */
  @Nonnull
  public Optional<Database> getDatabase() {
    return Optional.ofNullable(database);
  }

  /** Returns the fields in declaration order. */
  @Nonnull
  public ImmutableList<Field> getFields() {
    return fields.values().asList();
  }

  /** Returns the column names in declaration order. */
  @Nonnull
  public ImmutableList<String> getColumns() {
    return fields.keySet().asList();
  }

  /**
   * Looks up a declared field by name.
   *
   * @throws UnknownFieldException if the table does not declare the field
   */
  @Nonnull
  public Field field(String fieldName) {
    Field field = fields.get(fieldName);
    if (field == null) {
      throw new UnknownFieldException(name, fieldName);
    }
    return field;
  }

  public boolean hasField(String fieldName) {
    return fields.containsKey(fieldName);
  }

  @Nonnull
  public PrimaryKey getPrimaryKey() {
    return primaryKey;
  }

  @Nonnull
  public ImmutableList<Index> getIndexes() {
    return indexes;
  }

  @Nonnull
  public Optional<String> getCharset() {
    return Optional.ofNullable(charset);
  }

  @Nonnull
  public Optional<String> getComment() {
    return Optional.ofNullable(comment);
  }

  /**
   * Returns the driver of the bound database.
   *
   * @throws IllegalStateException if the table is not bound to a database
   */
  @Nonnull
  public Driver driver() {
    Preconditions.checkState(database != null, "Table `%s` is not bound to a database", name);
    return database.getDriver();
  }

  /** Creates the table through the bound driver. */
  @Nonnull
  public CompletableFuture<ExecutionOutcome> create(@Nonnull DdlOptions options) {
    return driver().createTable(this, options);
  }

  /** Drops the table through the bound driver. */
  @Nonnull
  public CompletableFuture<ExecutionOutcome> drop(@Nonnull DdlOptions options) {
    return driver().dropTable(this, options);
  }

  /**
   * Applies a schema change through the bound driver. The change is checked against this
   * metadata first; the metadata itself stays as registered.
   */
  @Nonnull
  public ExecutionOutcome alter(@Nonnull Alteration alteration) {
    for (Field added : alteration.addColumns()) {
      Preconditions.checkArgument(added.getName() != null, "Added columns must be named");
      if (hasField(added.getName())) {
        throw new DuplicateFieldNameException(
            String.format("Table `%s` already has `%s` field", name, added.getName()));
      }
    }
    for (String dropped : alteration.dropColumns()) {
      field(dropped);
      Preconditions.checkArgument(
          !dropped.equals(primaryKey.name()), "Cannot drop primary key `%s`", dropped);
    }
    return driver().alterTable(this, alteration);
  }

  /** Describes the current schema as reported by the bound driver. */
  @Nonnull
  public TableInfo show() {
    return driver().describeTable(this);
  }

  /** Renders the registered metadata as JSON. */
  @Nonnull
  public String toJson() {
    JsonObject json = new JsonObject();
    json.addProperty("name", name);
    json.addProperty("database", database == null ? null : database.getName());
    JsonArray columns = new JsonArray();
    for (Field field : fields.values()) {
      JsonObject column = new JsonObject();
      column.addProperty("name", field.getName());
      column.addProperty("type", field.getType().name());
      column.addProperty("length", field.getLength());
      column.addProperty("nullable", field.isNullable());
      column.addProperty("primaryKey", field.isPrimaryKey());
      column.addProperty("comment", field.getComment());
      columns.add(column);
    }
    json.add("fields", columns);
    json.addProperty("primaryKey", primaryKey.name());
    json.addProperty("autoIncrement", primaryKey.auto());
    JsonArray indexArray = new JsonArray();
    for (Index index : indexes) {
      JsonObject indexJson = new JsonObject();
      indexJson.addProperty("name", index.name());
      indexJson.add("columns", JsonUtil.gson().toJsonTree(index.columns()));
      indexJson.addProperty("unique", index.unique());
      indexArray.add(indexJson);
    }
    json.add("indexes", indexArray);
    json.addProperty("charset", charset);
    json.addProperty("comment", comment);
    return JsonUtil.toJson(json);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", name)
        .add("columns", getColumns())
        .add("primaryKey", primaryKey.name())
        .add("comment", comment)
        .toString();
  }
}
