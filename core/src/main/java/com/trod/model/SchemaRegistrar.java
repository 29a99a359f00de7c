package com.trod.model;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.trod.errors.DuplicateFieldNameException;
import com.trod.errors.DuplicatePrimaryKeyException;
import com.trod.errors.InvalidFieldTypeException;
import com.trod.errors.NoPrimaryKeyException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Turns the declarations of a model into its immutable {@link Table}.
 *
 * <p>Registration runs once per model, before any record or statement of that model exists:
 *
 * <ol>
 *   <li>The reserved keys ({@link #DATABASE}, {@link #TABLE}, {@link #INDEXES}, {@link #CHARSET},
 *       {@link #COMMENT}) are taken out of the declarations.
 *   <li>Without an explicit table name, the lower-cased model name is used and a diagnostic is
 *       emitted.
 *   <li>The remaining declarations are walked in order. {@link Field} values are named after
 *       their key unless named already; the first primary key wins and a second one fails. Any
 *       other value fails unless its key is a pass-through key.
 *   <li>A model without a primary key fails.
 *   <li>Every index must reference declared fields only.
 * </ol>
 */
public final class SchemaRegistrar {

  public static final String DATABASE = "database";
  public static final String TABLE = "table";
  public static final String INDEXES = "indexes";
  public static final String CHARSET = "charset";
  public static final String COMMENT = "comment";

  /** Keys that may carry arbitrary values; they are accepted and not part of the schema. */
  public static final ImmutableSet<String> PASS_THROUGH_KEYS = ImmutableSet.of("doc");

  private SchemaRegistrar() {
    // Utility class, no instances
  }

  /**
   * Registers a model.
   *
   * @param modelName the model name, used for the derived table name and in messages
   * @param declarations the declared attributes in declaration order; not modified
   * @param diagnostics receives the non-fatal notices of this registration
   * @return the immutable table metadata
   */
  @Nonnull
  public static Table register(
      @Nonnull String modelName,
      @Nonnull Map<String, ?> declarations,
      @Nonnull Diagnostics diagnostics) {
    Map<String, Object> attrs = new LinkedHashMap<>(declarations);

    Database database = reserved(attrs, DATABASE, Database.class, modelName);
    String tableName = reserved(attrs, TABLE, String.class, modelName);
    Object indexDeclaration = attrs.remove(INDEXES);
    String charset = reserved(attrs, CHARSET, String.class, modelName);
    String comment = reserved(attrs, COMMENT, String.class, modelName);

    Database.Config config = database == null ? Database.Config.defaults() : database.getConfig();

    if (Strings.isNullOrEmpty(tableName)) {
      tableName = modelName.toLowerCase(Locale.ROOT);
      if (config.warnOnImplicitTableName()) {
        notify(
            diagnostics,
            String.format(
                "Did not give the table name, use the model name `%s` as `%s`",
                modelName, tableName));
      }
    }

    Map<String, Field> fields = new LinkedHashMap<>();
    PrimaryKey primaryKey = null;

    for (Map.Entry<String, Object> attr : attrs.entrySet()) {
      String key = attr.getKey();
      Object value = attr.getValue();
      if (!(value instanceof Field)) {
        if (PASS_THROUGH_KEYS.contains(key)) {
          continue;
        }
        throw new InvalidFieldTypeException(
            String.format("Invalid model field `%s` of model `%s`", key, modelName));
      }

      Field field = (Field) value;
      if (field.getName() == null) {
        field = field.named(key);
      }
      if (fields.containsKey(field.getName())) {
        throw new DuplicateFieldNameException(
            String.format("Duplicate field name `%s` in model `%s`", field.getName(), modelName));
      }

      if (field.isPrimaryKey()) {
        if (primaryKey != null) {
          throw new DuplicatePrimaryKeyException(
              String.format(
                  "Duplicate primary key found for field `%s`, `%s` is already the primary key",
                  field.getName(), primaryKey.name()));
        }
        boolean auto = field.isAutoIncrement();
        primaryKey = new PrimaryKey(field, auto, field.getAutoIncrementStart());
        if (auto && !field.getName().equals(config.autoIncrementKeyName())) {
          notify(
              diagnostics,
              String.format(
                  "The field name of AUTO_INCREMENT primary key is suggested to use `%s` instead"
                      + " of `%s`",
                  config.autoIncrementKeyName(), field.getName()));
        }
      }
      fields.put(field.getName(), field);
    }

    if (primaryKey == null) {
      throw new NoPrimaryKeyException(
          String.format("Primary key not found for table `%s`", tableName));
    }

    ImmutableList<Index> indexes = indexes(indexDeclaration, fields, tableName);

    Table table =
        new Table(
            tableName,
            database,
            ImmutableMap.copyOf(fields),
            primaryKey,
            indexes,
            charset,
            comment);
    Logger.debug("Registered model {} as {}", modelName, table);
    return table;
  }

  @Nullable
  private static <T> T reserved(
      Map<String, Object> attrs, String key, Class<T> type, String modelName) {
    Object value = attrs.remove(key);
    if (value == null) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new InvalidFieldTypeException(
          String.format(
              "Reserved attribute `%s` of model `%s` must be a %s, got %s",
              key, modelName, type.getSimpleName(), value.getClass().getSimpleName()));
    }
    return type.cast(value);
  }

  private static ImmutableList<Index> indexes(
      @Nullable Object declaration, Map<String, Field> fields, String tableName) {
    if (declaration == null) {
      return ImmutableList.of();
    }
    if (!(declaration instanceof Iterable)) {
      throw new InvalidFieldTypeException(
          String.format("Indexes of table `%s` must be a sequence of Index", tableName));
    }
    ImmutableList.Builder<Index> indexes = ImmutableList.builder();
    for (Object element : (Iterable<?>) declaration) {
      if (!(element instanceof Index)) {
        throw new InvalidFieldTypeException(
            String.format("Invalid index `%s` of table `%s`", element, tableName));
      }
      Index index = (Index) element;
      for (String column : index.columns()) {
        if (!fields.containsKey(column)) {
          throw new InvalidFieldTypeException(
              String.format(
                  "Index `%s` of table `%s` references unknown field `%s`",
                  index.name(), tableName, column));
        }
      }
      indexes.add(index);
    }
    return indexes.build();
  }

  private static void notify(Diagnostics diagnostics, String message) {
    try {
      diagnostics.warn(message);
    } catch (RuntimeException e) {
      Logger.error(e, "Diagnostics sink failed on: {}", message);
    }
  }
}
