package com.trod.model;

import com.google.common.collect.ImmutableList;
import com.trod.errors.DuplicateFieldNameException;
import com.trod.errors.SchemaFrozenException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Collects the declarations of a model, in order, until {@link #register()} turns them into the
 * model's {@link Table}. After registration the definition is frozen: every further declaration
 * fails with {@link SchemaFrozenException}.
 *
 * @param <R> the record type of the model
 */
public final class ModelDefinition<R extends Model> {

  private final String modelName;
  private final Function<ModelClass<R>, R> factory;
  private final Map<String, Object> declarations = new LinkedHashMap<>();
  private Diagnostics diagnostics = Diagnostics.logging();
  private ModelClass<R> registered;

  ModelDefinition(@Nonnull String modelName, @Nonnull Function<ModelClass<R>, R> factory) {
    this.modelName = Objects.requireNonNull(modelName);
    this.factory = Objects.requireNonNull(factory);
  }

  /**
   * Declares an attribute. {@link Field} values become columns; the reserved keys of
   * {@link SchemaRegistrar} configure the table; anything else fails at registration.
   *
   * @throws DuplicateFieldNameException if {@code key} was declared already
   */
  public ModelDefinition<R> declare(@Nonnull String key, Object value) {
    checkNotFrozen(key);
    if (declarations.containsKey(key)) {
      throw new DuplicateFieldNameException(
          String.format("Duplicate declaration `%s` in model `%s`", key, modelName));
    }
    declarations.put(key, value);
    return this;
  }

  public ModelDefinition<R> field(@Nonnull String name, @Nonnull Field field) {
    return declare(name, field);
  }

  public ModelDefinition<R> database(@Nonnull Database database) {
    return declare(SchemaRegistrar.DATABASE, database);
  }

  public ModelDefinition<R> table(@Nonnull String tableName) {
    return declare(SchemaRegistrar.TABLE, tableName);
  }

  public ModelDefinition<R> charset(@Nonnull String charset) {
    return declare(SchemaRegistrar.CHARSET, charset);
  }

  public ModelDefinition<R> comment(@Nonnull String comment) {
    return declare(SchemaRegistrar.COMMENT, comment);
  }

  public ModelDefinition<R> indexes(@Nonnull Index... indexes) {
    return declare(SchemaRegistrar.INDEXES, ImmutableList.copyOf(Arrays.asList(indexes)));
  }

  /** Replaces the sink that receives this registration's diagnostics. */
  public ModelDefinition<R> diagnostics(@Nonnull Diagnostics diagnostics) {
    checkNotFrozen("diagnostics");
    this.diagnostics = Objects.requireNonNull(diagnostics);
    return this;
  }

  /**
   * Registers the model and freezes this definition.
   *
   * @return the registered model
   */
  @Nonnull
  public ModelClass<R> register() {
    checkNotFrozen("register");
    Table table = SchemaRegistrar.register(modelName, declarations, diagnostics);
    registered = new ModelClass<>(modelName, table, factory);
    return registered;
  }

  public boolean isRegistered() {
    return registered != null;
  }

  private void checkNotFrozen(String key) {
    if (registered != null) {
      throw new SchemaFrozenException(
          String.format(
              "Model `%s` is registered, setting attribute `%s` is not allowed", modelName, key));
    }
  }
}
