package com.trod.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.trod.query.Order;
import com.trod.query.Predicate;
import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Describes one column of a table.
 *
 * <p>A field is immutable. Every modifier returns a new descriptor, so a field value can be
 * declared once and reused across definitions:
 *
 * <pre>
 * Field.bigint().primaryKey().autoIncrement()
 * Field.varchar(45).notNull().comment("display name")
 * Field.datetime().defaultValue(Instant::now)
 * </pre>
 *
 * <p>Fields declared without a name take the key they are declared under when the model is
 * registered. Once attached to a {@link Table}, the named descriptor is also the handle used to
 * build predicates and orderings, e.g. {@code Person.NAME.eq("Alice")}.
 */
public final class Field {

  @Nullable private final String name;
  private final FieldType type;
  @Nullable private final Integer length;
  private final boolean nullable;
  private final boolean primaryKey;
  private final boolean autoIncrement;
  private final long autoIncrementStart;
  @Nullable private final Supplier<?> defaultValue;
  @Nullable private final String comment;

  private Field(
      @Nullable String name,
      FieldType type,
      @Nullable Integer length,
      boolean nullable,
      boolean primaryKey,
      boolean autoIncrement,
      long autoIncrementStart,
      @Nullable Supplier<?> defaultValue,
      @Nullable String comment) {
    this.name = name;
    this.type = Objects.requireNonNull(type);
    this.length = length;
    this.nullable = nullable;
    this.primaryKey = primaryKey;
    this.autoIncrement = autoIncrement;
    this.autoIncrementStart = autoIncrementStart;
    this.defaultValue = defaultValue;
    this.comment = comment;
  }

  /** Creates an unnamed, nullable field of the given type. */
  public static Field of(@Nonnull FieldType type) {
    return new Field(null, type, null, true, false, false, 1L, null, null);
  }

  public static Field tinyint() {
    return of(FieldType.TINYINT);
  }

  public static Field smallint() {
    return of(FieldType.SMALLINT);
  }

  public static Field integer() {
    return of(FieldType.INT);
  }

  public static Field bigint() {
    return of(FieldType.BIGINT);
  }

  public static Field floating() {
    return of(FieldType.FLOAT);
  }

  public static Field doublePrecision() {
    return of(FieldType.DOUBLE);
  }

  public static Field decimal() {
    return of(FieldType.DECIMAL);
  }

  public static Field bool() {
    return of(FieldType.BOOLEAN);
  }

  public static Field character(int length) {
    return of(FieldType.CHAR).length(length);
  }

  public static Field varchar(int length) {
    return of(FieldType.VARCHAR).length(length);
  }

  public static Field text() {
    return of(FieldType.TEXT);
  }

  public static Field blob() {
    return of(FieldType.BLOB);
  }

  public static Field date() {
    return of(FieldType.DATE);
  }

  public static Field datetime() {
    return of(FieldType.DATETIME);
  }

  public static Field timestamp() {
    return of(FieldType.TIMESTAMP);
  }

  public static Field json() {
    return of(FieldType.JSON);
  }

  /** Returns a copy carrying an explicit column name. */
  public Field named(@Nonnull String name) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Field name must not be empty");
    return new Field(
        name, type, length, nullable, primaryKey, autoIncrement, autoIncrementStart,
        defaultValue, comment);
  }

  public Field length(int length) {
    Preconditions.checkArgument(length > 0, "Length must be positive, got %s", length);
    return new Field(
        name, type, length, nullable, primaryKey, autoIncrement, autoIncrementStart,
        defaultValue, comment);
  }

  public Field notNull() {
    return new Field(
        name, type, length, false, primaryKey, autoIncrement, autoIncrementStart,
        defaultValue, comment);
  }

  /** Marks the field as the primary key. Primary keys are never nullable. */
  public Field primaryKey() {
    return new Field(
        name, type, length, false, true, autoIncrement, autoIncrementStart, defaultValue,
        comment);
  }

  /**
   * Marks the field as generated by an AUTO_INCREMENT counter starting at 1. The flag only takes
   * effect on the primary key.
   */
  public Field autoIncrement() {
    return autoIncrement(1L);
  }

  public Field autoIncrement(long start) {
    Preconditions.checkArgument(type.isIntegral(), "AUTO_INCREMENT requires an integer type");
    Preconditions.checkArgument(start > 0, "AUTO_INCREMENT start must be positive");
    return new Field(
        name, type, length, nullable, primaryKey, true, start, defaultValue, comment);
  }

  /** Sets a constant default value. */
  public Field defaultValue(@Nullable Object value) {
    return defaultValue(() -> value);
  }

  /** Sets a producer evaluated each time a record without a value for this field is persisted. */
  public Field defaultValue(@Nonnull Supplier<?> producer) {
    return new Field(
        name, type, length, nullable, primaryKey, autoIncrement, autoIncrementStart,
        Objects.requireNonNull(producer), comment);
  }

  public Field comment(@Nullable String comment) {
    return new Field(
        name, type, length, nullable, primaryKey, autoIncrement, autoIncrementStart,
        defaultValue, comment);
  }

  @Nullable
  public String getName() {
    return name;
  }

  @Nonnull
  public FieldType getType() {
    return type;
  }

  @Nullable
  public Integer getLength() {
    return length;
  }

  public boolean isNullable() {
    return nullable;
  }

  public boolean isPrimaryKey() {
    return primaryKey;
  }

  public boolean isAutoIncrement() {
    return autoIncrement;
  }

  public long getAutoIncrementStart() {
    return autoIncrementStart;
  }

  @Nullable
  public String getComment() {
    return comment;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  /** Evaluates the default producer, or returns null when the field has none. */
  @Nullable
  public Object produceDefault() {
    return defaultValue == null ? null : defaultValue.get();
  }

  public Predicate eq(@Nullable Object value) {
    return value == null ? isNull() : Predicate.compare(this, Predicate.Operator.EQ, value);
  }

  public Predicate ne(@Nullable Object value) {
    return value == null ? isNotNull() : Predicate.compare(this, Predicate.Operator.NE, value);
  }

  public Predicate lt(@Nonnull Object value) {
    return Predicate.compare(this, Predicate.Operator.LT, value);
  }

  public Predicate le(@Nonnull Object value) {
    return Predicate.compare(this, Predicate.Operator.LE, value);
  }

  public Predicate gt(@Nonnull Object value) {
    return Predicate.compare(this, Predicate.Operator.GT, value);
  }

  public Predicate ge(@Nonnull Object value) {
    return Predicate.compare(this, Predicate.Operator.GE, value);
  }

  /** SQL LIKE match, with {@code %} and {@code _} wildcards. */
  public Predicate like(@Nonnull String pattern) {
    return Predicate.compare(this, Predicate.Operator.LIKE, pattern);
  }

  public Predicate in(@Nonnull Collection<?> values) {
    return Predicate.in(this, nonNullValues(values), false);
  }

  public Predicate notIn(@Nonnull Collection<?> values) {
    return Predicate.in(this, nonNullValues(values), true);
  }

  private ImmutableList<?> nonNullValues(Collection<?> values) {
    Preconditions.checkArgument(
        values.stream().noneMatch(Objects::isNull),
        "IN list for field `%s` must not contain null; use isNull()",
        name);
    return ImmutableList.copyOf(values);
  }

  public Predicate between(@Nonnull Object low, @Nonnull Object high) {
    return Predicate.between(this, low, high);
  }

  public Predicate isNull() {
    return Predicate.nullCheck(this, true);
  }

  public Predicate isNotNull() {
    return Predicate.nullCheck(this, false);
  }

  public Order asc() {
    return new Order(this, true);
  }

  public Order desc() {
    return new Order(this, false);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Field other = (Field) obj;
    return nullable == other.nullable
        && primaryKey == other.primaryKey
        && autoIncrement == other.autoIncrement
        && autoIncrementStart == other.autoIncrementStart
        && Objects.equals(name, other.name)
        && type == other.type
        && Objects.equals(length, other.length)
        && Objects.equals(defaultValue, other.defaultValue)
        && Objects.equals(comment, other.comment);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name, type, length, nullable, primaryKey, autoIncrement, autoIncrementStart,
        defaultValue, comment);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", name)
        .add("type", type)
        .add("length", length)
        .add("primaryKey", primaryKey ? Boolean.TRUE : null)
        .add("autoIncrement", autoIncrement ? Boolean.TRUE : null)
        .toString();
  }
}
