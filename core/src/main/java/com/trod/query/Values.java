package com.trod.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Comparison rules for column values. Numbers compare by numeric value regardless of their boxed
 * type, so an {@code Integer} key written on insert matches the {@code Long} used to read it back.
 */
public final class Values {

  private Values() {
    // Utility class, no instances
  }

  /** Whether two non-SQL-NULL values are equal. */
  public static boolean equal(@Nullable Object a, @Nullable Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compare(a, b) == 0;
    }
    if (a instanceof byte[] && b instanceof byte[]) {
      return Arrays.equals((byte[]) a, (byte[]) b);
    }
    return Objects.equals(a, b);
  }

  /**
   * Orders two non-null values.
   *
   * @throws IllegalArgumentException if the values are not mutually comparable
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      if (!isFinite((Number) a) || !isFinite((Number) b)) {
        return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      }
      return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b));
    }
    if (a instanceof Comparable && a.getClass().isInstance(b)) {
      return ((Comparable) a).compareTo(b);
    }
    if (b instanceof Comparable && b.getClass().isInstance(a)) {
      return -((Comparable) b).compareTo(a);
    }
    throw new IllegalArgumentException(
        "Cannot compare " + a.getClass().getName() + " with " + b.getClass().getName());
  }

  /** Orders two values with SQL NULL sorting first. */
  public static int compareNullsFirst(@Nullable Object a, @Nullable Object b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    return compare(a, b);
  }

  /**
   * Normalizes a value used as a lookup key: integral numbers become {@code Long}, every other
   * value is returned unchanged.
   */
  @Nullable
  public static Object normalizeKey(@Nullable Object value) {
    if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      return ((BigInteger) value).longValueExact();
    }
    return value;
  }

  // NaN and the infinities have no BigDecimal form.
  private static boolean isFinite(Number number) {
    if (number instanceof Double || number instanceof Float) {
      return Double.isFinite(number.doubleValue());
    }
    return true;
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }
}
