package com.trod.query;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.trod.model.Field;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A WHERE condition. Predicates are immutable values built from {@link Field} handles and combined
 * with {@link #and}, {@link #or} and {@link #not}; building them has no side effects.
 *
 * <p>{@link #matches} evaluates a predicate against one row for drivers that filter in process.
 * A comparison involving a NULL column value does not match.
 */
public abstract class Predicate {

  /** Binary comparison operators. */
  public enum Operator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIKE("LIKE");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  private Predicate() {}

  public static Predicate compare(@Nonnull Field field, @Nonnull Operator op, @Nonnull Object value) {
    return new Comparison(named(field), op, Objects.requireNonNull(value));
  }

  public static Predicate in(@Nonnull Field field, @Nonnull ImmutableList<?> values, boolean negated) {
    return new In(named(field), values, negated);
  }

  public static Predicate between(@Nonnull Field field, @Nonnull Object low, @Nonnull Object high) {
    return new Between(named(field), Objects.requireNonNull(low), Objects.requireNonNull(high));
  }

  public static Predicate nullCheck(@Nonnull Field field, boolean isNull) {
    return new NullCheck(named(field), isNull);
  }

  /** Returns a predicate matching rows that satisfy both this and {@code other}. */
  public Predicate and(@Nonnull Predicate other) {
    return new Junction(true, ImmutableList.of(this, other));
  }

  /** Returns a predicate matching rows that satisfy this or {@code other}. */
  public Predicate or(@Nonnull Predicate other) {
    return new Junction(false, ImmutableList.of(this, other));
  }

  public Predicate not() {
    return new Not(this);
  }

  /** Evaluates this predicate against a row keyed by column name. */
  public abstract boolean matches(@Nonnull Map<String, ?> row);

  /** Names of the fields this predicate reads. */
  public abstract ImmutableSet<String> fieldNames();

  private static String named(Field field) {
    Preconditions.checkArgument(
        field.getName() != null, "Predicates can only be built from registered fields");
    return field.getName();
  }

  private static String literal(@Nullable Object value) {
    if (value instanceof CharSequence) {
      return "'" + value + "'";
    }
    return String.valueOf(value);
  }

  /** {@code field <op> value}. */
  public static final class Comparison extends Predicate {
    private final String field;
    private final Operator op;
    private final Object value;

    private Comparison(String field, Operator op, Object value) {
      this.field = field;
      this.op = op;
      this.value = value;
    }

    public String getField() {
      return field;
    }

    public Operator getOperator() {
      return op;
    }

    public Object getValue() {
      return value;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      Object actual = row.get(field);
      if (actual == null) {
        return false;
      }
      switch (op) {
        case EQ:
          return Values.equal(actual, value);
        case NE:
          return !Values.equal(actual, value);
        case LT:
          return Values.compare(actual, value) < 0;
        case LE:
          return Values.compare(actual, value) <= 0;
        case GT:
          return Values.compare(actual, value) > 0;
        case GE:
          return Values.compare(actual, value) >= 0;
        case LIKE:
          return likePattern(String.valueOf(value)).matcher(String.valueOf(actual)).matches();
        default:
          throw new IllegalStateException("Unhandled operator " + op);
      }
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      return ImmutableSet.of(field);
    }

    @Override
    public String toString() {
      return "`" + field + "` " + op.symbol() + " " + literal(value);
    }

    private static Pattern likePattern(String like) {
      StringBuilder regex = new StringBuilder();
      for (char c : like.toCharArray()) {
        if (c == '%') {
          regex.append(".*");
        } else if (c == '_') {
          regex.append('.');
        } else {
          regex.append(Pattern.quote(String.valueOf(c)));
        }
      }
      return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
  }

  /** {@code field [NOT] IN (values)}. */
  public static final class In extends Predicate {
    private final String field;
    private final ImmutableList<?> values;
    private final boolean negated;

    private In(String field, ImmutableList<?> values, boolean negated) {
      this.field = field;
      this.values = values;
      this.negated = negated;
    }

    public String getField() {
      return field;
    }

    public ImmutableList<?> getValues() {
      return values;
    }

    public boolean isNegated() {
      return negated;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      Object actual = row.get(field);
      if (actual == null) {
        return false;
      }
      boolean found = values.stream().anyMatch(v -> Values.equal(actual, v));
      return negated != found;
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      return ImmutableSet.of(field);
    }

    @Override
    public String toString() {
      return "`" + field + "`" + (negated ? " NOT IN (" : " IN (")
          + Joiner.on(", ").join(values.stream().map(Predicate::literal).iterator()) + ")";
    }
  }

  /** {@code field BETWEEN low AND high}, bounds inclusive. */
  public static final class Between extends Predicate {
    private final String field;
    private final Object low;
    private final Object high;

    private Between(String field, Object low, Object high) {
      this.field = field;
      this.low = low;
      this.high = high;
    }

    public String getField() {
      return field;
    }

    public Object getLow() {
      return low;
    }

    public Object getHigh() {
      return high;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      Object actual = row.get(field);
      return actual != null
          && Values.compare(actual, low) >= 0
          && Values.compare(actual, high) <= 0;
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      return ImmutableSet.of(field);
    }

    @Override
    public String toString() {
      return "`" + field + "` BETWEEN " + literal(low) + " AND " + literal(high);
    }
  }

  /** {@code field IS [NOT] NULL}. */
  public static final class NullCheck extends Predicate {
    private final String field;
    private final boolean isNull;

    private NullCheck(String field, boolean isNull) {
      this.field = field;
      this.isNull = isNull;
    }

    public String getField() {
      return field;
    }

    public boolean isNullCheck() {
      return isNull;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      return (row.get(field) == null) == isNull;
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      return ImmutableSet.of(field);
    }

    @Override
    public String toString() {
      return "`" + field + "` IS " + (isNull ? "NULL" : "NOT NULL");
    }
  }

  /** AND / OR of two or more predicates. */
  public static final class Junction extends Predicate {
    private final boolean conjunction;
    private final ImmutableList<Predicate> operands;

    private Junction(boolean conjunction, ImmutableList<Predicate> operands) {
      this.conjunction = conjunction;
      this.operands = operands;
    }

    public boolean isConjunction() {
      return conjunction;
    }

    public ImmutableList<Predicate> getOperands() {
      return operands;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      if (conjunction) {
        return operands.stream().allMatch(p -> p.matches(row));
      }
      return operands.stream().anyMatch(p -> p.matches(row));
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      ImmutableSet.Builder<String> names = ImmutableSet.builder();
      operands.forEach(p -> names.addAll(p.fieldNames()));
      return names.build();
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(conjunction ? " AND " : " OR ").join(operands) + ")";
    }
  }

  /** NOT of a predicate. */
  public static final class Not extends Predicate {
    private final Predicate operand;

    private Not(Predicate operand) {
      this.operand = operand;
    }

    public Predicate getOperand() {
      return operand;
    }

    @Override
    public boolean matches(Map<String, ?> row) {
      return !operand.matches(row);
    }

    @Override
    public ImmutableSet<String> fieldNames() {
      return operand.fieldNames();
    }

    @Override
    public String toString() {
      return "NOT " + operand;
    }
  }
}
