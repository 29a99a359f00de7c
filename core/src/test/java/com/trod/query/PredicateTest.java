package com.trod.query;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableSet;
import com.trod.model.Field;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class PredicateTest {

  private static final Field NAME = Field.varchar(45).named("name");
  private static final Field AGE = Field.integer().named("age");

  private static Map<String, Object> row(String name, Integer age) {
    Map<String, Object> row = new HashMap<>();
    row.put("name", name);
    row.put("age", age);
    return row;
  }

  @Test
  void testComparisonsAreNumericAcrossBoxedTypes() {
    Map<String, Object> bob = row("Bob", 20);
    assertTrue(AGE.eq(20L).matches(bob));
    assertTrue(AGE.ge(20).matches(bob));
    assertTrue(AGE.lt(20.5).matches(bob));
    assertFalse(AGE.gt(20).matches(bob));
    assertTrue(AGE.ne(21).matches(bob));
  }

  @Test
  void testNullColumnNeverMatchesComparison() {
    Map<String, Object> unknown = row("Bob", null);
    assertFalse(AGE.gt(0).matches(unknown));
    assertFalse(AGE.ne(0).matches(unknown));
    assertFalse(AGE.in(List.of(1, 2)).matches(unknown));
    assertFalse(AGE.notIn(List.of(1, 2)).matches(unknown));
    assertTrue(AGE.isNull().matches(unknown));
  }

  @Test
  void testEqualityWithNullIsNullCheck() {
    assertTrue(AGE.eq(null) instanceof Predicate.NullCheck);
    assertTrue(AGE.eq(null).matches(row("Bob", null)));
    assertTrue(AGE.ne(null).matches(row("Bob", 1)));
  }

  @Test
  void testLikeIsCaseSensitive() {
    Map<String, Object> herb = row("Herb", 30);
    assertTrue(NAME.like("H%").matches(herb));
    assertTrue(NAME.like("H_rb").matches(herb));
    assertFalse(NAME.like("h%").matches(herb));
    assertFalse(NAME.like("H.rb").matches(herb));
  }

  @Test
  void testInListRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> AGE.in(Arrays.asList(1, null)));
    assertThrows(IllegalArgumentException.class, () -> AGE.notIn(Arrays.asList(null, 2)));
  }

  @Test
  void testNonFiniteDoublesCompareWithoutFailing() {
    Field score = Field.doublePrecision().named("score");
    Map<String, Object> nan = new HashMap<>();
    nan.put("score", Double.NaN);
    assertTrue(score.eq(Double.NaN).matches(nan));
    assertFalse(score.eq(1).matches(nan));
    assertTrue(score.lt(Double.POSITIVE_INFINITY).matches(Map.of("score", 1.5)));
    assertEquals(0, Values.compare(Double.NaN, Float.NaN));
    assertTrue(Values.compare(Double.NEGATIVE_INFINITY, Long.MIN_VALUE) < 0);
  }

  @Test
  void testInAndBetween() {
    Map<String, Object> herb = row("Herb", 30);
    assertTrue(NAME.in(List.of("Bob", "Herb")).matches(herb));
    assertTrue(NAME.notIn(List.of("Bob")).matches(herb));
    assertTrue(AGE.between(30, 40).matches(herb));
    assertTrue(AGE.between(20, 30).matches(herb));
    assertFalse(AGE.between(31, 40).matches(herb));
  }

  @Test
  void testCombinators() {
    Predicate adultBob = NAME.eq("Bob").and(AGE.ge(18));
    assertTrue(adultBob.matches(row("Bob", 20)));
    assertFalse(adultBob.matches(row("Bob", 10)));
    assertTrue(NAME.eq("Bob").or(NAME.eq("Herb")).matches(row("Herb", 1)));
    assertTrue(NAME.eq("Bob").not().matches(row("Herb", 1)));
    assertEquals(ImmutableSet.of("name", "age"), adultBob.fieldNames());
  }

  @Test
  void testIncomparableValues() {
    assertThrows(IllegalArgumentException.class, () -> AGE.gt("ten").matches(row("Bob", 20)));
  }

  @Test
  void testUnnamedFieldsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Field.integer().eq(1));
  }

  @Test
  void testToString() {
    assertEquals("(`name` = 'Bob' AND `age` >= 18)", NAME.eq("Bob").and(AGE.ge(18)).toString());
    assertEquals("`age` IN (1, 2)", AGE.in(List.of(1, 2)).toString());
    assertEquals("`age` IS NULL", AGE.isNull().toString());
  }
}
