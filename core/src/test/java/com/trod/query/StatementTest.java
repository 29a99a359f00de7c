package com.trod.query;

import static org.junit.jupiter.api.Assertions.*;

import com.trod.errors.InvalidRowException;
import com.trod.errors.UnknownFieldException;
import com.trod.model.Field;
import com.trod.model.Person;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Building statements performs no I/O and never mutates an existing statement. */
public class StatementTest {

  private static final Field NAME = Person.MODEL.field("name");
  private static final Field AGE = Person.MODEL.field("age");

  @Test
  void testSelectDefaultsToEveryField() {
    Select<Person> select = Person.MODEL.select();
    assertEquals(Person.MODEL.getTable().getFields(), select.getColumns());
    assertFalse(select.isDistinct());
    assertTrue(select.getWhere().isEmpty());
    assertEquals(OptionalInt.empty(), select.getLimit());
    assertEquals(0, select.getOffset());
    assertFalse(select.isSingle());
  }

  @Test
  void testSelectChainingReturnsNewStatements() {
    Select<Person> base = Person.MODEL.select(NAME);
    Select<Person> filtered = base.where(AGE.gt(18));
    Select<Person> refined = filtered.where(NAME.like("A%")).orderBy(AGE.desc()).limit(5).offset(2);

    assertTrue(base.getWhere().isEmpty());
    assertEquals("`age` > 18", filtered.getWhere().orElseThrow().toString());
    assertTrue(refined.getWhere().orElseThrow() instanceof Predicate.Junction);
    assertEquals(List.of(AGE.desc()), refined.getOrderBy());
    assertEquals(OptionalInt.of(5), refined.getLimit());
    assertEquals(2, refined.getOffset());
    assertEquals(OptionalInt.empty(), filtered.getLimit());
    assertEquals(List.of(NAME), refined.getColumns());
  }

  @Test
  void testSelectDistinct() {
    assertTrue(Person.MODEL.selectDistinct(AGE).isDistinct());
  }

  @Test
  void testSelectRejectsForeignFields() {
    Field other = Field.integer().named("salary");
    assertThrows(UnknownFieldException.class, () -> Person.MODEL.select(other));
    assertThrows(UnknownFieldException.class, () -> Person.MODEL.select().where(other.eq(1)));
    assertThrows(UnknownFieldException.class, () -> Person.MODEL.select().orderBy(other.asc()));
    assertThrows(IllegalArgumentException.class, () -> Person.MODEL.select().limit(-1));
  }

  @Test
  void testUpdateOrdersValuesByDeclaration() {
    Update update = Person.MODEL.update(Map.of("age", 40, "name", "Bob"));
    assertEquals(List.of("name", "age"), List.copyOf(update.getValues().keySet()));

    Update restricted = update.where(NAME.eq("Bob"));
    assertTrue(update.getWhere().isEmpty());
    assertTrue(restricted.getWhere().isPresent());
  }

  @Test
  void testUpdateValidation() {
    assertThrows(InvalidRowException.class, () -> Person.MODEL.update(Map.of()));
    assertThrows(UnknownFieldException.class, () -> Person.MODEL.update(Map.of("nickname", "B")));
  }

  @Test
  void testDeleteWhereCombinesWithAnd() {
    Delete delete = Person.MODEL.delete().where(NAME.eq("Bob")).where(AGE.lt(30));
    Predicate where = delete.getWhere().orElseThrow();
    assertTrue(where instanceof Predicate.Junction);
    assertTrue(((Predicate.Junction) where).isConjunction());
  }

  @Test
  void testInsertShapes() {
    Insert fromTuples =
        Person.MODEL.insertMany(List.of(List.of("Bob", 20), List.of("Herb", 30)), NAME, AGE);
    assertEquals(List.of("name", "age"), fromTuples.getRows().getColumns());
    assertEquals(2, fromTuples.getRows().size());

    Insert fromRecord = Person.MODEL.add(Person.named("Alice"));
    assertEquals(List.of("name", "age"), fromRecord.getRows().getColumns());
    assertEquals(List.of("Alice", 18), fromRecord.getRows().getRows().get(0));
  }

  @Test
  void testStatementsDispatchToVisitor() {
    StatementVisitor<String> names =
        new StatementVisitor<>() {
          @Override
          public String visitSelect(Select<?> select) {
            return "select";
          }

          @Override
          public String visitInsert(Insert insert) {
            return "insert";
          }

          @Override
          public String visitReplace(Replace replace) {
            return "replace";
          }

          @Override
          public String visitUpdate(Update update) {
            return "update";
          }

          @Override
          public String visitDelete(Delete delete) {
            return "delete";
          }
        };

    assertEquals("select", Person.MODEL.select().accept(names));
    assertEquals("insert", Person.MODEL.insert(Map.of("name", "Al")).accept(names));
    assertEquals("replace", Person.MODEL.replace(Map.of("name", "Al")).accept(names));
    assertEquals("update", Person.MODEL.update(Map.of("name", "Al")).accept(names));
    assertEquals("delete", Person.MODEL.delete().accept(names));
  }
}
