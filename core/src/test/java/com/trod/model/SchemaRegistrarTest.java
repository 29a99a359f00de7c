package com.trod.model;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.trod.common.status.StatusCode;
import com.trod.driver.memory.MemoryDriver;
import com.trod.errors.DuplicateFieldNameException;
import com.trod.errors.DuplicatePrimaryKeyException;
import com.trod.errors.InvalidFieldTypeException;
import com.trod.errors.NoPrimaryKeyException;
import com.trod.errors.TrodException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SchemaRegistrarTest {

  private List<String> notices;
  private Diagnostics sink;

  @BeforeEach
  void setUp() {
    notices = new ArrayList<>();
    sink = notices::add;
  }

  private static Map<String, Object> declarations(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  @Test
  void testFieldsAreNamedAfterTheirKeysInDeclarationOrder() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations(
                "table", "person",
                "id", Field.bigint().primaryKey().autoIncrement(),
                "name", Field.varchar(45),
                "age", Field.integer()),
            sink);

    assertEquals("person", table.getName());
    assertEquals(List.of("id", "name", "age"), table.getColumns());
    assertEquals("id", table.getPrimaryKey().name());
    assertTrue(table.getPrimaryKey().auto());
    assertEquals(FieldType.VARCHAR, table.field("name").getType());
    assertTrue(table.getDatabase().isEmpty());
    assertTrue(notices.isEmpty());
  }

  @Test
  void testExplicitlyNamedFieldKeepsItsName() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations(
                "table", "person",
                "id", Field.bigint().primaryKey(),
                "fullName", Field.varchar(45).named("full_name")),
            sink);

    assertEquals(List.of("id", "full_name"), table.getColumns());
    assertFalse(table.hasField("fullName"));
  }

  @Test
  void testImplicitTableNameIsDerivedAndReported() {
    Table table =
        SchemaRegistrar.register(
            "Person", declarations("id", Field.bigint().primaryKey().autoIncrement()), sink);

    assertEquals("person", table.getName());
    assertEquals(1, notices.size());
    assertTrue(notices.get(0).contains("`person`"), notices.get(0));
  }

  @Test
  void testImplicitTableNameNoticeCanBeDisabled() {
    Database db =
        new Database("test", new MemoryDriver(), new Database.Config("id", false));
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations("database", db, "id", Field.bigint().primaryKey().autoIncrement()),
            sink);

    assertEquals("person", table.getName());
    assertSame(db, table.getDatabase().orElseThrow());
    assertTrue(notices.isEmpty());
  }

  @Test
  void testUnconventionalAutoIncrementKeyIsReported() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations("table", "person", "uid", Field.bigint().primaryKey().autoIncrement()),
            sink);

    assertEquals("uid", table.getPrimaryKey().name());
    assertEquals(1, notices.size());
    assertTrue(notices.get(0).contains("`id` instead of `uid`"), notices.get(0));
  }

  @Test
  void testFailingDiagnosticsSinkDoesNotFailRegistration() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations("id", Field.bigint().primaryKey()),
            message -> {
              throw new IllegalStateException("sink is broken");
            });

    assertEquals("person", table.getName());
  }

  @Test
  void testDuplicatePrimaryKey() {
    DuplicatePrimaryKeyException e =
        assertThrows(
            DuplicatePrimaryKeyException.class,
            () ->
                SchemaRegistrar.register(
                    "Person",
                    declarations(
                        "table", "person",
                        "id", Field.bigint().primaryKey(),
                        "uuid", Field.varchar(36).primaryKey()),
                    sink));
    assertTrue(e.getMessage().contains("`uuid`"), e.getMessage());
    assertEquals(StatusCode.INVALID_ARGUMENT, e.getCode());
  }

  @Test
  void testNoPrimaryKey() {
    NoPrimaryKeyException e =
        assertThrows(
            NoPrimaryKeyException.class,
            () ->
                SchemaRegistrar.register(
                    "Person", declarations("table", "person", "name", Field.text()), sink));
    assertTrue(e.getMessage().contains("`person`"), e.getMessage());
  }

  @Test
  void testNonFieldValueIsRejected() {
    assertThrows(
        InvalidFieldTypeException.class,
        () ->
            SchemaRegistrar.register(
                "Person",
                declarations("table", "person", "id", Field.bigint().primaryKey(), "name", 42),
                sink));
  }

  @Test
  void testPassThroughKeyAcceptsAnyValue() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations(
                "table", "person", "doc", "A person.", "id", Field.bigint().primaryKey()),
            sink);

    assertEquals(List.of("id"), table.getColumns());
  }

  @Test
  void testReservedKeyWithWrongTypeIsRejected() {
    assertThrows(
        InvalidFieldTypeException.class,
        () ->
            SchemaRegistrar.register(
                "Person", declarations("table", 42, "id", Field.bigint().primaryKey()), sink));
  }

  @Test
  void testDuplicateFieldName() {
    assertThrows(
        DuplicateFieldNameException.class,
        () ->
            SchemaRegistrar.register(
                "Person",
                declarations(
                    "table", "person",
                    "id", Field.bigint().primaryKey(),
                    "name", Field.varchar(10),
                    "alias", Field.varchar(10).named("name")),
                sink));
  }

  @Test
  void testIndexesMustReferenceDeclaredFields() {
    Table table =
        SchemaRegistrar.register(
            "Person",
            declarations(
                "table", "person",
                "id", Field.bigint().primaryKey(),
                "email", Field.varchar(100),
                "indexes", ImmutableList.of(Index.unique("uk_email", "email"))),
            sink);
    assertEquals(1, table.getIndexes().size());
    assertTrue(table.getIndexes().get(0).unique());

    TrodException e =
        assertThrows(
            InvalidFieldTypeException.class,
            () ->
                SchemaRegistrar.register(
                    "Person",
                    declarations(
                        "table", "person",
                        "id", Field.bigint().primaryKey(),
                        "indexes", ImmutableList.of(Index.of("ix_email", "email"))),
                    sink));
    assertTrue(e.getMessage().contains("`email`"), e.getMessage());
  }

  @Test
  void testInputDeclarationsAreNotModified() {
    Map<String, Object> declarations =
        declarations("table", "person", "id", Field.bigint().primaryKey());
    SchemaRegistrar.register("Person", declarations, sink);

    assertEquals(2, declarations.size());
    assertEquals("person", declarations.get("table"));
  }
}
