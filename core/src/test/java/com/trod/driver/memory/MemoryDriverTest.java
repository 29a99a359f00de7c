package com.trod.driver.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableMap;
import com.trod.common.status.StatusCode;
import com.trod.driver.Alteration;
import com.trod.driver.DdlOptions;
import com.trod.driver.DriverException;
import com.trod.driver.TableInfo;
import com.trod.errors.DuplicateFieldNameException;
import com.trod.errors.UnknownFieldException;
import com.trod.model.Diagnostics;
import com.trod.model.Field;
import com.trod.model.Index;
import com.trod.model.Model;
import com.trod.model.ModelClass;
import com.trod.model.Person;
import com.trod.query.ExecutionOutcome;
import com.trod.query.FetchResult;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Round trips through a typed model bound to the in-memory driver. */
public class MemoryDriverTest {

  private static final Field ID = Person.MODEL.field("id");
  private static final Field NAME = Person.MODEL.field("name");
  private static final Field AGE = Person.MODEL.field("age");

  @BeforeEach
  void setUp() {
    Person.MODEL.dropTable(DdlOptions.safeMode()).join();
    Person.MODEL.createTable().join();
  }

  private static DriverException driverFailure(CompletableFuture<?> future) {
    CompletionException e = assertThrows(CompletionException.class, future::join);
    assertTrue(e.getCause() instanceof DriverException, String.valueOf(e.getCause()));
    return (DriverException) e.getCause();
  }

  private static List<String> names(FetchResult<Person> people) {
    return people.stream().map(Person::getName).collect(Collectors.toList());
  }

  @Test
  void testAddThenGet() {
    ExecutionOutcome outcome = Person.MODEL.add(Person.named("Alice")).execute().join();
    assertEquals(1, outcome.affected());
    assertEquals(1L, outcome.lastId());

    Person alice = Person.MODEL.get(outcome.lastId()).join();
    assertEquals("Alice", alice.getName());
    assertEquals(1L, alice.getId());
    assertEquals(18, alice.get("age"));
  }

  @Test
  void testMissReturnsUnpopulatedRecordOrEmptyResult() {
    Person nobody = Person.MODEL.select().where(NAME.eq("Nobody")).first().join();
    assertNotNull(nobody);
    assertNull(nobody.getPrimaryKeyValue());
    assertTrue(nobody.values().isEmpty());

    assertTrue(Person.MODEL.select().where(NAME.eq("Nobody")).all().join().isEmpty());
    assertEquals(Map.of(), Person.MODEL.select().where(NAME.eq("Nobody")).firstMap().join());
  }

  @Test
  void testInsertManyTuplesAndQuery() {
    ExecutionOutcome outcome =
        Person.MODEL
            .insertMany(
                List.of(List.of("Bob", 20), List.of("Herb", 30), List.of("Cleo", 25)), NAME, AGE)
            .execute()
            .join();
    assertEquals(3, outcome.affected());
    assertEquals(1L, outcome.lastId());

    assertEquals(
        List.of("Bob", "Cleo", "Herb"),
        names(Person.MODEL.select().orderBy(NAME.asc()).all().join()));
    assertEquals(
        List.of("Herb", "Cleo"),
        names(Person.MODEL.select().where(AGE.ge(25)).orderBy(AGE.desc()).all().join()));
    assertEquals(
        List.of("Cleo"),
        names(Person.MODEL.select().orderBy(AGE.asc()).offset(1).limit(1).all().join()));
    assertEquals(
        List.of("Bob", "Herb"),
        names(Person.MODEL.getMany(List.of(1L, 2L)).join()));
  }

  @Test
  void testProjectionAndDistinct() {
    Person.MODEL
        .insertMany(List.of(List.of("Bob", 20), List.of("Herb", 20), List.of("Cleo", 25)), NAME, AGE)
        .execute()
        .join();

    FetchResult<Map<String, Object>> ages =
        Person.MODEL.selectDistinct(AGE).orderBy(AGE.asc()).allMaps().join();
    assertEquals(List.of(Map.of("age", 20), Map.of("age", 25)), ages);

    Person projected = Person.MODEL.select(NAME).where(AGE.eq(25)).first().join();
    assertEquals("Cleo", projected.getName());
    assertFalse(projected.isSet("id"));
  }

  @Test
  void testInsertManyMappingsFillsMissingColumnsWithDefaults() {
    Person.MODEL
        .insertMany(
            List.of(
                ImmutableMap.of("name", "Bob"),
                ImmutableMap.of("name", "Herb", "age", 44)))
        .execute()
        .join();

    Map<String, Object> bob = Person.MODEL.select().where(NAME.eq("Bob")).firstMap().join();
    assertEquals(18, bob.get("age"));
    assertEquals(44, Person.MODEL.select().where(NAME.eq("Herb")).first().join().get("age"));
  }

  @Test
  void testAutoIncrementAdvancesPastExplicitKeys() {
    Person.MODEL.insert(Map.of("id", 10L, "name", "Ten")).execute().join();
    ExecutionOutcome next = Person.MODEL.add(Person.named("Eleven")).execute().join();
    assertEquals(11L, next.lastId());
  }

  @Test
  void testDuplicatePrimaryKeyFailsThroughTheFuture() {
    Person.MODEL.insert(Map.of("id", 1L, "name", "Alice")).execute().join();

    DriverException e =
        driverFailure(Person.MODEL.insert(Map.of("id", 1, "name", "Bob")).execute());
    assertEquals(StatusCode.ALREADY_EXISTS, e.getCode());
    assertEquals(1, Person.MODEL.show().rowCount());
  }

  @Test
  void testUniqueIndexViolation() {
    Person.MODEL.insert(Map.of("name", "Alice", "email", "a@example.com")).execute().join();

    DriverException e =
        driverFailure(
            Person.MODEL.insert(Map.of("name", "Alicia", "email", "a@example.com")).execute());
    assertEquals(StatusCode.ALREADY_EXISTS, e.getCode());
    assertTrue(e.getMessage().contains("uk_email"), e.getMessage());
  }

  @Test
  void testFailedBatchLeavesNoRows() {
    DriverException e =
        driverFailure(
            Person.MODEL
                .insertMany(
                    List.of(
                        ImmutableMap.of("name", "Bob", "email", "x@example.com"),
                        ImmutableMap.of("name", "Herb", "email", "x@example.com")))
                .execute());
    assertEquals(StatusCode.ALREADY_EXISTS, e.getCode());
    assertTrue(Person.MODEL.select().all().join().isEmpty());
  }

  @Test
  void testUniqueIndexOnDoubleColumnAcceptsNaN() {
    ModelClass<Model> readings =
        ModelClass.define("Reading")
            .database(Person.DB)
            .table("reading")
            .field("id", Field.bigint().primaryKey().autoIncrement())
            .field("value", Field.doublePrecision())
            .indexes(Index.unique("uk_value", "value"))
            .diagnostics(Diagnostics.silent())
            .register();
    readings.dropTable(DdlOptions.safeMode()).join();
    readings.createTable().join();

    readings.insert(Map.of("value", Double.NaN)).execute().join();
    readings.insert(Map.of("value", 1.0)).execute().join();
    readings.insert(Map.of("value", Double.POSITIVE_INFINITY)).execute().join();

    DriverException e = driverFailure(readings.insert(Map.of("value", Double.NaN)).execute());
    assertEquals(StatusCode.ALREADY_EXISTS, e.getCode());
    assertEquals(3, readings.show().rowCount());
    assertEquals(1, readings.select().where(readings.field("value").eq(1.0)).all().join().size());
  }

  @Test
  void testLimitZeroAppliesToFirst() {
    Person.MODEL.add(Person.named("Alice")).execute().join();

    Person none = Person.MODEL.select().limit(0).first().join();
    assertNull(none.getName());
    assertTrue(Person.MODEL.select().limit(0).firstMap().join().isEmpty());
    assertTrue(Person.MODEL.select().limit(0).all().join().isEmpty());
    assertEquals("Alice", Person.MODEL.select().limit(5).first().join().getName());
  }

  @Test
  void testNotNullColumn() {
    DriverException e = driverFailure(Person.MODEL.insert(Map.of("age", 3)).execute());
    assertEquals(StatusCode.INVALID_ARGUMENT, e.getCode());
  }

  @Test
  void testReplaceRemovesConflictingRows() {
    Person.MODEL.insert(Map.of("name", "Alice", "email", "a@example.com")).execute().join();
    Person.MODEL.insert(Map.of("name", "Bob", "email", "b@example.com")).execute().join();

    ExecutionOutcome outcome =
        Person.MODEL
            .replace(Map.of("id", 1L, "name", "Alicia", "email", "b@example.com"))
            .execute()
            .join();

    assertEquals(3, outcome.affected());
    assertNull(outcome.lastId());
    assertEquals(List.of("Alicia"), names(Person.MODEL.select().all().join()));
  }

  @Test
  void testUpdateAndDelete() {
    Person.MODEL
        .insertMany(List.of(List.of("Bob", 20), List.of("Herb", 30), List.of("Cleo", 25)), NAME, AGE)
        .execute()
        .join();

    ExecutionOutcome updated =
        Person.MODEL.update(Map.of("age", 21)).where(AGE.lt(26)).execute().join();
    assertEquals(2, updated.affected());
    assertEquals(
        List.of("Bob", "Cleo"),
        names(Person.MODEL.select().where(AGE.eq(21)).orderBy(ID.asc()).all().join()));

    ExecutionOutcome deleted = Person.MODEL.delete().where(NAME.ne("Herb")).execute().join();
    assertEquals(2, deleted.affected());
    assertEquals(List.of("Herb"), names(Person.MODEL.select().all().join()));

    assertEquals(1, Person.MODEL.delete().execute().join().affected());
  }

  @Test
  void testCreateAndDropHonorSafeMode() {
    assertEquals(StatusCode.ALREADY_EXISTS, driverFailure(Person.MODEL.createTable()).getCode());
    assertEquals(0, Person.MODEL.createTable(DdlOptions.safeMode()).join().affected());

    Person.MODEL.dropTable().join();
    assertEquals(StatusCode.NOT_FOUND, driverFailure(Person.MODEL.dropTable()).getCode());
    assertEquals(0, Person.MODEL.dropTable(DdlOptions.safeMode()).join().affected());
    assertEquals(
        StatusCode.NOT_FOUND, driverFailure(Person.MODEL.select().all()).getCode());
  }

  @Test
  void testShowDescribesStoredTable() {
    Person.MODEL.add(Person.named("Alice")).execute().join();

    TableInfo info = Person.MODEL.show();

    assertEquals("person", info.name());
    assertEquals(List.of("id", "name", "email", "age"), info.columnNames());
    assertEquals(List.of("uk_email"), info.indexes());
    assertEquals(1, info.rowCount());
    assertEquals("people", info.comment());
    assertTrue(info.columns().get(0).primaryKey());
    assertFalse(info.columns().get(1).nullable());
    assertTrue(info.toJson().contains("\"name\":\"person\""), info.toJson());
  }

  @Test
  void testAlterAddsAndDropsColumns() {
    Person.MODEL.add(Person.named("Alice")).execute().join();

    Person.MODEL.alter(
        Alteration.builder()
            .addColumn("city", Field.varchar(40).defaultValue("Oslo"))
            .dropColumn("email")
            .addIndex(Index.of("ix_age", "age"))
            .build());

    TableInfo info = Person.MODEL.show();
    assertEquals(List.of("id", "name", "age", "city"), info.columnNames());
    assertEquals(List.of("ix_age"), info.indexes());
    assertEquals("Alice", Person.MODEL.select(NAME).first().join().getName());
  }

  @Test
  void testAlterIsCheckedAgainstRegisteredFields() {
    assertThrows(
        DuplicateFieldNameException.class,
        () -> Person.MODEL.alter(Alteration.builder().addColumn("name", Field.text()).build()));
    assertThrows(
        UnknownFieldException.class,
        () -> Person.MODEL.alter(Alteration.builder().dropColumn("nickname").build()));
    assertThrows(
        IllegalArgumentException.class,
        () -> Person.MODEL.alter(Alteration.builder().dropColumn("id").build()));
  }

  @Test
  void testAlterFailureFromDriverIsThrownDirectly() {
    DriverException e =
        assertThrows(
            DriverException.class,
            () -> Person.MODEL.alter(Alteration.builder().dropIndex("ix_missing").build()));
    assertEquals(StatusCode.NOT_FOUND, e.getCode());
  }

  @Test
  void testSelectCannotBeExecutedAsWrite() {
    DriverException e =
        driverFailure(Person.DB.getDriver().execute(Person.MODEL.select()));
    assertEquals(StatusCode.INVALID_ARGUMENT, e.getCode());
  }
}
