package com.trod.model;

import com.trod.driver.memory.MemoryDriver;

/** Typed model used across the tests, bound to an in-memory database that runs inline. */
public final class Person extends Model {

  public static final Database DB =
      new Database("test", new MemoryDriver(Runnable::run), Database.Config.defaults());

  public static final ModelClass<Person> MODEL =
      ModelClass.define("Person", Person::new)
          .database(DB)
          .table("person")
          .comment("people")
          .field("id", Field.bigint().primaryKey().autoIncrement())
          .field("name", Field.varchar(45).notNull())
          .field("email", Field.varchar(100))
          .field("age", Field.integer().defaultValue(18))
          .indexes(Index.unique("uk_email", "email"))
          .diagnostics(Diagnostics.silent())
          .register();

  public Person() {
    super(MODEL);
  }

  public static Person named(String name) {
    Person person = new Person();
    person.set("name", name);
    return person;
  }

  public Long getId() {
    Object id = get("id");
    return id == null ? null : ((Number) id).longValue();
  }

  public String getName() {
    return get("name", String.class);
  }
}
