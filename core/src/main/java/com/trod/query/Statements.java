package com.trod.query;

import com.trod.errors.UnknownFieldException;
import com.trod.model.Field;
import com.trod.model.Table;

/** Checks shared by the statement builders. */
final class Statements {

  private Statements() {
    // Utility class, no instances
  }

  /** Every field read by {@code predicate} must be declared by {@code table}. */
  static void checkFields(Table table, Predicate predicate) {
    for (String name : predicate.fieldNames()) {
      if (!table.hasField(name)) {
        throw new UnknownFieldException(table.getName(), name);
      }
    }
  }

  /** The field must be a registered field of {@code table}. */
  static Field checkField(Table table, Field field) {
    if (field.getName() == null || !table.hasField(field.getName())) {
      throw new UnknownFieldException(table.getName(), String.valueOf(field.getName()));
    }
    return field;
  }
}
