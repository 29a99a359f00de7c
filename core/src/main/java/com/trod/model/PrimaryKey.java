package com.trod.model;

import javax.annotation.Nonnull;

/**
 * The primary key of a table.
 *
 * @param field the primary-key field
 * @param auto whether the key is generated by an AUTO_INCREMENT counter
 * @param autoIncrementStart first value handed out by the counter, meaningful only when auto
 */
public record PrimaryKey(@Nonnull Field field, boolean auto, long autoIncrementStart) {

  @Nonnull
  public String name() {
    return field.getName();
  }
}
