package com.trod.query;

import com.trod.model.Field;
import javax.annotation.Nonnull;

/**
 * One ORDER BY term.
 *
 * @param field the sort field
 * @param ascending true for ascending order
 */
public record Order(@Nonnull Field field, boolean ascending) {

  @Override
  public String toString() {
    return field.getName() + (ascending ? " ASC" : " DESC");
  }
}
