package com.trod.model;

import com.trod.errors.DecodeException;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * The trusted write path used to build records from driver rows. Columns are written as they
 * come, including an AUTO_INCREMENT primary key.
 */
public final class Loader {

  private Loader() {
    // Utility class, no instances
  }

  /**
   * Creates a record of {@code modelClass} holding the columns of {@code row}.
   *
   * @throws DecodeException if a column name is not a string
   */
  @Nonnull
  public static <R extends Model> R populate(
      @Nonnull ModelClass<R> modelClass, @Nonnull Map<?, ?> row) {
    R record = modelClass.newInstance();
    for (Map.Entry<?, ?> column : row.entrySet()) {
      if (!(column.getKey() instanceof String)) {
        throw new DecodeException("Column names must be strings, got " + column.getKey());
      }
      record.load((String) column.getKey(), column.getValue());
    }
    return record;
  }
}
