package com.trod.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import javax.annotation.Nonnull;

/**
 * A secondary index declared on a table.
 *
 * @param name the index name
 * @param columns the indexed field names, in key order
 * @param unique whether the index enforces uniqueness
 */
public record Index(@Nonnull String name, @Nonnull ImmutableList<String> columns, boolean unique) {

  public Index {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Index name is required");
    Preconditions.checkArgument(!columns.isEmpty(), "Index `%s` has no columns", name);
  }

  public static Index of(String name, String... columns) {
    return new Index(name, ImmutableList.copyOf(columns), false);
  }

  public static Index of(String name, Field... fields) {
    return new Index(name, names(fields), false);
  }

  public static Index unique(String name, String... columns) {
    return new Index(name, ImmutableList.copyOf(columns), true);
  }

  public static Index unique(String name, Field... fields) {
    return new Index(name, names(fields), true);
  }

  private static ImmutableList<String> names(Field... fields) {
    for (Field field : fields) {
      Preconditions.checkArgument(field.getName() != null, "Only named fields can be indexed");
    }
    return Arrays.stream(fields).map(Field::getName).collect(ImmutableList.toImmutableList());
  }
}
