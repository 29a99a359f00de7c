package com.trod.driver;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.trod.model.Field;
import com.trod.model.Index;
import javax.annotation.Nonnull;

/**
 * A schema change applied by ALTER TABLE.
 *
 * @param addColumns named fields to add
 * @param dropColumns names of columns to drop
 * @param addIndexes indexes to add
 * @param dropIndexes names of indexes to drop
 */
public record Alteration(
    @Nonnull ImmutableList<Field> addColumns,
    @Nonnull ImmutableList<String> dropColumns,
    @Nonnull ImmutableList<Index> addIndexes,
    @Nonnull ImmutableList<String> dropIndexes) {

  public Alteration {
    Preconditions.checkArgument(
        !(addColumns.isEmpty()
            && dropColumns.isEmpty()
            && addIndexes.isEmpty()
            && dropIndexes.isEmpty()),
        "An alteration must change something");
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link Alteration}. */
  public static final class Builder {
    private final ImmutableList.Builder<Field> addColumns = ImmutableList.builder();
    private final ImmutableList.Builder<String> dropColumns = ImmutableList.builder();
    private final ImmutableList.Builder<Index> addIndexes = ImmutableList.builder();
    private final ImmutableList.Builder<String> dropIndexes = ImmutableList.builder();

    private Builder() {}

    public Builder addColumn(@Nonnull String name, @Nonnull Field field) {
      addColumns.add(field.named(name));
      return this;
    }

    public Builder dropColumn(@Nonnull String name) {
      dropColumns.add(name);
      return this;
    }

    public Builder addIndex(@Nonnull Index index) {
      addIndexes.add(index);
      return this;
    }

    public Builder dropIndex(@Nonnull String name) {
      dropIndexes.add(name);
      return this;
    }

    public Alteration build() {
      return new Alteration(
          addColumns.build(), dropColumns.build(), addIndexes.build(), dropIndexes.build());
    }
  }
}
