package com.trod.driver;

import com.google.common.collect.ImmutableList;
import com.trod.model.FieldType;
import com.trod.util.JsonUtil;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Description of a stored table, as reported by a driver.
 *
 * @param name the table name
 * @param columns the stored columns in order
 * @param indexes names of the stored indexes
 * @param rowCount number of stored rows, or -1 when the driver does not know
 * @param comment the table comment
 */
public record TableInfo(
    @Nonnull String name,
    @Nonnull ImmutableList<Column> columns,
    @Nonnull ImmutableList<String> indexes,
    long rowCount,
    @Nullable String comment) {

  /**
   * One stored column.
   *
   * @param name the column name
   * @param type the declared type
   * @param nullable whether NULL is accepted
   * @param primaryKey whether the column is the primary key
   */
  public record Column(
      @Nonnull String name, @Nonnull FieldType type, boolean nullable, boolean primaryKey) {}

  @Nonnull
  public ImmutableList<String> columnNames() {
    return columns.stream().map(Column::name).collect(ImmutableList.toImmutableList());
  }

  @Nonnull
  public String toJson() {
    return JsonUtil.toJson(this);
  }
}
