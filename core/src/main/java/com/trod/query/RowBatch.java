package com.trod.query;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.trod.errors.InvalidRowException;
import com.trod.errors.UnknownFieldException;
import com.trod.model.Field;
import com.trod.model.Table;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The canonical payload of an insert or replace: a column list and a matrix of row values, each
 * row aligned with the column list.
 *
 * <p>Three input shapes are accepted:
 *
 * <ul>
 *   <li>one mapping: a single row whose keys are the columns;
 *   <li>a list of mappings: the columns are the union of all keys, and a row lacking a column
 *       holds {@code null} for it;
 *   <li>a list of positional tuples with an explicit column list of the same arity.
 * </ul>
 *
 * <p>When a {@link Table} is supplied, mapping keys must be declared fields and the columns follow
 * the table's declaration order; without one they keep the order in which keys are first seen.
 */
public final class RowBatch {

  private final ImmutableList<String> columns;
  private final ImmutableList<List<Object>> rows;

  private RowBatch(ImmutableList<String> columns, ImmutableList<List<Object>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /** One row from a mapping, columns in key order. */
  public static RowBatch of(@Nonnull Map<String, ?> row) {
    return ofMaps(null, List.of(row));
  }

  /** One row from a mapping, columns in the table's declaration order. */
  public static RowBatch of(@Nonnull Table table, @Nonnull Map<String, ?> row) {
    return ofMaps(table, List.of(row));
  }

  /** Rows from mappings, columns in first-seen key order. */
  public static RowBatch ofMaps(@Nonnull List<? extends Map<String, ?>> maps) {
    return ofMaps(null, maps);
  }

  /**
   * Rows from mappings.
   *
   * @param table when not null, keys are checked against it and columns follow its field order
   * @param maps the rows
   * @throws InvalidRowException if {@code maps} is empty
   * @throws UnknownFieldException if a key is not a field of {@code table}
   */
  public static RowBatch ofMaps(@Nullable Table table, @Nonnull List<? extends Map<String, ?>> maps) {
    if (maps.isEmpty()) {
      throw new InvalidRowException("No rows given");
    }
    Set<String> seen = new LinkedHashSet<>();
    for (Map<String, ?> map : maps) {
      if (map == null) {
        throw new InvalidRowException("Rows must not be null");
      }
      for (String key : map.keySet()) {
        if (table != null && !table.hasField(key)) {
          throw new UnknownFieldException(table.getName(), key);
        }
        seen.add(key);
      }
    }

    ImmutableList<String> columns;
    if (table == null) {
      columns = ImmutableList.copyOf(seen);
    } else {
      columns =
          table.getColumns().stream()
              .filter(seen::contains)
              .collect(ImmutableList.toImmutableList());
    }

    ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
    for (Map<String, ?> map : maps) {
      List<Object> values = new ArrayList<>(columns.size());
      for (String column : columns) {
        values.add(map.get(column));
      }
      rows.add(Collections.unmodifiableList(values));
    }
    return new RowBatch(columns, rows.build());
  }

  /**
   * Rows from positional tuples.
   *
   * @throws InvalidRowException if the column list is empty or repeats a column, or a tuple's
   *     arity differs from the column count
   */
  public static RowBatch ofTuples(
      @Nonnull List<String> columns, @Nonnull List<? extends List<?>> tuples) {
    return ofTuples(null, columns, tuples);
  }

  /** Rows from positional tuples whose columns must be fields of {@code table}. */
  public static RowBatch ofTuples(
      @Nullable Table table,
      @Nonnull List<String> columns,
      @Nonnull List<? extends List<?>> tuples) {
    if (columns.isEmpty()) {
      throw new InvalidRowException("Positional rows need an explicit column list");
    }
    if (tuples.isEmpty()) {
      throw new InvalidRowException("No rows given");
    }
    Set<String> unique = new HashSet<>();
    for (String column : columns) {
      if (!unique.add(column)) {
        throw new InvalidRowException(String.format("Column `%s` is listed twice", column));
      }
      if (table != null && !table.hasField(column)) {
        throw new UnknownFieldException(table.getName(), column);
      }
    }

    ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
    for (int i = 0; i < tuples.size(); i++) {
      List<?> tuple = tuples.get(i);
      if (tuple == null || tuple.size() != columns.size()) {
        throw new InvalidRowException(
            String.format(
                "Row %d has %d values, expected %d for columns %s",
                i, tuple == null ? 0 : tuple.size(), columns.size(), columns));
      }
      rows.add(Collections.unmodifiableList(new ArrayList<Object>(tuple)));
    }
    return new RowBatch(ImmutableList.copyOf(columns), rows.build());
  }

  /** Column names of the given fields, for use with {@link #ofTuples}. */
  public static List<String> columnsOf(@Nonnull Field... fields) {
    return Arrays.stream(fields)
        .map(
            field -> {
              if (field.getName() == null) {
                throw new InvalidRowException("Columns must be registered fields");
              }
              return field.getName();
            })
        .collect(ImmutableList.toImmutableList());
  }

  @Nonnull
  public ImmutableList<String> getColumns() {
    return columns;
  }

  /** Row values, each aligned with {@link #getColumns()}; values may be null. */
  @Nonnull
  public ImmutableList<List<Object>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  /** Returns row {@code i} keyed by column, in column order. */
  @Nonnull
  public Map<String, Object> rowAsMap(int i) {
    List<Object> values = rows.get(i);
    Map<String, Object> row = new LinkedHashMap<>();
    for (int c = 0; c < columns.size(); c++) {
      row.put(columns.get(c), values.get(c));
    }
    return Collections.unmodifiableMap(row);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("columns", columns)
        .add("rows", rows)
        .toString();
  }
}
