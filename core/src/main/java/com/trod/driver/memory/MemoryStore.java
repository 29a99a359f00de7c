package com.trod.driver.memory;

import com.google.common.collect.ImmutableList;
import com.trod.common.status.Status;
import com.trod.common.status.StatusOr;
import com.trod.driver.Alteration;
import com.trod.driver.TableInfo;
import com.trod.model.Field;
import com.trod.model.Index;
import com.trod.model.Table;
import com.trod.query.ExecutionOutcome;
import com.trod.query.Order;
import com.trod.query.Predicate;
import com.trod.query.RowBatch;
import com.trod.query.Select;
import com.trod.query.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Rows of one in-memory table, keyed by primary key.
 *
 * <p>Every operation is atomic: it works on a copy of the rows and publishes the copy only when
 * every row succeeds. Failures are reported as a non-OK {@link Status}.
 */
final class MemoryStore {

  private final String name;
  @Nullable private final String comment;
  private final String primaryKey;
  private final boolean autoIncrement;
  private final LinkedHashMap<String, Field> columns = new LinkedHashMap<>();
  private final LinkedHashMap<String, Index> indexes = new LinkedHashMap<>();
  private LinkedHashMap<Object, Map<String, Object>> rows = new LinkedHashMap<>();
  private long nextId;

  MemoryStore(@Nonnull Table table) {
    this.name = table.getName();
    this.comment = table.getComment().orElse(null);
    this.primaryKey = table.getPrimaryKey().name();
    this.autoIncrement = table.getPrimaryKey().auto();
    this.nextId = table.getPrimaryKey().autoIncrementStart();
    for (Field field : table.getFields()) {
      columns.put(field.getName(), field);
    }
    for (Index index : table.getIndexes()) {
      indexes.put(index.name(), index);
    }
  }

  @Nonnull
  synchronized StatusOr<ExecutionOutcome> insert(@Nonnull RowBatch batch) {
    LinkedHashMap<Object, Map<String, Object>> working = new LinkedHashMap<>(rows);
    long counter = nextId;
    Long firstGenerated = null;
    for (int i = 0; i < batch.size(); i++) {
      StatusOr<Map<String, Object>> rowOr = complete(batch.rowAsMap(i));
      if (rowOr.isNotOk()) {
        return StatusOr.ofStatus(rowOr.getStatus());
      }
      Map<String, Object> row = rowOr.getValue();
      if (row.get(primaryKey) == null) {
        if (!autoIncrement) {
          return StatusOr.ofStatus(
              Status.invalidArgument(
                  String.format("Primary key `%s` of `%s` has no value", primaryKey, name)));
        }
        row.put(primaryKey, counter);
        if (firstGenerated == null) {
          firstGenerated = counter;
        }
        counter++;
      } else {
        counter = advance(counter, row.get(primaryKey));
      }
      Object key = Values.normalizeKey(row.get(primaryKey));
      if (working.containsKey(key)) {
        return StatusOr.ofStatus(
            Status.alreadyExists(
                String.format("Duplicate entry '%s' for key `%s.PRIMARY`", key, name)));
      }
      Status unique = checkUnique(working.values(), row);
      if (unique.isError()) {
        return StatusOr.ofStatus(unique);
      }
      working.put(key, row);
    }
    rows = working;
    nextId = counter;
    return StatusOr.ofValue(new ExecutionOutcome(batch.size(), firstGenerated));
  }

  /**
   * Inserts rows, first deleting any stored row that shares the primary key or a unique index
   * value with them. Each deleted row counts as one more affected row.
   */
  @Nonnull
  synchronized StatusOr<ExecutionOutcome> replace(@Nonnull RowBatch batch) {
    LinkedHashMap<Object, Map<String, Object>> working = new LinkedHashMap<>(rows);
    long counter = nextId;
    Long firstGenerated = null;
    int affected = 0;
    for (int i = 0; i < batch.size(); i++) {
      StatusOr<Map<String, Object>> rowOr = complete(batch.rowAsMap(i));
      if (rowOr.isNotOk()) {
        return StatusOr.ofStatus(rowOr.getStatus());
      }
      Map<String, Object> row = rowOr.getValue();
      if (row.get(primaryKey) == null) {
        if (!autoIncrement) {
          return StatusOr.ofStatus(
              Status.invalidArgument(
                  String.format("Primary key `%s` of `%s` has no value", primaryKey, name)));
        }
        row.put(primaryKey, counter);
        if (firstGenerated == null) {
          firstGenerated = counter;
        }
        counter++;
      } else {
        counter = advance(counter, row.get(primaryKey));
      }
      Object key = Values.normalizeKey(row.get(primaryKey));
      Iterator<Map.Entry<Object, Map<String, Object>>> it = working.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<Object, Map<String, Object>> entry = it.next();
        if (Values.equal(entry.getKey(), key) || conflicts(entry.getValue(), row)) {
          it.remove();
          affected++;
        }
      }
      working.put(key, row);
      affected++;
    }
    rows = working;
    nextId = counter;
    return StatusOr.ofValue(new ExecutionOutcome(affected, firstGenerated));
  }

  @Nonnull
  synchronized StatusOr<ExecutionOutcome> update(
      @Nonnull Map<String, Object> values, @Nullable Predicate where) {
    for (String column : values.keySet()) {
      if (!columns.containsKey(column)) {
        return StatusOr.ofStatus(unknownColumn(column));
      }
      if (values.get(column) == null && !columns.get(column).isNullable()) {
        return StatusOr.ofStatus(notNull(column));
      }
    }
    LinkedHashMap<Object, Map<String, Object>> working = new LinkedHashMap<>();
    List<Map<String, Object>> changed = new ArrayList<>();
    try {
      for (Map.Entry<Object, Map<String, Object>> entry : rows.entrySet()) {
        if (where == null || where.matches(entry.getValue())) {
          Map<String, Object> row = new LinkedHashMap<>(entry.getValue());
          row.putAll(values);
          changed.add(row);
        } else {
          working.put(entry.getKey(), entry.getValue());
        }
      }
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument(e.getMessage()));
    }
    for (Map<String, Object> row : changed) {
      Object key = Values.normalizeKey(row.get(primaryKey));
      if (working.containsKey(key)) {
        return StatusOr.ofStatus(
            Status.alreadyExists(
                String.format("Duplicate entry '%s' for key `%s.PRIMARY`", key, name)));
      }
      Status unique = checkUnique(working.values(), row);
      if (unique.isError()) {
        return StatusOr.ofStatus(unique);
      }
      working.put(key, row);
    }
    rows = working;
    return StatusOr.ofValue(ExecutionOutcome.of(changed.size()));
  }

  @Nonnull
  synchronized StatusOr<ExecutionOutcome> delete(@Nullable Predicate where) {
    LinkedHashMap<Object, Map<String, Object>> working = new LinkedHashMap<>();
    int removed = 0;
    try {
      for (Map.Entry<Object, Map<String, Object>> entry : rows.entrySet()) {
        if (where == null || where.matches(entry.getValue())) {
          removed++;
        } else {
          working.put(entry.getKey(), entry.getValue());
        }
      }
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument(e.getMessage()));
    }
    rows = working;
    return StatusOr.ofValue(ExecutionOutcome.of(removed));
  }

  /**
   * Runs a select. A single-row select yields one mapping, empty when nothing matched; any other
   * select yields a list of mappings.
   */
  @Nonnull
  synchronized StatusOr<Object> select(@Nonnull Select<?> select) {
    List<String> projection = new ArrayList<>();
    for (Field field : select.getColumns()) {
      if (!columns.containsKey(field.getName())) {
        return StatusOr.ofStatus(unknownColumn(field.getName()));
      }
      projection.add(field.getName());
    }
    List<Map<String, Object>> matched = new ArrayList<>();
    try {
      Predicate where = select.getWhere().orElse(null);
      for (Map<String, Object> row : rows.values()) {
        if (where == null || where.matches(row)) {
          matched.add(row);
        }
      }
      if (!select.getOrderBy().isEmpty()) {
        matched.sort(ordering(select.getOrderBy()));
      }
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument(e.getMessage()));
    }

    List<Map<String, Object>> projected = new ArrayList<>();
    Set<Map<String, Object>> seen = new HashSet<>();
    for (Map<String, Object> row : matched) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (String column : projection) {
        out.put(column, row.get(column));
      }
      if (!select.isDistinct() || seen.add(out)) {
        projected.add(out);
      }
    }

    int from = Math.min(select.getOffset(), projected.size());
    int to = projected.size();
    if (select.getLimit().isPresent()) {
      to = Math.min(to, from + select.getLimit().getAsInt());
    }
    List<Map<String, Object>> page = new ArrayList<>(projected.subList(from, to));
    if (select.isSingle()) {
      return StatusOr.ofValue(page.isEmpty() ? Collections.emptyMap() : page.get(0));
    }
    return StatusOr.ofValue(page);
  }

  @Nonnull
  synchronized StatusOr<ExecutionOutcome> alter(@Nonnull Alteration alteration) {
    for (Field field : alteration.addColumns()) {
      if (columns.containsKey(field.getName())) {
        return StatusOr.ofStatus(
            Status.alreadyExists(String.format("Duplicate column name '%s'", field.getName())));
      }
      if (!field.isNullable() && !field.hasDefault() && !rows.isEmpty()) {
        return StatusOr.ofStatus(
            Status.failedPrecondition(
                String.format(
                    "Column `%s` is NOT NULL without a default and `%s` has rows",
                    field.getName(), name)));
      }
    }
    for (String column : alteration.dropColumns()) {
      if (!columns.containsKey(column)) {
        return StatusOr.ofStatus(unknownColumn(column));
      }
      if (column.equals(primaryKey)) {
        return StatusOr.ofStatus(
            Status.failedPrecondition(
                String.format("Cannot drop primary key column `%s`", column)));
      }
    }
    for (String index : alteration.dropIndexes()) {
      if (!indexes.containsKey(index)) {
        return StatusOr.ofStatus(
            Status.notFound(String.format("Index `%s` does not exist on `%s`", index, name)));
      }
    }

    LinkedHashMap<String, Field> newColumns = new LinkedHashMap<>(columns);
    alteration.dropColumns().forEach(newColumns::remove);
    alteration.addColumns().forEach(field -> newColumns.put(field.getName(), field));
    LinkedHashMap<String, Index> newIndexes = new LinkedHashMap<>(indexes);
    alteration.dropIndexes().forEach(newIndexes::remove);
    newIndexes.values().removeIf(index -> !newColumns.keySet().containsAll(index.columns()));
    for (Index index : alteration.addIndexes()) {
      if (newIndexes.containsKey(index.name())) {
        return StatusOr.ofStatus(
            Status.alreadyExists(String.format("Duplicate key name '%s'", index.name())));
      }
      for (String column : index.columns()) {
        if (!newColumns.containsKey(column)) {
          return StatusOr.ofStatus(unknownColumn(column));
        }
      }
      newIndexes.put(index.name(), index);
    }

    LinkedHashMap<Object, Map<String, Object>> working = new LinkedHashMap<>();
    for (Map.Entry<Object, Map<String, Object>> entry : rows.entrySet()) {
      Map<String, Object> row = new LinkedHashMap<>(entry.getValue());
      alteration.dropColumns().forEach(row::remove);
      for (Field field : alteration.addColumns()) {
        row.put(field.getName(), field.hasDefault() ? field.produceDefault() : null);
      }
      working.put(entry.getKey(), row);
    }
    for (Index index : alteration.addIndexes()) {
      if (index.unique() && hasDuplicates(working.values(), index)) {
        return StatusOr.ofStatus(
            Status.alreadyExists(
                String.format("Existing rows violate unique index `%s`", index.name())));
      }
    }

    columns.clear();
    columns.putAll(newColumns);
    indexes.clear();
    indexes.putAll(newIndexes);
    rows = working;
    return StatusOr.ofValue(ExecutionOutcome.of(0));
  }

  @Nonnull
  synchronized TableInfo describe() {
    ImmutableList<TableInfo.Column> described =
        columns.values().stream()
            .map(
                field ->
                    new TableInfo.Column(
                        field.getName(),
                        field.getType(),
                        field.isNullable(),
                        field.getName().equals(primaryKey)))
            .collect(ImmutableList.toImmutableList());
    return new TableInfo(
        name, described, ImmutableList.copyOf(indexes.keySet()), rows.size(), comment);
  }

  synchronized int size() {
    return rows.size();
  }

  /** Fills a batch row out to every column, applying defaults and NOT NULL checks. */
  private StatusOr<Map<String, Object>> complete(Map<String, Object> input) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String column : input.keySet()) {
      if (!columns.containsKey(column)) {
        return StatusOr.ofStatus(unknownColumn(column));
      }
    }
    for (Field field : columns.values()) {
      Object value = input.get(field.getName());
      if (value == null && field.hasDefault()) {
        value = field.produceDefault();
      }
      // A missing primary key is generated or rejected by the caller.
      if (value == null && !field.isNullable() && !field.getName().equals(primaryKey)) {
        return StatusOr.ofStatus(notNull(field.getName()));
      }
      row.put(field.getName(), value);
    }
    return StatusOr.ofValue(row);
  }

  private static long advance(long counter, Object key) {
    Object normalized = Values.normalizeKey(key);
    if (normalized instanceof Long && (Long) normalized >= counter) {
      return (Long) normalized + 1;
    }
    return counter;
  }

  private Status checkUnique(Iterable<Map<String, Object>> existing, Map<String, Object> row) {
    for (Index index : indexes.values()) {
      if (!index.unique()) {
        continue;
      }
      for (Map<String, Object> other : existing) {
        if (sameValues(index, other, row)) {
          return Status.alreadyExists(
              String.format(
                  "Duplicate entry %s for key `%s.%s`",
                  indexValues(index, row), name, index.name()));
        }
      }
    }
    return Status.ok();
  }

  private boolean conflicts(Map<String, Object> stored, Map<String, Object> row) {
    for (Index index : indexes.values()) {
      if (index.unique() && sameValues(index, stored, row)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasDuplicates(Iterable<Map<String, Object>> rows, Index index) {
    List<Map<String, Object>> seen = new ArrayList<>();
    for (Map<String, Object> row : rows) {
      for (Map<String, Object> other : seen) {
        if (sameValues(index, other, row)) {
          return true;
        }
      }
      seen.add(row);
    }
    return false;
  }

  /** NULL never collides in a unique index. */
  private static boolean sameValues(Index index, Map<String, Object> a, Map<String, Object> b) {
    for (String column : index.columns()) {
      Object left = a.get(column);
      Object right = b.get(column);
      if (left == null || right == null || !Values.equal(left, right)) {
        return false;
      }
    }
    return true;
  }

  private static List<Object> indexValues(Index index, Map<String, Object> row) {
    List<Object> values = new ArrayList<>();
    for (String column : index.columns()) {
      values.add(row.get(column));
    }
    return values;
  }

  private static Comparator<Map<String, Object>> ordering(List<Order> orders) {
    Comparator<Map<String, Object>> comparator = (a, b) -> 0;
    for (Order order : orders) {
      String column = order.field().getName();
      Comparator<Map<String, Object>> term =
          (a, b) -> Values.compareNullsFirst(a.get(column), b.get(column));
      comparator = comparator.thenComparing(order.ascending() ? term : term.reversed());
    }
    return comparator;
  }

  private Status unknownColumn(String column) {
    return Status.notFound(String.format("Unknown column '%s' in '%s'", column, name));
  }

  private static Status notNull(String column) {
    return Status.invalidArgument(String.format("Column '%s' cannot be null", column));
  }
}
