package com.trod.query;

import com.google.common.base.MoreObjects;
import com.trod.model.Table;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * REPLACE of one or more rows: a row whose primary key (or unique index key) matches an existing
 * row replaces it, any other row is inserted.
 */
public final class Replace implements Statement {

  private final Table table;
  private final RowBatch rows;

  public Replace(@Nonnull Table table, @Nonnull RowBatch rows) {
    this.table = Objects.requireNonNull(table);
    this.rows = Objects.requireNonNull(rows);
  }

  @Override
  public Table getTable() {
    return table;
  }

  @Nonnull
  public RowBatch getRows() {
    return rows;
  }

  @Nonnull
  public CompletableFuture<ExecutionOutcome> execute() {
    return table.driver().execute(this);
  }

  @Override
  public <T> T accept(StatementVisitor<T> visitor) {
    return visitor.visitReplace(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("table", table.getName())
        .add("columns", rows.getColumns())
        .add("rows", rows.size())
        .toString();
  }
}
