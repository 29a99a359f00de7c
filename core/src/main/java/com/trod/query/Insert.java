package com.trod.query;

import com.google.common.base.MoreObjects;
import com.trod.model.Table;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/** INSERT of one or more rows. */
public final class Insert implements Statement {

  private final Table table;
  private final RowBatch rows;

  public Insert(@Nonnull Table table, @Nonnull RowBatch rows) {
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

  /**
   * Executes the insert. The outcome carries the generated key when the table has an
   * AUTO_INCREMENT primary key.
   */
  @Nonnull
  public CompletableFuture<ExecutionOutcome> execute() {
    return table.driver().execute(this);
  }

  @Override
  public <T> T accept(StatementVisitor<T> visitor) {
    return visitor.visitInsert(this);
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
