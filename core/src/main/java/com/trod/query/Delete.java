package com.trod.query;

import com.google.common.base.MoreObjects;
import com.trod.model.Table;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** DELETE of the rows matching an optional condition; without one every row is deleted. */
public final class Delete implements Statement {

  private final Table table;
  @Nullable private final Predicate where;

  public Delete(@Nonnull Table table) {
    this(table, null);
  }

  private Delete(Table table, @Nullable Predicate where) {
    this.table = Objects.requireNonNull(table);
    this.where = where;
  }

  /** Returns a delete restricted by {@code predicate}, AND-ed with any existing condition. */
  @Nonnull
  public Delete where(@Nonnull Predicate predicate) {
    Statements.checkFields(table, predicate);
    return new Delete(table, where == null ? predicate : where.and(predicate));
  }

  @Override
  public Table getTable() {
    return table;
  }

  @Nonnull
  public Optional<Predicate> getWhere() {
    return Optional.ofNullable(where);
  }

  @Nonnull
  public CompletableFuture<ExecutionOutcome> execute() {
    return table.driver().execute(this);
  }

  @Override
  public <T> T accept(StatementVisitor<T> visitor) {
    return visitor.visitDelete(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("table", table.getName())
        .add("where", where)
        .toString();
  }
}
