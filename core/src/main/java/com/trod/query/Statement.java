package com.trod.query;

import com.trod.model.Table;
import javax.annotation.Nonnull;

/**
 * A not-yet-executed operation against one table. Statements are immutable; building and chaining
 * them performs no I/O. Only the terminal methods ({@code execute()}, or {@code first()} and
 * {@code all()} on {@link Select}) reach the driver.
 */
public interface Statement {

  @Nonnull
  Table getTable();

  <T> T accept(@Nonnull StatementVisitor<T> visitor);
}
