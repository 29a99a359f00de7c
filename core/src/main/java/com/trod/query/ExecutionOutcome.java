package com.trod.query;

import com.google.common.base.Preconditions;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Result of a write statement or DDL operation.
 *
 * @param affected number of affected rows, never negative
 * @param lastId key generated by an AUTO_INCREMENT primary key, or null when none was generated
 */
public record ExecutionOutcome(int affected, @Nullable Long lastId) {

  public ExecutionOutcome {
    Preconditions.checkArgument(affected >= 0, "affected must not be negative, got %s", affected);
  }

  public static ExecutionOutcome of(int affected) {
    return new ExecutionOutcome(affected, null);
  }

  @Nonnull
  public Optional<Long> generatedKey() {
    return Optional.ofNullable(lastId);
  }

  @Override
  public String toString() {
    return "<ExecutionOutcome(affected: " + affected + ", last_id: " + lastId + ")>";
  }
}
