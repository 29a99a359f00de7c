package com.trod.driver;

import com.trod.model.Table;
import com.trod.query.ExecutionOutcome;
import com.trod.query.Select;
import com.trod.query.Statement;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;

/**
 * The boundary to the storage that executes statements. The mapping layer shapes calls to a
 * driver and never retries them; a failure reported by the driver reaches the caller through the
 * returned future unchanged.
 *
 * <p>A driver owns connection handling, dialect rendering and any timeout policy.
 */
public interface Driver {

  /**
   * Executes a write statement ({@code Insert}, {@code Replace}, {@code Update} or
   * {@code Delete}).
   */
  @Nonnull
  CompletableFuture<ExecutionOutcome> execute(@Nonnull Statement statement);

  /**
   * Runs a select. When {@link Select#isSingle()} is set, the future completes with one row as a
   * {@code Map<String, Object>}, or with an empty map or null when nothing matched; otherwise it
   * completes with a {@code List<Map<String, Object>>}.
   */
  @Nonnull
  CompletableFuture<Object> fetch(@Nonnull Select<?> select);

  @Nonnull
  CompletableFuture<ExecutionOutcome> createTable(@Nonnull Table table, @Nonnull DdlOptions options);

  @Nonnull
  CompletableFuture<ExecutionOutcome> dropTable(@Nonnull Table table, @Nonnull DdlOptions options);

  /** Applies a schema change to the stored table. */
  @Nonnull
  ExecutionOutcome alterTable(@Nonnull Table table, @Nonnull Alteration alteration);

  /** Describes the stored table. */
  @Nonnull
  TableInfo describeTable(@Nonnull Table table);
}
