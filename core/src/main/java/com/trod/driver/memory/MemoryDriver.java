package com.trod.driver.memory;

import com.trod.common.status.Status;
import com.trod.common.status.StatusOr;
import com.trod.driver.Alteration;
import com.trod.driver.DdlOptions;
import com.trod.driver.Driver;
import com.trod.driver.DriverException;
import com.trod.driver.TableInfo;
import com.trod.model.Table;
import com.trod.query.Delete;
import com.trod.query.ExecutionOutcome;
import com.trod.query.Insert;
import com.trod.query.Replace;
import com.trod.query.Select;
import com.trod.query.Statement;
import com.trod.query.StatementVisitor;
import com.trod.query.Update;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * A {@link Driver} that keeps tables in process memory.
 *
 * <p>Statements run on the supplied executor. A storage failure completes the returned future
 * exceptionally with a {@link DriverException} carrying the failure's {@link Status}.
 */
public final class MemoryDriver implements Driver {

  private final Executor executor;
  private final Map<String, MemoryStore> tables = new ConcurrentHashMap<>();

  public MemoryDriver() {
    this(ForkJoinPool.commonPool());
  }

  public MemoryDriver(@Nonnull Executor executor) {
    this.executor = Objects.requireNonNull(executor);
  }

  @Nonnull
  @Override
  public CompletableFuture<ExecutionOutcome> execute(@Nonnull Statement statement) {
    return submit(
        () -> {
          Logger.debug("Executing {}", statement);
          return store(statement.getTable())
              .flatMap(store -> statement.accept(new WriteDispatch(store)));
        });
  }

  @Nonnull
  @Override
  public CompletableFuture<Object> fetch(@Nonnull Select<?> select) {
    return submit(
        () -> {
          Logger.debug("Fetching {}", select);
          return store(select.getTable()).flatMap(store -> store.select(select));
        });
  }

  @Nonnull
  @Override
  public CompletableFuture<ExecutionOutcome> createTable(
      @Nonnull Table table, @Nonnull DdlOptions options) {
    return submit(
        () -> {
          MemoryStore created = new MemoryStore(table);
          MemoryStore existing = tables.putIfAbsent(key(table), created);
          if (existing != null) {
            if (options.safe()) {
              return StatusOr.ofValue(ExecutionOutcome.of(0));
            }
            return StatusOr.ofStatus(
                Status.alreadyExists(
                    String.format("Table '%s' already exists", table.getName())));
          }
          Logger.info("Created table {}", key(table));
          return StatusOr.ofValue(ExecutionOutcome.of(0));
        });
  }

  @Nonnull
  @Override
  public CompletableFuture<ExecutionOutcome> dropTable(
      @Nonnull Table table, @Nonnull DdlOptions options) {
    return submit(
        () -> {
          MemoryStore removed = tables.remove(key(table));
          if (removed == null) {
            if (options.safe()) {
              return StatusOr.ofValue(ExecutionOutcome.of(0));
            }
            return StatusOr.ofStatus(unknownTable(table));
          }
          Logger.info("Dropped table {} holding {} rows", key(table), removed.size());
          return StatusOr.ofValue(ExecutionOutcome.of(0));
        });
  }

  @Nonnull
  @Override
  public ExecutionOutcome alterTable(@Nonnull Table table, @Nonnull Alteration alteration) {
    Logger.info("Altering table {}: {}", key(table), alteration);
    return unwrap(store(table).flatMap(store -> store.alter(alteration)));
  }

  @Nonnull
  @Override
  public TableInfo describeTable(@Nonnull Table table) {
    return unwrap(store(table).map(MemoryStore::describe));
  }

  private <T> CompletableFuture<T> submit(Supplier<StatusOr<T>> work) {
    return CompletableFuture.supplyAsync(() -> unwrap(work.get()), executor);
  }

  private static <T> T unwrap(StatusOr<T> result) {
    if (result.isNotOk()) {
      Logger.debug("Driver call failed: {}", result.getStatus());
      throw new DriverException(result.getStatus());
    }
    return result.getValue();
  }

  private StatusOr<MemoryStore> store(Table table) {
    MemoryStore store = tables.get(key(table));
    if (store == null) {
      return StatusOr.ofStatus(unknownTable(table));
    }
    return StatusOr.ofValue(store);
  }

  private static Status unknownTable(Table table) {
    return Status.notFound(String.format("Table '%s' doesn't exist", key(table)));
  }

  private static String key(Table table) {
    return table.getDatabase().map(db -> db.getName() + ".").orElse("") + table.getName();
  }

  /** Routes a write statement to the store operation that applies it. */
  private static final class WriteDispatch implements StatementVisitor<StatusOr<ExecutionOutcome>> {
    private final MemoryStore store;

    WriteDispatch(MemoryStore store) {
      this.store = store;
    }

    @Override
    public StatusOr<ExecutionOutcome> visitSelect(Select<?> select) {
      return StatusOr.ofStatus(
          Status.invalidArgument("SELECT is read through fetch(), not execute()"));
    }

    @Override
    public StatusOr<ExecutionOutcome> visitInsert(Insert insert) {
      return store.insert(insert.getRows());
    }

    @Override
    public StatusOr<ExecutionOutcome> visitReplace(Replace replace) {
      return store.replace(replace.getRows());
    }

    @Override
    public StatusOr<ExecutionOutcome> visitUpdate(Update update) {
      return store.update(update.getValues(), update.getWhere().orElse(null));
    }

    @Override
    public StatusOr<ExecutionOutcome> visitDelete(Delete delete) {
      return store.delete(delete.getWhere().orElse(null));
    }
  }
}
