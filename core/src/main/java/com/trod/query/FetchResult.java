package com.trod.query;

import com.google.common.collect.ForwardingList;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Ordered, immutable rows returned by a multi-row read. A fetch that matched nothing yields an
 * empty result, never null.
 *
 * @param <T> the row type, a model record or a generic mapping
 */
public final class FetchResult<T> extends ForwardingList<T> {

  private static final FetchResult<Object> EMPTY = new FetchResult<>(ImmutableList.of());

  private final ImmutableList<T> rows;

  private FetchResult(ImmutableList<T> rows) {
    this.rows = rows;
  }

  @SuppressWarnings("unchecked")
  public static <T> FetchResult<T> empty() {
    return (FetchResult<T>) EMPTY;
  }

  public static <T> FetchResult<T> of(@Nonnull Collection<? extends T> rows) {
    return rows.isEmpty() ? empty() : new FetchResult<>(ImmutableList.copyOf(rows));
  }

  @Override
  protected List<T> delegate() {
    return rows;
  }

  /** Returns the first row, or throws if the result is empty. */
  @Nonnull
  public T first() {
    if (rows.isEmpty()) {
      throw new IndexOutOfBoundsException("FetchResult is empty");
    }
    return rows.get(0);
  }

  @Override
  public String toString() {
    return "FetchResult" + rows;
  }
}
