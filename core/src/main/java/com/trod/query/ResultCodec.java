package com.trod.query;

import com.google.common.collect.ImmutableList;
import com.trod.errors.DecodeException;
import com.trod.model.Loader;
import com.trod.model.Model;
import com.trod.model.ModelClass;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Decodes raw driver results into records or generic mappings.
 *
 * <p>A raw result is a mapping (one row; {@code null} or empty when no row matched) or a list of
 * mappings. What an empty result decodes to depends on its shape and on the requested output:
 *
 * <table>
 *   <caption>Empty results</caption>
 *   <tr><th>raw</th><th>records</th><th>mappings</th></tr>
 *   <tr><td>null or empty mapping</td><td>a fresh, unpopulated record</td><td>an empty mapping</td></tr>
 *   <tr><td>empty list</td><td>an empty {@link FetchResult}</td>
 *       <td>a {@link FetchResult} holding one empty mapping</td></tr>
 * </table>
 *
 * <p>The one-empty-mapping answer for list reads is kept for compatibility with existing callers.
 * Records are populated through {@link Loader}, which writes columns without the checks of the
 * public write path.
 */
public final class ResultCodec {

  private ResultCodec() {
    // Utility class, no instances
  }

  /**
   * Decodes any raw shape.
   *
   * @return a record, a mapping, or a {@link FetchResult} of either
   * @throws DecodeException if {@code raw} is neither a mapping nor a list of mappings
   */
  @Nonnull
  public static <R extends Model> Object load(
      @Nullable Object raw, @Nonnull ModelClass<R> modelClass, boolean asMapping) {
    if (raw == null || raw instanceof Map) {
      return asMapping ? loadOneAsMap(raw) : loadOne(raw, modelClass);
    }
    if (raw instanceof List) {
      return asMapping ? loadAllAsMaps(raw) : loadAll(raw, modelClass);
    }
    throw DecodeException.unexpectedShape(raw);
  }

  /** Decodes a single-row result into a record; never returns null. */
  @Nonnull
  public static <R extends Model> R loadOne(@Nullable Object raw, @Nonnull ModelClass<R> modelClass) {
    Map<?, ?> row = asRow(raw);
    if (row == null || row.isEmpty()) {
      return modelClass.newInstance();
    }
    return Loader.populate(modelClass, row);
  }

  /** Decodes a single-row result into a mapping; empty when no row matched. */
  @Nonnull
  public static Map<String, Object> loadOneAsMap(@Nullable Object raw) {
    Map<?, ?> row = asRow(raw);
    if (row == null || row.isEmpty()) {
      return Collections.emptyMap();
    }
    return copy(row);
  }

  /** Decodes a list result into records; {@code null} is read as an empty list. */
  @Nonnull
  public static <R extends Model> FetchResult<R> loadAll(
      @Nullable Object raw, @Nonnull ModelClass<R> modelClass) {
    List<?> rows = asRows(raw);
    if (rows.isEmpty()) {
      return FetchResult.empty();
    }
    ImmutableList.Builder<R> records = ImmutableList.builderWithExpectedSize(rows.size());
    for (Object element : rows) {
      records.add(Loader.populate(modelClass, element(element)));
    }
    return FetchResult.of(records.build());
  }

  /**
   * Decodes a list result into mappings. An empty list yields a result holding a single empty
   * mapping.
   */
  @Nonnull
  public static FetchResult<Map<String, Object>> loadAllAsMaps(@Nullable Object raw) {
    List<?> rows = asRows(raw);
    if (rows.isEmpty()) {
      return FetchResult.of(ImmutableList.of(Collections.<String, Object>emptyMap()));
    }
    ImmutableList.Builder<Map<String, Object>> maps =
        ImmutableList.builderWithExpectedSize(rows.size());
    for (Object element : rows) {
      maps.add(copy(element(element)));
    }
    return FetchResult.of(maps.build());
  }

  @Nullable
  private static Map<?, ?> asRow(@Nullable Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Map) {
      return (Map<?, ?>) raw;
    }
    throw DecodeException.unexpectedShape(raw);
  }

  private static List<?> asRows(@Nullable Object raw) {
    if (raw == null) {
      return List.of();
    }
    if (raw instanceof List) {
      return (List<?>) raw;
    }
    throw DecodeException.unexpectedShape(raw);
  }

  private static Map<?, ?> element(@Nullable Object element) {
    if (element instanceof Map) {
      return (Map<?, ?>) element;
    }
    throw new DecodeException(
        "List results must hold mappings, got "
            + (element == null ? "null" : element.getClass().getName()));
  }

  private static Map<String, Object> copy(Map<?, ?> row) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : row.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new DecodeException("Column names must be strings, got " + entry.getKey());
      }
      copy.put((String) entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }
}
