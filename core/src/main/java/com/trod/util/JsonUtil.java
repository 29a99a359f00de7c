package com.trod.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;
import javax.annotation.Nonnull;

/** JSON rendering shared by metadata and record descriptions. */
public final class JsonUtil {

  // java.time types are rendered through toString(); reflective access to them fails on JDK 17.
  private static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .disableHtmlEscaping()
          .registerTypeHierarchyAdapter(
              TemporalAccessor.class,
              (JsonSerializer<TemporalAccessor>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
          .registerTypeAdapter(
              UUID.class,
              (JsonSerializer<UUID>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
          .create();

  private JsonUtil() {
    // Utility class, no instances
  }

  @Nonnull
  public static Gson gson() {
    return GSON;
  }

  @Nonnull
  public static String toJson(Object value) {
    return GSON.toJson(value);
  }
}
