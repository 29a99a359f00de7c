package com.trod.driver;

/**
 * Options of CREATE TABLE and DROP TABLE.
 *
 * @param safe adds IF NOT EXISTS to a create and IF EXISTS to a drop
 */
public record DdlOptions(boolean safe) {

  private static final DdlOptions DEFAULTS = new DdlOptions(false);
  private static final DdlOptions SAFE = new DdlOptions(true);

  public static DdlOptions defaults() {
    return DEFAULTS;
  }

  public static DdlOptions safeMode() {
    return SAFE;
  }
}
