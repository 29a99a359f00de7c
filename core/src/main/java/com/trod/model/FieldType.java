package com.trod.model;

/** Declared column type tags. */
public enum FieldType {
  TINYINT(true),
  SMALLINT(true),
  INT(true),
  BIGINT(true),
  FLOAT(true),
  DOUBLE(true),
  DECIMAL(true),
  BOOLEAN(false),
  CHAR(false),
  VARCHAR(false),
  TEXT(false),
  BLOB(false),
  DATE(false),
  DATETIME(false),
  TIMESTAMP(false),
  JSON(false);

  private final boolean numeric;

  FieldType(boolean numeric) {
    this.numeric = numeric;
  }

  public boolean isNumeric() {
    return numeric;
  }

  /** Whether a column of this type can carry an AUTO_INCREMENT counter. */
  public boolean isIntegral() {
    return this == TINYINT || this == SMALLINT || this == INT || this == BIGINT;
  }
}
