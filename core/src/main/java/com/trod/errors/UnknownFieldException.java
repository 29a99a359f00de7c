package com.trod.errors;

import com.trod.common.status.StatusCode;

/**
 * Raised when a read or write names a field the table does not declare, outside the trusted
 * loader path.
 */
public class UnknownFieldException extends TrodException {

  private final String tableName;
  private final String fieldName;

  public UnknownFieldException(String tableName, String fieldName) {
    super(
        StatusCode.NOT_FOUND,
        String.format("Table `%s` does not have `%s` field", tableName, fieldName));
    this.tableName = tableName;
    this.fieldName = fieldName;
  }

  public String getTableName() {
    return tableName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
