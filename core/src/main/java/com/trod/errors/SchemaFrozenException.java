package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised on any declaration made after the model has been registered. */
public class SchemaFrozenException extends TrodException {

  public SchemaFrozenException(String message) {
    super(StatusCode.FAILED_PRECONDITION, message);
  }
}
