package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a model finishes registration without a primary key field. */
public class NoPrimaryKeyException extends TrodException {

  public NoPrimaryKeyException(String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
  }
}
