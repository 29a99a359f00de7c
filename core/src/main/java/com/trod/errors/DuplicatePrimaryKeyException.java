package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a second field of one model is marked as the primary key. */
public class DuplicatePrimaryKeyException extends TrodException {

  public DuplicatePrimaryKeyException(String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
  }
}
