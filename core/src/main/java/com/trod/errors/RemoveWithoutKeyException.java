package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a record is removed while its primary key is unset. */
public class RemoveWithoutKeyException extends TrodException {

  public RemoveWithoutKeyException(String message) {
    super(StatusCode.FAILED_PRECONDITION, message);
  }
}
