package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a public write targets the auto-increment primary key of a record. */
public class ImmutablePrimaryKeyException extends TrodException {

  public ImmutablePrimaryKeyException(String message) {
    super(StatusCode.FAILED_PRECONDITION, message);
  }
}
