package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when two declarations of one model resolve to the same field name. */
public class DuplicateFieldNameException extends TrodException {

  public DuplicateFieldNameException(String message) {
    super(StatusCode.ALREADY_EXISTS, message);
  }
}
