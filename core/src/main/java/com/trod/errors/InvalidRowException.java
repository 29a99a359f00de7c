package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when an insert payload cannot be normalized into aligned columns and values. */
public class InvalidRowException extends TrodException {

  public InvalidRowException(String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
  }
}
