package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a declaration is neither a field, an index nor a reserved attribute. */
public class InvalidFieldTypeException extends TrodException {

  public InvalidFieldTypeException(String message) {
    super(StatusCode.INVALID_ARGUMENT, message);
  }
}
