package com.trod.errors;

import com.trod.common.status.StatusCode;

/** Raised when a raw driver result has none of the shapes the result codec understands. */
public class DecodeException extends TrodException {

  public DecodeException(String message) {
    super(StatusCode.DATA_LOSS, message);
  }

  /** Builds the failure for a raw value of an unexpected type. */
  public static DecodeException unexpectedShape(Object raw) {
    String type = raw == null ? "null" : raw.getClass().getName();
    return new DecodeException("Cannot decode driver result of type " + type);
  }
}
