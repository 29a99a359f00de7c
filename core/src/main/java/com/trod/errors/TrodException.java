package com.trod.errors;

import com.trod.common.status.StatusCode;
import javax.annotation.Nonnull;

/**
 * Base class of every failure raised by the mapping layer itself. Each subclass names one cause
 * so callers can branch on the type, and reports the {@link StatusCode} that classifies it.
 *
 * <p>Failures reported by a driver are not wrapped in this hierarchy; they reach the caller as the
 * driver produced them.
 */
public abstract class TrodException extends RuntimeException {

  private final StatusCode code;

  protected TrodException(@Nonnull StatusCode code, String message) {
    super(message);
    this.code = code;
  }

  protected TrodException(@Nonnull StatusCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /** Returns the status code classifying this failure. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }
}
