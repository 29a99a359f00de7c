package com.trod.driver;

import com.trod.common.status.Status;
import com.trod.common.status.StatusCode;
import javax.annotation.Nonnull;

/** A storage-level failure reported by a driver, such as a violated key constraint. */
public class DriverException extends RuntimeException {

  private final Status status;

  public DriverException(@Nonnull Status status) {
    super(status.toString());
    this.status = status;
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  @Nonnull
  public StatusCode getCode() {
    return status.getCode();
  }
}
