package com.trod.model;

import org.tinylog.Logger;

/**
 * Receives the non-fatal notices produced while a model is registered, such as a table name that
 * had to be derived from the model name. Implementations must not throw.
 */
@FunctionalInterface
public interface Diagnostics {

  void warn(String message);

  /** Writes notices to the application log at WARN level. */
  static Diagnostics logging() {
    return message -> Logger.warn(message);
  }

  /** Discards every notice. */
  static Diagnostics silent() {
    return message -> {};
  }
}
