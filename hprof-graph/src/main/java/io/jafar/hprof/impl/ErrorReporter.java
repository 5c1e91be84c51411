package io.jafar.hprof.impl;

import io.jafar.hprof.api.ErrorKind;
import java.io.IOException;

/** Receives recoverable decode errors. */
@FunctionalInterface
public interface ErrorReporter {

  /**
   * Reports a recoverable error.
   *
   * @param kind error classification, never a fatal kind
   * @param context what was being decoded
   * @throws IOException if forwarding the error fails
   */
  void report(ErrorKind kind, String context) throws IOException;
}
