package io.jafar.hprof.api;

import java.io.IOException;
import java.util.Objects;

/** Signals malformed HPROF content. The {@link ErrorKind} tells whether decoding may go on. */
public class HprofFormatException extends IOException {

  private final ErrorKind kind;
  private final long offset;
  private final String detail;

  public HprofFormatException(ErrorKind kind, long offset, String message) {
    super(offset >= 0 ? kind + " at offset " + offset + ": " + message : kind + ": " + message);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    this.offset = offset;
    this.detail = message;
  }

  public HprofFormatException(ErrorKind kind, String message) {
    this(kind, -1, message);
  }

  /** Returns the error classification. */
  public ErrorKind kind() {
    return kind;
  }

  /** Returns the absolute file offset where the problem was detected, or -1 if unknown. */
  public long offset() {
    return offset;
  }

  /** Returns the message without the kind, with the offset appended when known. */
  public String detail() {
    return offset >= 0 ? detail + " (offset " + offset + ")" : detail;
  }

  /** Returns true if this error terminates the decode. */
  public boolean isFatal() {
    return kind.isFatal();
  }
}
