package io.jafar.hprof.api;

/**
 * Classification of decode failures. Fatal kinds abort the whole decode because the reader can
 * no longer tell where the next record starts; the others are reported as {@link
 * GraphEvent.DecodeError} events and decoding continues with the next record or object.
 */
public enum ErrorKind {
  /** Fewer bytes remain than a read requires. */
  TRUNCATED_INPUT(true),
  /** A fixed-layout payload was not fully consumed by its decoder. */
  UNCONSUMED_PAYLOAD(true),
  /** The file header is not a supported HPROF header. */
  INVALID_HEADER(true),
  /** Top-level record tag outside the known set; the record is skipped by its length. */
  UNKNOWN_TAG(false),
  /** Heap sub-record tag outside the known set; the rest of the segment is skipped. */
  UNKNOWN_SUB_RECORD(false),
  /** A string record whose bytes are not valid UTF-8; the string is dropped. */
  INVALID_SYMBOL(false),
  /** A class id dumped more than once; the later definition is dropped. */
  DUPLICATE_CLASS_DEF(false),
  /** An instance whose superclass chain references an undefined class. */
  DANGLING_SUPERCLASS(false),
  /** An instance blob whose length disagrees with its class field layout. */
  FIELD_LAYOUT_MISMATCH(false),
  /** An instance or object array whose class was never dumped. */
  MISSING_CLASS_DEF(false);

  private final boolean fatal;

  ErrorKind(boolean fatal) {
    this.fatal = fatal;
  }

  public boolean isFatal() {
    return fatal;
  }
}
