package io.jafar.hprof.impl;

import io.jafar.hprof.api.RecordTag;
import io.jafar.hprof.internal.ByteCursor;

/**
 * One top-level HPROF record.
 *
 * @param tag record tag
 * @param timestamp microseconds since the header timestamp (unsigned u4)
 * @param offset absolute file offset of the record header
 * @param payload cursor over exactly the record body; borrowed from the file, not copied
 */
public record TopLevelRecord(RecordTag tag, long timestamp, long offset, ByteCursor payload) {

  /** Returns the declared payload length. */
  public long length() {
    return payload.length();
  }
}
