package io.jafar.hprof.impl;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.RecordTag;
import io.jafar.hprof.internal.ByteCursor;
import java.io.IOException;

/**
 * Lazy sequence of top-level records.
 *
 * <pre>
 * Records (repeated):
 *   u1    - tag
 *   u4    - timestamp offset (microseconds)
 *   u4    - record length
 *   [u1]* - record body
 * </pre>
 *
 * <p>Payloads are sliced, not decoded. Records with an unknown tag are reported and skipped by
 * their declared length since the format is open to extension.
 */
public final class TopLevelRecordStream {

  /** Size of the fixed record header: tag, timestamp, length. */
  public static final int RECORD_HEADER_SIZE = 9;

  private final ByteCursor records;
  private final ErrorReporter reporter;

  /**
   * @param records cursor over the record area (everything after the file header)
   * @param reporter receiver of {@link ErrorKind#UNKNOWN_TAG} reports
   */
  public TopLevelRecordStream(ByteCursor records, ErrorReporter reporter) {
    this.records = records;
    this.reporter = reporter;
  }

  /**
   * Reads the next record.
   *
   * @return the record, or null at end of input
   * @throws HprofFormatException with {@link ErrorKind#TRUNCATED_INPUT} if the input ends inside
   *     a record header or body
   * @throws IOException if reporting an unknown tag fails
   */
  public TopLevelRecord next() throws IOException {
    while (records.hasRemaining()) {
      long offset = records.position();
      if (records.remaining() < RECORD_HEADER_SIZE) {
        throw new HprofFormatException(
            ErrorKind.TRUNCATED_INPUT,
            offset,
            "record header needs "
                + RECORD_HEADER_SIZE
                + " bytes, "
                + records.remaining()
                + " remaining");
      }
      int code = records.readU1();
      long timestamp = records.readU4();
      long length = records.readU4();
      ByteCursor payload = records.slice(length);

      RecordTag tag = RecordTag.fromCode(code);
      if (tag == null) {
        reporter.report(
            ErrorKind.UNKNOWN_TAG,
            "record "
                + RecordTag.nameOf(code)
                + " at offset "
                + offset
                + ", skipped "
                + length
                + " bytes");
        continue;
      }
      return new TopLevelRecord(tag, timestamp, offset, payload);
    }
    return null;
  }

  /** Rewinds to the first record. */
  public void restart() {
    records.rewind();
  }

  /** Returns the absolute position of the next record header. */
  public long position() {
    return records.position();
  }
}
