package io.jafar.hprof.internal;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import java.util.Objects;

/**
 * Bounds-checked, forward-only reader over a window {@code [start, limit)} of an {@link
 * HprofBuffer}. All multi-byte values are big-endian (HPROF wire order).
 *
 * <p>A read that needs more bytes than remain in the window fails with {@link
 * ErrorKind#TRUNCATED_INPUT} and leaves the position unchanged. {@link #slice(long)} hands out a
 * nested window without copying, so a sub-record decoder can never read past the payload it was
 * given.
 */
public final class ByteCursor {

  private final HprofBuffer buffer;
  private final int idSize;
  private final long start;
  private final long limit;
  private long position;

  private ByteCursor(HprofBuffer buffer, int idSize, long start, long limit) {
    this.buffer = buffer;
    this.idSize = idSize;
    this.start = start;
    this.limit = limit;
    this.position = start;
  }

  /**
   * Creates a cursor over the whole buffer.
   *
   * @param idSize identifier width in bytes, 0 while it is still unknown (before the header)
   */
  public static ByteCursor over(HprofBuffer buffer, int idSize) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    return new ByteCursor(buffer, idSize, 0, buffer.size());
  }

  /**
   * Creates a cursor over {@code [offset, offset + length)} of the buffer.
   *
   * @throws HprofFormatException if the window exceeds the buffer
   */
  public static ByteCursor window(HprofBuffer buffer, int idSize, long offset, long length)
      throws HprofFormatException {
    if (offset < 0 || length < 0 || offset + length > buffer.size()) {
      throw new HprofFormatException(
          ErrorKind.TRUNCATED_INPUT,
          offset,
          "window of " + length + " bytes exceeds input of " + buffer.size() + " bytes");
    }
    return new ByteCursor(buffer, idSize, offset, offset + length);
  }

  public int idSize() {
    return idSize;
  }

  /** Returns the absolute position in the underlying buffer. */
  public long position() {
    return position;
  }

  /** Returns the absolute offset where this window starts. */
  public long start() {
    return start;
  }

  /** Returns the window length. */
  public long length() {
    return limit - start;
  }

  public long remaining() {
    return limit - position;
  }

  public boolean hasRemaining() {
    return position < limit;
  }

  /** Returns an independent cursor over the same window, positioned at its start. */
  public ByteCursor duplicate() {
    return new ByteCursor(buffer, idSize, start, limit);
  }

  /** Moves back to the start of the window. */
  public void rewind() {
    position = start;
  }

  private long require(long n) throws HprofFormatException {
    if (n < 0 || n > limit - position) {
      throw new HprofFormatException(
          ErrorKind.TRUNCATED_INPUT,
          position,
          "need " + n + " bytes, " + (limit - position) + " remaining");
    }
    long at = position;
    position += n;
    return at;
  }

  public int readU1() throws HprofFormatException {
    return buffer.get(require(1)) & 0xFF;
  }

  public int readU2() throws HprofFormatException {
    return buffer.getShort(require(2)) & 0xFFFF;
  }

  public int readI4() throws HprofFormatException {
    return buffer.getInt(require(4));
  }

  /** Reads a 4-byte unsigned integer as long. */
  public long readU4() throws HprofFormatException {
    return buffer.getInt(require(4)) & 0xFFFFFFFFL;
  }

  /** Reads an 8-byte integer; u8 values above {@code Long.MAX_VALUE} come back negative. */
  public long readI8() throws HprofFormatException {
    return buffer.getLong(require(8));
  }

  /** Reads an object ID (4 or 8 bytes depending on the file's identifier size). */
  public long readId() throws HprofFormatException {
    return switch (idSize) {
      case 4 -> readU4();
      case 8 -> readI8();
      default -> throw new IllegalStateException("Identifier size not set: " + idSize);
    };
  }

  public float readFloat() throws HprofFormatException {
    return Float.intBitsToFloat(readI4());
  }

  public double readDouble() throws HprofFormatException {
    return Double.longBitsToDouble(readI8());
  }

  /** Reads {@code n} bytes into a new array. */
  public byte[] readBytes(int n) throws HprofFormatException {
    long at = require(n);
    byte[] dest = new byte[n];
    buffer.get(at, dest, 0, n);
    return dest;
  }

  public void skip(long n) throws HprofFormatException {
    require(n);
  }

  /** Skips whatever is left in the window. */
  public void skipRemaining() {
    position = limit;
  }

  /**
   * Returns a zero-copy cursor over the next {@code n} bytes and advances past them.
   *
   * @throws HprofFormatException if fewer than {@code n} bytes remain
   */
  public ByteCursor slice(long n) throws HprofFormatException {
    long at = require(n);
    return new ByteCursor(buffer, idSize, at, at + n);
  }

  /**
   * Checks that the window has been read completely.
   *
   * @param context what was being decoded, for the error message
   * @throws HprofFormatException with {@link ErrorKind#UNCONSUMED_PAYLOAD} if bytes remain
   */
  public void expectConsumed(String context) throws HprofFormatException {
    if (position != limit) {
      throw new HprofFormatException(
          ErrorKind.UNCONSUMED_PAYLOAD,
          position,
          context + " left " + (limit - position) + " of " + (limit - start) + " bytes unread");
    }
  }

  @Override
  public String toString() {
    return "ByteCursor[" + start + ".." + limit + ", position=" + position + "]";
  }
}
