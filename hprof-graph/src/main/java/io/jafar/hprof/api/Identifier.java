package io.jafar.hprof.api;

/**
 * An opaque heap object or class reference. The width (4 or 8 bytes) is fixed per file by the
 * header; 4-byte identifiers are kept unsigned. Value 0 is the null reference.
 */
public record Identifier(long value, int width) {

  public Identifier {
    if (width != 4 && width != 8) {
      throw new IllegalArgumentException("Invalid identifier width: " + width);
    }
    if (width == 4 && (value & 0xFFFFFFFF00000000L) != 0) {
      throw new IllegalArgumentException(
          "Value 0x" + Long.toHexString(value) + " does not fit a 4-byte identifier");
    }
  }

  /** Returns the null identifier for the given width. */
  public static Identifier nullId(int width) {
    return new Identifier(0, width);
  }

  public boolean isNull() {
    return value == 0;
  }

  @Override
  public String toString() {
    return "0x" + Long.toHexString(value);
  }
}
