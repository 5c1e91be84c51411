package io.jafar.hprof.internal;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;

/**
 * Decoder for HotSpot's modified UTF-8 (the encoding of {@code DataInput.readUTF} without the
 * length prefix). Symbols in HPROF STRING records use it: NUL is written as {@code C0 80} and
 * supplementary characters as two 3-byte surrogates, both of which strict UTF-8 rejects.
 */
public final class ModifiedUtf8 {
  private ModifiedUtf8() {}

  /**
   * Decodes modified UTF-8 bytes.
   *
   * @throws CharacterCodingException on a malformed or truncated sequence
   */
  public static String decode(byte[] bytes) throws CharacterCodingException {
    boolean ascii = true;
    for (byte b : bytes) {
      if ((b & 0x80) != 0) {
        ascii = false;
        break;
      }
    }
    if (ascii) {
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    StringBuilder sb = new StringBuilder(bytes.length);
    int i = 0;
    while (i < bytes.length) {
      int b = bytes[i] & 0xFF;
      if (b <= 0x7F) {
        sb.append((char) b);
        i++;
      } else if ((b & 0xE0) == 0xC0) {
        if (i + 1 >= bytes.length || !isContinuation(bytes[i + 1])) {
          throw new MalformedInputException(1);
        }
        sb.append((char) (((b & 0x1F) << 6) | (bytes[i + 1] & 0x3F)));
        i += 2;
      } else if ((b & 0xF0) == 0xE0) {
        if (i + 2 >= bytes.length
            || !isContinuation(bytes[i + 1])
            || !isContinuation(bytes[i + 2])) {
          throw new MalformedInputException(1);
        }
        sb.append(
            (char) (((b & 0x0F) << 12) | ((bytes[i + 1] & 0x3F) << 6) | (bytes[i + 2] & 0x3F)));
        i += 3;
      } else {
        // 4-byte forms and stray continuation bytes never occur in modified UTF-8
        throw new MalformedInputException(1);
      }
    }
    return sb.toString();
  }

  private static boolean isContinuation(byte b) {
    return (b & 0xC0) == 0x80;
  }
}
