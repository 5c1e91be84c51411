package io.jafar.hprof.internal;

import static org.junit.jupiter.api.Assertions.*;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import org.junit.jupiter.api.Test;

class ByteCursorTest {

  private static ByteCursor cursor(int idSize, int... bytes) {
    byte[] data = new byte[bytes.length];
    for (int i = 0; i < bytes.length; i++) {
      data[i] = (byte) bytes[i];
    }
    return ByteCursor.over(HprofBuffer.wrap(data), idSize);
  }

  @Test
  void readsBigEndianValues() throws Exception {
    ByteCursor c =
        cursor(8, 0xAB, 0x12, 0x34, 0xFF, 0xFF, 0xFF, 0xFE, 0, 0, 0, 0, 0, 0, 1, 0);
    assertEquals(0xAB, c.readU1());
    assertEquals(0x1234, c.readU2());
    assertEquals(-2, c.readI4());
    assertEquals(256L, c.readI8());
    assertFalse(c.hasRemaining());
  }

  @Test
  void readsUnsignedFourByteIdentifiers() throws Exception {
    ByteCursor c = cursor(4, 0xFF, 0xFF, 0xFF, 0xF0);
    assertEquals(0xFFFFFFF0L, c.readId(), "4-byte ids must not be sign extended");
  }

  @Test
  void readsEightByteIdentifiers() throws Exception {
    ByteCursor c = cursor(8, 0x80, 0, 0, 0, 0, 0, 0, 1);
    assertEquals(0x8000000000000001L, c.readId());
  }

  @Test
  void truncatedReadFailsWithoutMovingPosition() {
    ByteCursor c = cursor(8, 1, 2, 3);
    HprofFormatException e = assertThrows(HprofFormatException.class, c::readI4);
    assertEquals(ErrorKind.TRUNCATED_INPUT, e.kind());
    assertTrue(e.isFatal());
    assertEquals(0, c.position());
    assertEquals(3, c.remaining());
  }

  @Test
  void sliceIsBoundedAndAdvancesParent() throws Exception {
    ByteCursor c = cursor(4, 0, 0, 0, 7, 0, 0, 0, 9);
    ByteCursor slice = c.slice(4);
    assertEquals(4, c.position());
    assertEquals(0, slice.start());
    assertEquals(7, slice.readI4());
    assertThrows(HprofFormatException.class, slice::readU1, "slice must stop at its own end");
    assertEquals(9, c.readI4());
  }

  @Test
  void sliceLargerThanRemainingIsTruncation() {
    ByteCursor c = cursor(4, 1, 2);
    HprofFormatException e = assertThrows(HprofFormatException.class, () -> c.slice(3));
    assertEquals(ErrorKind.TRUNCATED_INPUT, e.kind());
  }

  @Test
  void expectConsumedReportsLeftoverBytes() throws Exception {
    ByteCursor c = cursor(4, 1, 2, 3);
    c.readU2();
    HprofFormatException e =
        assertThrows(HprofFormatException.class, () -> c.expectConsumed("LOAD_CLASS"));
    assertEquals(ErrorKind.UNCONSUMED_PAYLOAD, e.kind());
    assertTrue(e.getMessage().contains("LOAD_CLASS"));
    c.readU1();
    c.expectConsumed("LOAD_CLASS");
  }

  @Test
  void duplicateStartsAtWindowStart() throws Exception {
    ByteCursor c = cursor(4, 5, 6);
    c.readU1();
    ByteCursor copy = c.duplicate();
    assertEquals(5, copy.readU1());
    assertEquals(6, c.readU1());
  }

  @Test
  void windowOutsideBufferIsRejected() {
    HprofBuffer buffer = HprofBuffer.wrap(new byte[4]);
    assertThrows(HprofFormatException.class, () -> ByteCursor.window(buffer, 4, 2, 3));
  }

  @Test
  void readsFloatingPointBits() throws Exception {
    ByteCursor c = cursor(4, 0x3F, 0x80, 0, 0, 0x40, 0, 0, 0, 0, 0, 0, 0);
    assertEquals(1.0f, c.readFloat());
    assertEquals(2.0, c.readDouble());
  }
}
