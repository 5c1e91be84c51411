package io.jafar.hprof.internal;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HprofBufferTest {

  @TempDir Path tempDir;

  private Path writeLongs(long... values) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(bytes);
    for (long v : values) {
      out.writeLong(v);
    }
    Path file = tempDir.resolve("data.bin");
    Files.write(file, bytes.toByteArray());
    return file;
  }

  @Test
  void smallFileIsMappedAsOneRegion() throws IOException {
    Path file = writeLongs(1, 2);
    try (HprofBuffer buffer = HprofBuffer.map(file, 1024)) {
      assertInstanceOf(HprofBuffer.ByteBufferWrapper.class, buffer);
      assertEquals(16, buffer.size());
      assertEquals(2, buffer.getLong(8));
    }
  }

  @Test
  void valuesCrossingSpliceBoundariesAreStitched() throws IOException {
    Path file = writeLongs(0x0102030405060708L, 0x1112131415161718L, -1L);
    // 24 bytes in splices of 20: the third long starts at 16 and crosses into splice 2
    try (HprofBuffer buffer = HprofBuffer.map(file, 20)) {
      assertInstanceOf(HprofBuffer.SplicedMappedBuffer.class, buffer);
      assertEquals(24, buffer.size());
      assertEquals(0x1112131415161718L, buffer.getLong(8));
      assertEquals(-1L, buffer.getLong(16));
      assertEquals(0x15161718, buffer.getInt(12));
      assertEquals((short) 0x1718, buffer.getShort(14));
      assertEquals((short) 0xFFFF, buffer.getShort(19));
      assertEquals(0x18FFFFFF, buffer.getInt(15));

      byte[] dest = new byte[6];
      buffer.get(15, dest, 0, 6);
      assertArrayEquals(new byte[] {0x18, -1, -1, -1, -1, -1}, dest);
    }
  }

  @Test
  void cursorReadsAcrossSplices() throws Exception {
    Path file = writeLongs(42L, 0xCAFEBABEL);
    try (HprofBuffer buffer = HprofBuffer.map(file, 12)) {
      ByteCursor cursor = ByteCursor.over(buffer, 8);
      cursor.skip(4);
      assertEquals(42, cursor.readI4());
      assertEquals(0xCAFEBABEL, cursor.readI8());
    }
  }

  @Test
  void wrapsInMemoryData() {
    HprofBuffer buffer = HprofBuffer.wrap(new byte[] {0, 0, 0, 5});
    assertEquals(4, buffer.size());
    assertEquals(5, buffer.getInt(0));
  }
}
