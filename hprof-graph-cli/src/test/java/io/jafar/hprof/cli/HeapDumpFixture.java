package io.jafar.hprof.cli;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes a small heap dump with 8-byte identifiers:
 *
 * <ul>
 *   <li>class {@code com.example.Foo} (0x100) with static {@code int COUNT = 3} and fields {@code
 *       int x}, {@code Foo next}
 *   <li>class {@code java.lang.Object[]} (0x200)
 *   <li>Foo 0x1000 (x=42, next=0x1010) and Foo 0x1010 (x=7, next=null)
 *   <li>Object[] 0x2000 = {0x1000, null}
 *   <li>byte[] 0x3000 = {0x1F, 0x7F}
 * </ul>
 */
final class HeapDumpFixture {

  static final String EXPECTED_DUMP =
      String.join(
          System.lineSeparator(),
          "",
          "id 256: class com.example.Foo",
          "  - COUNT: int = 3",
          "",
          "id 512: class java.lang.Object[]",
          "",
          "id 4096: com.example.Foo",
          "  - x: int = 42",
          "  - next = id 4112 (com.example.Foo)",
          "",
          "id 4112: com.example.Foo",
          "  - x: int = 7",
          "  - next = null",
          "",
          "id 8192: java.lang.Object[] = [",
          "  - id 4096: com.example.Foo",
          "  - null",
          "]",
          "",
          "12288: byte[] = [0x1F, 0x7F, ]",
          "");

  private static final int STRING = 0x01;
  private static final int LOAD_CLASS = 0x02;
  private static final int HEAP_DUMP_SEGMENT = 0x1C;
  private static final int HEAP_DUMP_END = 0x2C;

  private static final int INT = 10;
  private static final int OBJECT = 2;
  private static final int BYTE = 8;

  private HeapDumpFixture() {}

  static Path write(Path dir) throws IOException {
    return write(dir.resolve("fixture.hprof"), bytes());
  }

  /** Writes the fixture cut off inside the last record header. */
  static Path writeTruncated(Path dir) throws IOException {
    byte[] bytes = bytes();
    return write(dir.resolve("truncated.hprof"), Arrays.copyOf(bytes, bytes.length - 5));
  }

  /** Writes the fixture followed by an empty record with the undefined tag 0x99. */
  static Path writeWithUnknownRecord(Path dir) throws IOException {
    byte[] bytes = bytes();
    byte[] extended = Arrays.copyOf(bytes, bytes.length + 9);
    extended[bytes.length] = (byte) 0x99;
    return write(dir.resolve("unknown-tag.hprof"), extended);
  }

  private static Path write(Path file, byte[] bytes) throws IOException {
    Files.write(file, bytes);
    return file;
  }

  static byte[] bytes() throws IOException {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    DataOutputStream out = new DataOutputStream(buf);
    out.write("JAVA PROFILE 1.0.2".getBytes(StandardCharsets.US_ASCII));
    out.writeByte(0);
    out.writeInt(8);
    out.writeLong(1_700_000_000_000L);

    string(out, 1, "com/example/Foo");
    string(out, 2, "x");
    string(out, 3, "next");
    string(out, 4, "[Ljava/lang/Object;");
    string(out, 5, "COUNT");

    loadClass(out, 1, 0x100, 1);
    loadClass(out, 2, 0x200, 4);

    ByteArrayOutputStream segBuf = new ByteArrayOutputStream();
    DataOutputStream seg = new DataOutputStream(segBuf);
    // ROOT_UNKNOWN
    seg.writeByte(0xFF);
    seg.writeLong(0x1000);

    // CLASS_DUMP Foo
    seg.writeByte(0x20);
    seg.writeLong(0x100);
    seg.writeInt(0);
    for (int i = 0; i < 6; i++) {
      seg.writeLong(0); // super, loader, signers, protection domain, reserved x2
    }
    seg.writeInt(12);
    seg.writeShort(0);
    seg.writeShort(1);
    seg.writeLong(5);
    seg.writeByte(INT);
    seg.writeInt(3);
    seg.writeShort(2);
    seg.writeLong(2);
    seg.writeByte(INT);
    seg.writeLong(3);
    seg.writeByte(OBJECT);

    // CLASS_DUMP Object[]
    seg.writeByte(0x20);
    seg.writeLong(0x200);
    seg.writeInt(0);
    for (int i = 0; i < 6; i++) {
      seg.writeLong(0);
    }
    seg.writeInt(0);
    seg.writeShort(0);
    seg.writeShort(0);
    seg.writeShort(0);

    instance(seg, 0x1000, 42, 0x1010);
    instance(seg, 0x1010, 7, 0);

    // OBJ_ARRAY_DUMP
    seg.writeByte(0x22);
    seg.writeLong(0x2000);
    seg.writeInt(0);
    seg.writeInt(2);
    seg.writeLong(0x200);
    seg.writeLong(0x1000);
    seg.writeLong(0);

    // PRIM_ARRAY_DUMP
    seg.writeByte(0x23);
    seg.writeLong(0x3000);
    seg.writeInt(0);
    seg.writeInt(2);
    seg.writeByte(BYTE);
    seg.writeByte(0x1F);
    seg.writeByte(0x7F);

    record(out, HEAP_DUMP_SEGMENT, segBuf.toByteArray());
    record(out, HEAP_DUMP_END, new byte[0]);
    out.flush();
    return buf.toByteArray();
  }

  private static void instance(DataOutputStream seg, long id, int x, long next)
      throws IOException {
    seg.writeByte(0x21);
    seg.writeLong(id);
    seg.writeInt(0);
    seg.writeLong(0x100);
    seg.writeInt(12);
    seg.writeInt(x);
    seg.writeLong(next);
  }

  private static void string(DataOutputStream out, long id, String value) throws IOException {
    byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream payload = new ByteArrayOutputStream();
    DataOutputStream p = new DataOutputStream(payload);
    p.writeLong(id);
    p.write(utf8);
    record(out, STRING, payload.toByteArray());
  }

  private static void loadClass(DataOutputStream out, int serial, long classId, long nameId)
      throws IOException {
    ByteArrayOutputStream payload = new ByteArrayOutputStream();
    DataOutputStream p = new DataOutputStream(payload);
    p.writeInt(serial);
    p.writeLong(classId);
    p.writeInt(0);
    p.writeLong(nameId);
    record(out, LOAD_CLASS, payload.toByteArray());
  }

  private static void record(DataOutputStream out, int tag, byte[] payload) throws IOException {
    out.writeByte(tag);
    out.writeInt(0);
    out.writeInt(payload.length);
    out.write(payload);
  }
}
