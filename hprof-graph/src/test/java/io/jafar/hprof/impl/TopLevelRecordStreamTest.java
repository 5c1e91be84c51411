package io.jafar.hprof.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.RecordTag;
import io.jafar.hprof.internal.ByteCursor;
import io.jafar.hprof.internal.HprofBuffer;
import io.jafar.hprof.test.HprofFileBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TopLevelRecordStreamTest {

  private final List<ErrorKind> reported = new ArrayList<>();

  private TopLevelRecordStream stream(byte[] file, int idSize) throws HprofFormatException {
    HprofBuffer buffer = HprofBuffer.wrap(file);
    int header = HprofFileBuilder.headerSize();
    ByteCursor records = ByteCursor.window(buffer, idSize, header, buffer.size() - header);
    return new TopLevelRecordStream(records, (kind, context) -> reported.add(kind));
  }

  @Test
  void payloadsMatchDeclaredLengthsWithoutDrift() throws Exception {
    byte[] file =
        HprofFileBuilder.create(8)
            .string(1, "hello")
            .record(0x0A, new byte[24])
            .loadClass(1, 100, 1)
            .heapDumpEnd()
            .build();

    TopLevelRecordStream stream = stream(file, 8);
    long expectedPosition = HprofFileBuilder.headerSize();
    long[] lengths = {8 + 5, 24, 4 + 8 + 4 + 8, 0};
    RecordTag[] tags = {
      RecordTag.STRING, RecordTag.START_THREAD, RecordTag.LOAD_CLASS, RecordTag.HEAP_DUMP_END
    };
    for (int i = 0; i < lengths.length; i++) {
      TopLevelRecord record = stream.next();
      assertNotNull(record);
      assertEquals(tags[i], record.tag());
      assertEquals(expectedPosition, record.offset());
      assertEquals(lengths[i], record.length());
      assertEquals(lengths[i], record.payload().remaining());
      expectedPosition += TopLevelRecordStream.RECORD_HEADER_SIZE + lengths[i];
      assertEquals(expectedPosition, stream.position());
    }
    assertNull(stream.next());
    assertEquals(file.length, expectedPosition);
  }

  @Test
  void unknownTagIsReportedAndSkipped() throws Exception {
    byte[] file =
        HprofFileBuilder.create(4)
            .record(0x42, new byte[] {1, 2, 3})
            .string(7, "after")
            .build();

    TopLevelRecordStream stream = stream(file, 4);
    TopLevelRecord record = stream.next();
    assertEquals(RecordTag.STRING, record.tag());
    assertEquals(List.of(ErrorKind.UNKNOWN_TAG), reported);
    assertNull(stream.next());
  }

  @Test
  void endOfInputInsideRecordHeaderIsTruncation() throws Exception {
    byte[] file = HprofFileBuilder.create(8).string(1, "x").raw(new byte[] {0x01, 0, 0}).build();
    TopLevelRecordStream stream = stream(file, 8);
    assertNotNull(stream.next());
    HprofFormatException e = assertThrows(HprofFormatException.class, stream::next);
    assertEquals(ErrorKind.TRUNCATED_INPUT, e.kind());
  }

  @Test
  void declaredLengthPastEndOfInputIsTruncation() throws Exception {
    // STRING header claims 100 bytes, only 8 follow
    byte[] file =
        HprofFileBuilder.create(8)
            .raw(new byte[] {0x01, 0, 0, 0, 0, 0, 0, 0, 100})
            .raw(new byte[8])
            .build();
    HprofFormatException e = assertThrows(HprofFormatException.class, stream(file, 8)::next);
    assertEquals(ErrorKind.TRUNCATED_INPUT, e.kind());
    assertEquals(HprofFileBuilder.headerSize() + 9, e.offset());
  }

  @Test
  void restartRewindsToFirstRecord() throws Exception {
    byte[] file = HprofFileBuilder.create(8).string(1, "a").string(2, "b").build();
    TopLevelRecordStream stream = stream(file, 8);
    stream.next();
    stream.next();
    assertNull(stream.next());

    stream.restart();
    TopLevelRecord first = stream.next();
    assertEquals(HprofFileBuilder.headerSize(), first.offset());
    assertEquals(1, first.payload().readId());
  }
}
