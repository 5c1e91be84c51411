package io.jafar.hprof.impl;

import io.jafar.hprof.api.DecodeSummary;
import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.GraphSink;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.HprofHeader;
import io.jafar.hprof.api.HprofParser.ParserOptions;
import io.jafar.hprof.api.ResolvedObject;
import io.jafar.hprof.internal.ByteCursor;
import io.jafar.hprof.internal.HprofBuffer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a complete decode: header, top-level records, and the two passes over each heap dump
 * segment group.
 *
 * <p>Pass 1 runs while the group's segments stream by. It registers class dumps, emits GC roots
 * and buffers everything else in the {@link RecordArena}. Pass 2 starts at HEAP_DUMP_END (or at
 * end of input for a group that was never closed) and resolves the buffered records one at a
 * time, in stream order. Classes dumped after their instances therefore resolve fine as long as
 * they belong to the same group.
 */
public final class HeapGraphDecoder {

  private static final Logger LOG = LoggerFactory.getLogger(HeapGraphDecoder.class);

  static final String MAGIC_PREFIX = "JAVA PROFILE ";
  private static final String SUPPORTED_VERSION_PREFIX = "1.0.";
  private static final int MAX_MAGIC_LENGTH = 64;

  private final HprofBuffer buffer;
  private final ParserOptions options;
  private final GraphSink sink;
  private final DecodeErrors errors;

  private final SymbolTable symbols = new SymbolTable();
  private final ClassRegistry registry = new ClassRegistry();

  private RecordArena arena;
  private ReferenceIndex references;
  private ObjectGraphResolver resolver;
  private boolean groupOpen;

  private long recordCount;
  private long classCount;
  private long objectCount;
  private long gcRootCount;

  public HeapGraphDecoder(HprofBuffer buffer, ParserOptions options, GraphSink sink) {
    this.buffer = buffer;
    this.options = options;
    this.sink = sink;
    this.errors = new DecodeErrors(sink);
  }

  /**
   * Reads the file header: a NUL-terminated "JAVA PROFILE 1.0.x" string, the u4 identifier size
   * and the u8 dump timestamp.
   *
   * @throws HprofFormatException with {@link ErrorKind#INVALID_HEADER} if the header is missing,
   *     truncated, of an unsupported version or declares an identifier size other than 4 or 8
   */
  public static HprofHeader readHeader(HprofBuffer buffer) throws HprofFormatException {
    ByteCursor cursor = ByteCursor.over(buffer, 0);
    try {
      ByteArrayOutputStream magic = new ByteArrayOutputStream();
      int b;
      while ((b = cursor.readU1()) != 0) {
        if (magic.size() >= MAX_MAGIC_LENGTH) {
          throw new HprofFormatException(
              ErrorKind.INVALID_HEADER, 0, "no HPROF magic within " + MAX_MAGIC_LENGTH + " bytes");
        }
        magic.write(b);
      }
      String text = magic.toString(StandardCharsets.US_ASCII);
      if (!text.startsWith(MAGIC_PREFIX + SUPPORTED_VERSION_PREFIX)) {
        throw new HprofFormatException(
            ErrorKind.INVALID_HEADER, 0, "unsupported format '" + text + "'");
      }
      long idSizePosition = cursor.position();
      int idSize = cursor.readI4();
      if (idSize != 4 && idSize != 8) {
        throw new HprofFormatException(
            ErrorKind.INVALID_HEADER, idSizePosition, "unsupported identifier size " + idSize);
      }
      long timestamp = cursor.readI8();
      return new HprofHeader(
          text.substring(MAGIC_PREFIX.length()), idSize, timestamp, (int) cursor.position());
    } catch (HprofFormatException e) {
      if (e.kind() == ErrorKind.TRUNCATED_INPUT) {
        throw new HprofFormatException(
            ErrorKind.INVALID_HEADER, e.offset(), "header truncated (" + buffer.size() + " bytes)");
      }
      throw e;
    }
  }

  /**
   * Decodes the whole input, delivering events to the sink.
   *
   * @return the summary also delivered in the final {@link GraphEvent.Finished} event
   * @throws HprofFormatException on a fatal format error
   * @throws IOException if the sink fails
   */
  public DecodeSummary decode() throws IOException {
    HprofHeader header = readHeader(buffer);
    LOG.debug(
        "HPROF {} with {}-byte identifiers, {} bytes",
        header.formatVersion(),
        header.idSize(),
        buffer.size());

    arena = new RecordArena(buffer, header.idSize());
    references = options.describeReferences() ? new ReferenceIndex(registry, symbols) : null;
    resolver = new ObjectGraphResolver(registry, symbols, references);

    ByteCursor records =
        ByteCursor.window(buffer, header.idSize(), header.size(), buffer.size() - header.size());
    TopLevelRecordStream stream = new TopLevelRecordStream(records, errors);

    TopLevelRecord record;
    while ((record = stream.next()) != null) {
      recordCount++;
      if (options.countRecords()) {
        sink.handle(new GraphEvent.RecordCounted(record.tag()));
      }
      if (options.resolveObjects()) {
        dispatch(record);
      }
    }
    if (groupOpen) {
      LOG.debug("Heap dump group still open at end of input, resolving it now");
      closeGroup();
    }

    DecodeSummary summary =
        new DecodeSummary(
            header, recordCount, classCount, objectCount, gcRootCount, errors.counts());
    LOG.debug(
        "Decoded {} records, {} classes, {} objects, {} GC roots ({})",
        recordCount,
        classCount,
        objectCount,
        gcRootCount,
        summary.describeErrors());
    sink.handle(new GraphEvent.Finished(summary));
    return summary;
  }

  private void dispatch(TopLevelRecord record) throws IOException {
    ByteCursor payload = record.payload();
    switch (record.tag()) {
      case STRING -> {
        long id = payload.readId();
        byte[] bytes = payload.readBytes((int) payload.remaining());
        try {
          symbols.insertUtf8(id, bytes);
        } catch (HprofFormatException e) {
          recover(e);
        }
      }
      case LOAD_CLASS -> {
        int classSerial = payload.readI4();
        long classObjectId = payload.readId();
        payload.readI4(); // stack trace serial
        long nameId = payload.readId();
        payload.expectConsumed("LOAD_CLASS");
        symbols.insertClassName(classSerial, classObjectId, nameId);
      }
      case UNLOAD_CLASS -> {
        int classSerial = payload.readI4();
        payload.expectConsumed("UNLOAD_CLASS");
        symbols.unloadClass(classSerial);
      }
      case HEAP_DUMP, HEAP_DUMP_SEGMENT -> scanSegment(record);
      case HEAP_DUMP_END -> {
        payload.expectConsumed("HEAP_DUMP_END");
        closeGroup();
      }
      default -> {
        // stack traces, threads, CPU samples: not part of the object graph
      }
    }
  }

  private void scanSegment(TopLevelRecord record) throws IOException {
    groupOpen = true;
    HeapSegmentDecoder decoder = new HeapSegmentDecoder(record.payload(), errors);
    HeapSubRecord sub;
    while ((sub = decoder.next()) != null) {
      if (sub instanceof HeapSubRecord.GcRootEntry entry) {
        gcRootCount++;
        if (options.includeGcRoots()) {
          sink.handle(new GraphEvent.GcRootFound(entry.root()));
        }
      } else if (sub instanceof HeapSubRecord.ClassDump dump) {
        try {
          registry.register(dump.classDef());
          classCount++;
          arena.add(dump);
        } catch (HprofFormatException e) {
          recover(e);
        }
      } else if (sub instanceof HeapSubRecord.InstanceDump dump) {
        arena.add(dump);
        if (references != null) {
          references.addObject(dump.objectId().value(), dump.classId().value());
        }
      } else if (sub instanceof HeapSubRecord.ObjectArrayDump dump) {
        arena.add(dump);
        if (references != null) {
          references.addObject(dump.objectId().value(), dump.arrayClassId().value());
        }
      } else if (sub instanceof HeapSubRecord.PrimitiveArrayDump dump) {
        arena.add(dump);
        if (references != null) {
          references.addPrimitiveArray(dump.objectId().value(), dump.elementType());
        }
      }
    }
  }

  private void closeGroup() throws IOException {
    LOG.debug("Resolving {} buffered heap records", arena.size());
    for (int handle = 0; handle < arena.size(); handle++) {
      HeapSubRecord sub = arena.get(handle);
      try {
        if (sub instanceof HeapSubRecord.ClassDump dump) {
          sink.handle(
              new GraphEvent.ClassResolved(
                  dump.classDef(),
                  symbols.displayClassName(dump.classDef().classId().value()),
                  resolver.resolveStatics(dump.classDef())));
        } else {
          emit(resolveObject(sub));
        }
      } catch (HprofFormatException e) {
        recover(e);
      }
    }
    arena.clear();
    if (references != null) {
      references.clear();
    }
    groupOpen = false;
  }

  private ResolvedObject resolveObject(HeapSubRecord sub) throws HprofFormatException {
    if (sub instanceof HeapSubRecord.InstanceDump dump) {
      return resolver.resolve(dump);
    } else if (sub instanceof HeapSubRecord.ObjectArrayDump dump) {
      return resolver.resolve(dump);
    } else if (sub instanceof HeapSubRecord.PrimitiveArrayDump dump) {
      return resolver.resolve(dump);
    }
    throw new IllegalStateException("Not an object record: " + sub);
  }

  private void emit(ResolvedObject object) throws IOException {
    objectCount++;
    sink.handle(new GraphEvent.ObjectResolved(object));
  }

  private void recover(HprofFormatException e) throws IOException {
    if (e.isFatal()) {
      throw e;
    }
    errors.report(e.kind(), e.detail());
  }
}
