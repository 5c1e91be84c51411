package io.jafar.hprof.impl;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.GcRoot;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.internal.ByteCursor;
import io.jafar.hprof.internal.HeapTag;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one HEAP_DUMP / HEAP_DUMP_SEGMENT payload into sub-records.
 *
 * <p>Sub-records carry no length prefix, so every layout is decoded field by field with the
 * file's identifier width. A sub-record that runs past the payload is {@link
 * ErrorKind#TRUNCATED_INPUT}. An unknown sub-record tag, or a type code that leaves the record
 * size undefined, is reported as {@link ErrorKind#UNKNOWN_SUB_RECORD} and the rest of the payload
 * is skipped.
 */
public final class HeapSegmentDecoder {

  private final ByteCursor payload;
  private final ErrorReporter reporter;
  private final int idSize;

  public HeapSegmentDecoder(ByteCursor payload, ErrorReporter reporter) {
    this.payload = payload;
    this.reporter = reporter;
    this.idSize = payload.idSize();
  }

  /**
   * Decodes the next sub-record.
   *
   * @return the sub-record, or null once the payload is exhausted
   * @throws HprofFormatException if a sub-record is truncated
   * @throws IOException if reporting an unknown sub-record fails
   */
  public HeapSubRecord next() throws IOException {
    if (!payload.hasRemaining()) {
      return null;
    }
    long offset = payload.position();
    int subTag = payload.readU1();
    try {
      return switch (subTag) {
        case HeapTag.ROOT_UNKNOWN -> root(offset, GcRoot.Type.UNKNOWN);
        case HeapTag.ROOT_JNI_GLOBAL -> rootJniGlobal(offset);
        case HeapTag.ROOT_JNI_LOCAL -> rootWithFrame(offset, GcRoot.Type.JNI_LOCAL);
        case HeapTag.ROOT_JAVA_FRAME -> rootWithFrame(offset, GcRoot.Type.JAVA_FRAME);
        case HeapTag.ROOT_NATIVE_STACK -> rootWithThread(offset, GcRoot.Type.NATIVE_STACK);
        case HeapTag.ROOT_STICKY_CLASS -> root(offset, GcRoot.Type.STICKY_CLASS);
        case HeapTag.ROOT_THREAD_BLOCK -> rootWithThread(offset, GcRoot.Type.THREAD_BLOCK);
        case HeapTag.ROOT_MONITOR_USED -> root(offset, GcRoot.Type.MONITOR_USED);
        case HeapTag.ROOT_THREAD_OBJ -> rootThreadObj(offset);
        case HeapTag.CLASS_DUMP -> classDump(offset);
        case HeapTag.INSTANCE_DUMP -> instanceDump(offset);
        case HeapTag.OBJ_ARRAY_DUMP -> objectArrayDump(offset);
        case HeapTag.PRIM_ARRAY_DUMP -> primitiveArrayDump(offset);
        default -> throw new HprofFormatException(
            ErrorKind.UNKNOWN_SUB_RECORD, offset, "sub-record " + HeapTag.nameOf(subTag));
      };
    } catch (HprofFormatException e) {
      if (e.isFatal()) {
        throw e;
      }
      // Sub-records have no length prefix: there is no way to find the next one
      reporter.report(
          e.kind(), e.detail() + ", skipped " + payload.remaining() + " bytes of segment");
      payload.skipRemaining();
      return null;
    }
  }

  private Identifier id() throws HprofFormatException {
    return new Identifier(payload.readId(), idSize);
  }

  private BasicType basicType(String what) throws HprofFormatException {
    long at = payload.position();
    int code = payload.readU1();
    BasicType type = BasicType.fromCode(code);
    if (type == null) {
      throw new HprofFormatException(
          ErrorKind.UNKNOWN_SUB_RECORD, at, "unknown basic type " + code + " for " + what);
    }
    return type;
  }

  private HeapSubRecord root(long offset, GcRoot.Type type) throws HprofFormatException {
    return new HeapSubRecord.GcRootEntry(offset, new GcRoot(type, id(), -1, -1, 0));
  }

  private HeapSubRecord rootJniGlobal(long offset) throws HprofFormatException {
    Identifier objectId = id();
    long globalRefId = payload.readId();
    return new HeapSubRecord.GcRootEntry(
        offset, new GcRoot(GcRoot.Type.JNI_GLOBAL, objectId, -1, -1, globalRefId));
  }

  private HeapSubRecord rootWithFrame(long offset, GcRoot.Type type)
      throws HprofFormatException {
    Identifier objectId = id();
    int threadSerial = payload.readI4();
    int frameNumber = payload.readI4();
    return new HeapSubRecord.GcRootEntry(
        offset, new GcRoot(type, objectId, threadSerial, frameNumber, 0));
  }

  private HeapSubRecord rootWithThread(long offset, GcRoot.Type type)
      throws HprofFormatException {
    Identifier objectId = id();
    int threadSerial = payload.readI4();
    return new HeapSubRecord.GcRootEntry(offset, new GcRoot(type, objectId, threadSerial, -1, 0));
  }

  private HeapSubRecord rootThreadObj(long offset) throws HprofFormatException {
    Identifier objectId = id();
    int threadSerial = payload.readI4();
    int stackTraceSerial = payload.readI4();
    return new HeapSubRecord.GcRootEntry(
        offset,
        new GcRoot(GcRoot.Type.THREAD_OBJ, objectId, threadSerial, -1, stackTraceSerial));
  }

  private HeapSubRecord classDump(long offset) throws HprofFormatException {
    Identifier classId = id();
    int stackSerial = payload.readI4();
    Identifier superClassId = id();
    Identifier classLoaderId = id();
    payload.readId(); // signers
    payload.readId(); // protection domain
    payload.readId(); // reserved
    payload.readId(); // reserved
    int instanceSize = payload.readI4();

    // Constant pool entries are never referenced by HotSpot dumps
    int cpSize = payload.readU2();
    for (int i = 0; i < cpSize; i++) {
      payload.readU2();
      BasicType type = basicType("constant pool entry of " + classId);
      payload.skip(type.sizeOf(idSize));
    }

    int staticCount = payload.readU2();
    List<ClassDef.StaticField> statics = new ArrayList<>(staticCount);
    for (int i = 0; i < staticCount; i++) {
      Identifier nameId = id();
      BasicType type = basicType("static field of " + classId);
      statics.add(new ClassDef.StaticField(nameId, ObjectGraphResolver.readValue(payload, type)));
    }

    int fieldCount = payload.readU2();
    List<ClassDef.FieldDecl> fields = new ArrayList<>(fieldCount);
    for (int i = 0; i < fieldCount; i++) {
      Identifier nameId = id();
      BasicType type = basicType("instance field of " + classId);
      fields.add(new ClassDef.FieldDecl(nameId, type));
    }

    return new HeapSubRecord.ClassDump(
        offset,
        stackSerial,
        new ClassDef(classId, superClassId, classLoaderId, instanceSize, fields, statics));
  }

  private HeapSubRecord instanceDump(long offset) throws HprofFormatException {
    Identifier objectId = id();
    int stackSerial = payload.readI4();
    Identifier classId = id();
    long dataSize = payload.readU4();
    ByteCursor fields = payload.slice(dataSize);
    return new HeapSubRecord.InstanceDump(offset, objectId, stackSerial, classId, fields);
  }

  private HeapSubRecord objectArrayDump(long offset) throws HprofFormatException {
    Identifier objectId = id();
    int stackSerial = payload.readI4();
    int length = payload.readI4();
    Identifier arrayClassId = id();
    ByteCursor elements = payload.slice((long) length * idSize);
    return new HeapSubRecord.ObjectArrayDump(
        offset, objectId, stackSerial, arrayClassId, length, elements);
  }

  private HeapSubRecord primitiveArrayDump(long offset) throws HprofFormatException {
    Identifier objectId = id();
    int stackSerial = payload.readI4();
    int length = payload.readI4();
    BasicType elementType = basicType("primitive array " + objectId);
    if (!elementType.isPrimitive()) {
      throw new HprofFormatException(
          ErrorKind.UNKNOWN_SUB_RECORD, offset, "primitive array " + objectId + " of objects");
    }
    ByteCursor elements = payload.slice((long) length * elementType.sizeOf(idSize));
    return new HeapSubRecord.PrimitiveArrayDump(
        offset, objectId, stackSerial, elementType, length, elements);
  }
}
