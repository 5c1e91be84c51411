package io.jafar.hprof.impl;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.internal.ByteCursor;
import io.jafar.hprof.internal.HprofBuffer;
import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Pass-1 buffer of the sub-records of one segment group that still have to be resolved.
 *
 * <p>Records live in parallel primitive columns addressed by int handles, handed out in stream
 * order. Instance and array bodies are not copied: only their offset and length in the mapped
 * file are kept, and {@link #get(int)} re-creates a cursor over them.
 */
public final class RecordArena {

  private static final byte CLASS = 0;
  private static final byte INSTANCE = 1;
  private static final byte OBJECT_ARRAY = 2;
  private static final byte PRIMITIVE_ARRAY = 3;

  private final HprofBuffer buffer;
  private final int idSize;

  private final ByteArrayList kinds = new ByteArrayList();
  private final LongArrayList offsets = new LongArrayList();
  private final LongArrayList objectIds = new LongArrayList();
  // class id, array class id, element type code or index into classDefs
  private final LongArrayList typeRefs = new LongArrayList();
  private final IntArrayList stackSerials = new IntArrayList();
  private final IntArrayList lengths = new IntArrayList();
  private final LongArrayList dataOffsets = new LongArrayList();
  private final LongArrayList dataSizes = new LongArrayList();
  private final ObjectArrayList<ClassDef> classDefs = new ObjectArrayList<>();

  public RecordArena(HprofBuffer buffer, int idSize) {
    this.buffer = buffer;
    this.idSize = idSize;
  }

  public int add(HeapSubRecord.ClassDump dump) {
    classDefs.add(dump.classDef());
    return append(
        CLASS,
        dump.offset(),
        dump.classDef().classId().value(),
        classDefs.size() - 1,
        dump.stackSerial(),
        0,
        -1,
        0);
  }

  public int add(HeapSubRecord.InstanceDump dump) {
    return append(
        INSTANCE,
        dump.offset(),
        dump.objectId().value(),
        dump.classId().value(),
        dump.stackSerial(),
        0,
        dump.fields().start(),
        dump.fields().length());
  }

  public int add(HeapSubRecord.ObjectArrayDump dump) {
    return append(
        OBJECT_ARRAY,
        dump.offset(),
        dump.objectId().value(),
        dump.arrayClassId().value(),
        dump.stackSerial(),
        dump.length(),
        dump.elements().start(),
        dump.elements().length());
  }

  public int add(HeapSubRecord.PrimitiveArrayDump dump) {
    return append(
        PRIMITIVE_ARRAY,
        dump.offset(),
        dump.objectId().value(),
        dump.elementType().code,
        dump.stackSerial(),
        dump.length(),
        dump.elements().start(),
        dump.elements().length());
  }

  private int append(
      byte kind,
      long offset,
      long objectId,
      long typeRef,
      int stackSerial,
      int length,
      long dataOffset,
      long dataSize) {
    int handle = kinds.size();
    kinds.add(kind);
    offsets.add(offset);
    objectIds.add(objectId);
    typeRefs.add(typeRef);
    stackSerials.add(stackSerial);
    lengths.add(length);
    dataOffsets.add(dataOffset);
    dataSizes.add(dataSize);
    return handle;
  }

  /**
   * Re-creates the sub-record behind a handle.
   *
   * @throws HprofFormatException if the stored body no longer fits the buffer
   */
  public HeapSubRecord get(int handle) throws HprofFormatException {
    long offset = offsets.getLong(handle);
    Identifier objectId = new Identifier(objectIds.getLong(handle), idSize);
    int stackSerial = stackSerials.getInt(handle);
    long typeRef = typeRefs.getLong(handle);
    switch (kinds.getByte(handle)) {
      case CLASS:
        return new HeapSubRecord.ClassDump(offset, stackSerial, classDefs.get((int) typeRef));
      case INSTANCE:
        return new HeapSubRecord.InstanceDump(
            offset, objectId, stackSerial, new Identifier(typeRef, idSize), body(handle));
      case OBJECT_ARRAY:
        return new HeapSubRecord.ObjectArrayDump(
            offset,
            objectId,
            stackSerial,
            new Identifier(typeRef, idSize),
            lengths.getInt(handle),
            body(handle));
      case PRIMITIVE_ARRAY:
        return new HeapSubRecord.PrimitiveArrayDump(
            offset,
            objectId,
            stackSerial,
            BasicType.fromCode((int) typeRef),
            lengths.getInt(handle),
            body(handle));
      default:
        throw new IllegalStateException("Corrupt arena entry " + handle);
    }
  }

  private ByteCursor body(int handle) throws HprofFormatException {
    return ByteCursor.window(
        buffer, idSize, dataOffsets.getLong(handle), dataSizes.getLong(handle));
  }

  public int size() {
    return kinds.size();
  }

  public boolean isEmpty() {
    return kinds.isEmpty();
  }

  /** Drops all records; handles handed out before are invalid afterwards. */
  public void clear() {
    kinds.clear();
    offsets.clear();
    objectIds.clear();
    typeRefs.clear();
    stackSerials.clear();
    lengths.clear();
    dataOffsets.clear();
    dataSizes.clear();
    classDefs.clear();
  }
}
