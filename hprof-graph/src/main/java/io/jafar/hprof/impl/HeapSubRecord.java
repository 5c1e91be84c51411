package io.jafar.hprof.impl;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.GcRoot;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.internal.ByteCursor;

/**
 * One sub-record of a HEAP_DUMP or HEAP_DUMP_SEGMENT payload. Instance and array bodies are kept
 * as cursors over the mapped file and decoded only when resolved.
 */
public sealed interface HeapSubRecord
    permits HeapSubRecord.GcRootEntry,
        HeapSubRecord.ClassDump,
        HeapSubRecord.InstanceDump,
        HeapSubRecord.ObjectArrayDump,
        HeapSubRecord.PrimitiveArrayDump {

  /** Absolute file offset of the sub-record tag. */
  long offset();

  record GcRootEntry(long offset, GcRoot root) implements HeapSubRecord {}

  /** A CLASS_DUMP with its static values already decoded. */
  record ClassDump(long offset, int stackSerial, ClassDef classDef) implements HeapSubRecord {}

  /**
   * An INSTANCE_DUMP.
   *
   * @param fields cursor over exactly the declared field blob
   */
  record InstanceDump(
      long offset, Identifier objectId, int stackSerial, Identifier classId, ByteCursor fields)
      implements HeapSubRecord {}

  /**
   * An OBJ_ARRAY_DUMP.
   *
   * @param elements cursor over {@code length} identifiers
   */
  record ObjectArrayDump(
      long offset,
      Identifier objectId,
      int stackSerial,
      Identifier arrayClassId,
      int length,
      ByteCursor elements)
      implements HeapSubRecord {}

  /**
   * A PRIM_ARRAY_DUMP.
   *
   * @param elements cursor over {@code length} values of {@code elementType}
   */
  record PrimitiveArrayDump(
      long offset,
      Identifier objectId,
      int stackSerial,
      BasicType elementType,
      int length,
      ByteCursor elements)
      implements HeapSubRecord {}
}
