package io.jafar.hprof.impl;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.FieldValue;
import it.unimi.dsi.fastutil.longs.Long2ByteOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;

/**
 * Object id to type lookup for the objects of the current segment group, used to describe the
 * target of a reference without decoding the target itself.
 */
public final class ReferenceIndex {

  private final ClassRegistry registry;
  private final SymbolTable symbols;
  private final Long2LongOpenHashMap classOf = new Long2LongOpenHashMap();
  private final Long2ByteOpenHashMap primitiveArrays = new Long2ByteOpenHashMap();

  public ReferenceIndex(ClassRegistry registry, SymbolTable symbols) {
    this.registry = registry;
    this.symbols = symbols;
  }

  /** Records an instance or object array and the id of its class. */
  public void addObject(long objectId, long classId) {
    classOf.put(objectId, classId);
  }

  public void addPrimitiveArray(long objectId, BasicType elementType) {
    primitiveArrays.put(objectId, (byte) elementType.code);
  }

  /**
   * Describes the object behind an id.
   *
   * @return the class name of an instance or object array, {@code "int[]"} style names for
   *     primitive arrays, {@code "class X"} for class objects, {@link
   *     FieldValue.Reference#CLASS_NOT_FOUND} for an object whose class was never dumped, or null
   *     if the id is unknown
   */
  public String describe(long objectId) {
    if (classOf.containsKey(objectId)) {
      long classId = classOf.get(objectId);
      return registry.contains(classId)
          ? symbols.displayClassName(classId)
          : FieldValue.Reference.CLASS_NOT_FOUND;
    }
    if (primitiveArrays.containsKey(objectId)) {
      return BasicType.fromCode(primitiveArrays.get(objectId)).javaName() + "[]";
    }
    if (registry.contains(objectId)) {
      return "class " + symbols.displayClassName(objectId);
    }
    return null;
  }

  public int size() {
    return classOf.size() + primitiveArrays.size();
  }

  public void clear() {
    classOf.clear();
    primitiveArrays.clear();
  }
}
