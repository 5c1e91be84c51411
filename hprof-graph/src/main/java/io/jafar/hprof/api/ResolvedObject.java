package io.jafar.hprof.api;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An instance or array with all of its values decoded. Object references are kept as {@link
 * Identifier}s; dereferencing them is a separate lookup and never happens implicitly.
 */
public sealed interface ResolvedObject
    permits ResolvedObject.Instance, ResolvedObject.ObjectArray, ResolvedObject.PrimitiveArray {

  /** Returns the object ID. */
  Identifier id();

  /** Returns the class name in Java source form (e.g. "java.lang.String", "int[]"). */
  String className();

  /**
   * A plain object.
   *
   * @param fields instance fields in on-wire order: the most-derived class first
   */
  record Instance(Identifier id, Identifier classId, String className, List<ResolvedField> fields)
      implements ResolvedObject {

    public Instance {
      fields = List.copyOf(fields);
    }

    /**
     * Returns the value of a field by name. With shadowed names the most-derived declaration wins.
     */
    public Optional<FieldValue> field(String name) {
      for (ResolvedField f : fields) {
        if (f.name().equals(name)) {
          return Optional.of(f.value());
        }
      }
      return Optional.empty();
    }
  }

  /** An array of object references; null elements are references to the null identifier. */
  record ObjectArray(
      Identifier id, Identifier arrayClassId, String className, List<FieldValue.Reference> elements)
      implements ResolvedObject {

    public ObjectArray {
      elements = List.copyOf(elements);
    }

    public int length() {
      return elements.size();
    }
  }

  /**
   * An array of primitives.
   *
   * @param values a Java primitive array matching {@code elementType} (e.g. {@code int[]})
   */
  record PrimitiveArray(Identifier id, BasicType elementType, Object values)
      implements ResolvedObject {

    public PrimitiveArray {
      Objects.requireNonNull(values, "values must not be null");
      if (!values.getClass().isArray() || !values.getClass().getComponentType().isPrimitive()) {
        throw new IllegalArgumentException("values must be a primitive array");
      }
    }

    @Override
    public String className() {
      return elementType.javaName() + "[]";
    }

    public int length() {
      return Array.getLength(values);
    }

    /** Returns element {@code index} as a typed value. */
    public FieldValue.Primitive get(int index) {
      return switch (elementType) {
        case BOOLEAN -> FieldValue.Primitive.ofBoolean(((boolean[]) values)[index]);
        case BYTE -> FieldValue.Primitive.ofByte(((byte[]) values)[index]);
        case CHAR -> FieldValue.Primitive.ofChar(((char[]) values)[index]);
        case SHORT -> FieldValue.Primitive.ofShort(((short[]) values)[index]);
        case INT -> FieldValue.Primitive.ofInt(((int[]) values)[index]);
        case LONG -> FieldValue.Primitive.ofLong(((long[]) values)[index]);
        case FLOAT -> FieldValue.Primitive.ofFloat(((float[]) values)[index]);
        case DOUBLE -> FieldValue.Primitive.ofDouble(((double[]) values)[index]);
        case OBJECT -> throw new IllegalStateException("Primitive array of OBJECT");
      };
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof PrimitiveArray other
          && id.equals(other.id)
          && elementType == other.elementType
          && Objects.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, elementType, Arrays.deepHashCode(new Object[] {values}));
    }

    @Override
    public String toString() {
      return "PrimitiveArray[id=" + id + ", " + className() + ", length=" + length() + "]";
    }
  }
}
