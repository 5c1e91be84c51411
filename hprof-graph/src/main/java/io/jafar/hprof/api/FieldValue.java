package io.jafar.hprof.api;

import java.util.Objects;

/**
 * A decoded field or array element value. Primitive values keep their raw bits so equal inputs
 * always produce equal values (including NaN payloads). References hold an {@link Identifier}
 * only; looking up the referenced object is up to the caller.
 */
public sealed interface FieldValue permits FieldValue.Primitive, FieldValue.Reference {

  /** Returns the declared type of this value. */
  BasicType type();

  /** Returns the value boxed as the matching Java type, an {@link Identifier} or null. */
  Object toJava();

  /** A primitive value stored as its raw bits, sign-extended for integral types. */
  record Primitive(BasicType type, long bits) implements FieldValue {

    public Primitive {
      Objects.requireNonNull(type, "type must not be null");
      if (!type.isPrimitive()) {
        throw new IllegalArgumentException("Not a primitive type: " + type);
      }
    }

    public static Primitive ofBoolean(boolean v) {
      return new Primitive(BasicType.BOOLEAN, v ? 1 : 0);
    }

    public static Primitive ofByte(byte v) {
      return new Primitive(BasicType.BYTE, v);
    }

    public static Primitive ofChar(char v) {
      return new Primitive(BasicType.CHAR, v);
    }

    public static Primitive ofShort(short v) {
      return new Primitive(BasicType.SHORT, v);
    }

    public static Primitive ofInt(int v) {
      return new Primitive(BasicType.INT, v);
    }

    public static Primitive ofLong(long v) {
      return new Primitive(BasicType.LONG, v);
    }

    public static Primitive ofFloat(float v) {
      return new Primitive(BasicType.FLOAT, Float.floatToRawIntBits(v));
    }

    public static Primitive ofDouble(double v) {
      return new Primitive(BasicType.DOUBLE, Double.doubleToRawLongBits(v));
    }

    public boolean asBoolean() {
      return bits != 0;
    }

    public byte asByte() {
      return (byte) bits;
    }

    public char asChar() {
      return (char) bits;
    }

    public short asShort() {
      return (short) bits;
    }

    public int asInt() {
      return (int) bits;
    }

    public long asLong() {
      return bits;
    }

    public float asFloat() {
      return Float.intBitsToFloat((int) bits);
    }

    public double asDouble() {
      return Double.longBitsToDouble(bits);
    }

    @Override
    public Object toJava() {
      return switch (type) {
        case BOOLEAN -> asBoolean();
        case BYTE -> asByte();
        case CHAR -> asChar();
        case SHORT -> asShort();
        case INT -> asInt();
        case LONG -> asLong();
        case FLOAT -> asFloat();
        case DOUBLE -> asDouble();
        case OBJECT -> throw new IllegalStateException("Primitive with OBJECT type");
      };
    }

    @Override
    public String toString() {
      return String.valueOf(toJava());
    }
  }

  /**
   * An object reference.
   *
   * @param id the referenced identifier, the null identifier for {@code null}
   * @param targetType display type of the referenced object when known to the decoder, {@link
   *     #CLASS_NOT_FOUND} when the object is known but its class was never dumped, else null
   */
  record Reference(Identifier id, String targetType) implements FieldValue {

    /** Target type of an object whose class is missing from the dump. */
    public static final String CLASS_NOT_FOUND = "(class not found)";

    public Reference {
      Objects.requireNonNull(id, "id must not be null");
    }

    public Reference(Identifier id) {
      this(id, null);
    }

    @Override
    public BasicType type() {
      return BasicType.OBJECT;
    }

    public boolean isNull() {
      return id.isNull();
    }

    @Override
    public Object toJava() {
      return isNull() ? null : id;
    }

    @Override
    public String toString() {
      return isNull() ? "null" : "id " + id.value();
    }
  }
}
