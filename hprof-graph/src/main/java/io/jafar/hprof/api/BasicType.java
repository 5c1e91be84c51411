package io.jafar.hprof.api;

/**
 * HPROF basic (primitive) type identifiers. These are used in CLASS_DUMP and PRIM_ARRAY_DUMP
 * records to identify the type of fields and array elements.
 */
public enum BasicType {
  OBJECT(2, 0, "object", 'L'),
  BOOLEAN(4, 1, "boolean", 'Z'),
  CHAR(5, 2, "char", 'C'),
  FLOAT(6, 4, "float", 'F'),
  DOUBLE(7, 8, "double", 'D'),
  BYTE(8, 1, "byte", 'B'),
  SHORT(9, 2, "short", 'S'),
  INT(10, 4, "int", 'I'),
  LONG(11, 8, "long", 'J');

  private static final BasicType[] BY_CODE = new BasicType[12];

  static {
    for (BasicType type : values()) {
      BY_CODE[type.code] = type;
    }
  }

  public final int code;
  private final int size;
  private final String javaName;
  private final char descriptor;

  BasicType(int code, int size, String javaName, char descriptor) {
    this.code = code;
    this.size = size;
    this.javaName = javaName;
    this.descriptor = descriptor;
  }

  /**
   * Looks up a type by its HPROF code.
   *
   * @param code the basic type identifier
   * @return the type, or null if the code is unknown
   */
  public static BasicType fromCode(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }

  /**
   * Returns the size in bytes of a value of this type.
   *
   * @param idSize the size of object IDs in this heap dump (4 or 8)
   * @return size in bytes
   */
  public int sizeOf(int idSize) {
    return this == OBJECT ? idSize : size;
  }

  /** Returns the Java source name ("int", "boolean", "object"). */
  public String javaName() {
    return javaName;
  }

  /** Returns the JVM descriptor character ('I', 'Z', 'L', ...). */
  public char descriptor() {
    return descriptor;
  }

  public boolean isPrimitive() {
    return this != OBJECT;
  }
}
