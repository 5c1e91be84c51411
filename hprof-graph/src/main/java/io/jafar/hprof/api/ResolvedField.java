package io.jafar.hprof.api;

/** A named, decoded field value of an instance or a class (static field). */
public record ResolvedField(String name, FieldValue value) {

  public BasicType type() {
    return value.type();
  }
}
