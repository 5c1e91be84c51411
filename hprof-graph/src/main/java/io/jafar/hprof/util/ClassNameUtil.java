package io.jafar.hprof.util;

import io.jafar.hprof.api.BasicType;

/**
 * Utility for converting between Java class name formats.
 *
 * <p>Heap dumps (HPROF format) store class names in <strong>internal format</strong> using slashes
 * as delimiters (e.g., {@code "java/lang/String"}) and JVM descriptors for arrays (e.g., {@code
 * "[I"}, {@code "[Ljava/lang/Object;"}). Output is rendered in <strong>Java source form</strong>
 * (e.g., {@code "java.lang.String"}, {@code "int[]"}, {@code "java.lang.Object[]"}).
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * ClassNameUtil.toJavaName("java/util/HashMap$Node");   // "java.util.HashMap$Node"
 * ClassNameUtil.toJavaName("[[J");                      // "long[][]"
 * ClassNameUtil.toJavaName("[Ljava/lang/String;");      // "java.lang.String[]"
 * }</pre>
 */
public final class ClassNameUtil {

  /**
   * Converts internal format to qualified format.
   *
   * <p>Example: {@code "java/lang/String"} → {@code "java.lang.String"}
   *
   * @param internalName class name in internal format (slash-delimited)
   * @return qualified class name (dot-delimited), or null if input is null
   */
  public static String toQualified(String internalName) {
    if (internalName == null) {
      return null;
    }
    return internalName.replace('/', '.');
  }

  /**
   * Converts an internal class name or array descriptor to Java source form.
   *
   * @param internalName class name as found in the string table
   * @return Java source name, or null if input is null
   */
  public static String toJavaName(String internalName) {
    if (internalName == null) {
      return null;
    }
    int dims = 0;
    while (dims < internalName.length() && internalName.charAt(dims) == '[') {
      dims++;
    }
    if (dims == 0) {
      return toQualified(internalName);
    }
    String component = internalName.substring(dims);
    String base;
    if (component.startsWith("L") && component.endsWith(";")) {
      base = toQualified(component.substring(1, component.length() - 1));
    } else if (component.length() == 1 && primitiveName(component.charAt(0)) != null) {
      base = primitiveName(component.charAt(0));
    } else {
      // Not a descriptor after all (some dumpers write "java.lang.Object[]" style names)
      return toQualified(internalName);
    }
    return base + "[]".repeat(dims);
  }

  private static String primitiveName(char descriptor) {
    for (BasicType type : BasicType.values()) {
      if (type.isPrimitive() && type.descriptor() == descriptor) {
        return type.javaName();
      }
    }
    return null;
  }

  private ClassNameUtil() {
    // Utility class
  }
}
