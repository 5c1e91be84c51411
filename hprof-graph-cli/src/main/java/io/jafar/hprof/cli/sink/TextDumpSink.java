package io.jafar.hprof.cli.sink;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.FieldValue;
import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.GraphSink;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.api.ResolvedField;
import io.jafar.hprof.api.ResolvedObject;
import java.io.PrintWriter;
import java.util.List;

/**
 * Prints classes, instances and arrays as indented text:
 *
 * <pre>
 * id 4096: com.example.Foo
 *   - x: int = 42
 *   - next = id 8192 (com.example.Foo)
 * </pre>
 */
public final class TextDumpSink implements GraphSink {

  static final String UNKNOWN_TARGET = "(type for obj id not found)";
  static final String UNKNOWN_ELEMENT_CLASS = "(could not resolve class)";

  private final PrintWriter out;

  public TextDumpSink(PrintWriter out) {
    this.out = out;
  }

  @Override
  public void handle(GraphEvent event) {
    if (event instanceof GraphEvent.ClassResolved resolved) {
      out.println();
      out.println("id " + id(resolved.classDef().classId()) + ": class " + resolved.className());
      printFields(resolved.staticFields());
    } else if (event instanceof GraphEvent.ObjectResolved resolved) {
      printObject(resolved.object());
    } else if (event instanceof GraphEvent.Finished) {
      out.flush();
    }
  }

  private void printObject(ResolvedObject object) {
    if (object instanceof ResolvedObject.Instance instance) {
      out.println();
      out.println("id " + id(instance.id()) + ": " + instance.className());
      printFields(instance.fields());
    } else if (object instanceof ResolvedObject.ObjectArray array) {
      out.println();
      out.println("id " + id(array.id()) + ": " + array.className() + " = [");
      for (FieldValue.Reference element : array.elements()) {
        if (element.isNull()) {
          out.println("  - null");
        } else {
          out.println("  - id " + id(element.id()) + ": " + elementType(element));
        }
      }
      out.println("]");
    } else if (object instanceof ResolvedObject.PrimitiveArray array) {
      out.println();
      StringBuilder line = new StringBuilder();
      line.append(id(array.id())).append(": ").append(array.className()).append(" = [");
      for (int i = 0; i < array.length(); i++) {
        line.append(formatElement(array.get(i))).append(", ");
      }
      out.println(line.append(']'));
    }
  }

  private void printFields(List<ResolvedField> fields) {
    for (ResolvedField field : fields) {
      FieldValue value = field.value();
      if (value instanceof FieldValue.Reference ref) {
        if (ref.isNull()) {
          out.println("  - " + field.name() + " = null");
        } else {
          out.println("  - " + field.name() + " = id " + id(ref.id()) + " " + targetType(ref));
        }
      } else {
        FieldValue.Primitive primitive = (FieldValue.Primitive) value;
        out.println(
            "  - "
                + field.name()
                + ": "
                + primitive.type().javaName()
                + " = "
                + format(primitive));
      }
    }
  }

  private static String targetType(FieldValue.Reference ref) {
    String type = ref.targetType();
    if (type == null) {
      return UNKNOWN_TARGET;
    }
    return FieldValue.Reference.CLASS_NOT_FOUND.equals(type) ? type : "(" + type + ")";
  }

  private static String elementType(FieldValue.Reference element) {
    String type = element.targetType();
    return type == null || FieldValue.Reference.CLASS_NOT_FOUND.equals(type)
        ? UNKNOWN_ELEMENT_CLASS
        : type;
  }

  /** Chars print as their numeric UTF-16 code unit, everything else as its Java string form. */
  static String format(FieldValue.Primitive value) {
    if (value.type() == BasicType.CHAR) {
      return String.valueOf((int) value.asChar());
    }
    return String.valueOf(value.toJava());
  }

  /** Array elements print like fields, except bytes, which print as hex ("0x1F"). */
  static String formatElement(FieldValue.Primitive value) {
    if (value.type() == BasicType.BYTE) {
      return String.format("0x%X", value.asByte() & 0xFF);
    }
    return format(value);
  }

  static String id(Identifier id) {
    return Long.toUnsignedString(id.value());
  }
}
