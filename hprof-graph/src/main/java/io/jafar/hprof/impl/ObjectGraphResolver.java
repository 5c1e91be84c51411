package io.jafar.hprof.impl;

import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.FieldValue;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.api.ResolvedField;
import io.jafar.hprof.api.ResolvedObject;
import io.jafar.hprof.internal.ByteCursor;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes buffered instance and array bodies into {@link ResolvedObject}s.
 *
 * <p>Resolution never changes the registry or symbol table and always reads from a fresh cursor,
 * so resolving the same record twice gives equal results. References are never followed; when a
 * {@link ReferenceIndex} is given, each reference is only annotated with its target's type.
 */
public final class ObjectGraphResolver {

  private final ClassRegistry registry;
  private final SymbolTable symbols;
  private final ReferenceIndex references;

  /**
   * @param references index used to describe reference targets, or null to leave them
   *     undescribed
   */
  public ObjectGraphResolver(
      ClassRegistry registry, SymbolTable symbols, ReferenceIndex references) {
    this.registry = registry;
    this.symbols = symbols;
    this.references = references;
  }

  /**
   * Reads one value of the given type.
   *
   * @throws HprofFormatException if the cursor has fewer bytes than the type needs
   */
  public static FieldValue readValue(ByteCursor cursor, BasicType type)
      throws HprofFormatException {
    return switch (type) {
      case OBJECT -> new FieldValue.Reference(new Identifier(cursor.readId(), cursor.idSize()));
      case BOOLEAN -> FieldValue.Primitive.ofBoolean(cursor.readU1() != 0);
      case BYTE -> FieldValue.Primitive.ofByte((byte) cursor.readU1());
      case CHAR -> FieldValue.Primitive.ofChar((char) cursor.readU2());
      case SHORT -> FieldValue.Primitive.ofShort((short) cursor.readU2());
      case INT -> FieldValue.Primitive.ofInt(cursor.readI4());
      case LONG -> FieldValue.Primitive.ofLong(cursor.readI8());
      // raw bits, a float/double round trip may canonicalize NaN payloads
      case FLOAT -> new FieldValue.Primitive(BasicType.FLOAT, cursor.readI4());
      case DOUBLE -> new FieldValue.Primitive(BasicType.DOUBLE, cursor.readI8());
    };
  }

  /**
   * Decodes an instance against the full field layout of its class.
   *
   * @throws HprofFormatException with {@link ErrorKind#MISSING_CLASS_DEF}, {@link
   *     ErrorKind#DANGLING_SUPERCLASS} or {@link ErrorKind#FIELD_LAYOUT_MISMATCH}
   */
  public ResolvedObject.Instance resolve(HeapSubRecord.InstanceDump dump)
      throws HprofFormatException {
    FieldLayout layout;
    try {
      layout = registry.layout(dump.classId().value());
    } catch (HprofFormatException e) {
      throw new HprofFormatException(
          e.kind(), dump.offset(), "instance " + dump.objectId() + ": " + e.detail());
    }

    ByteCursor blob = dump.fields().duplicate();
    long expected = layout.byteSize(blob.idSize());
    if (blob.length() != expected) {
      throw new HprofFormatException(
          ErrorKind.FIELD_LAYOUT_MISMATCH,
          dump.offset(),
          "instance "
              + dump.objectId()
              + " of "
              + symbols.displayClassName(dump.classId().value())
              + " has "
              + blob.length()
              + " field bytes, layout needs "
              + expected);
    }

    List<ResolvedField> fields = new ArrayList<>(layout.fields().size());
    for (ClassDef.FieldDecl decl : layout.fields()) {
      FieldValue value = describe(readValue(blob, decl.type()));
      fields.add(new ResolvedField(symbols.displayString(decl.nameId().value()), value));
    }
    return new ResolvedObject.Instance(
        dump.objectId(), dump.classId(), symbols.displayClassName(dump.classId().value()), fields);
  }

  /**
   * Decodes the element ids of an object array. Arrays describe themselves, so the array class
   * does not have to be dumped; its name comes from LOAD_CLASS when known.
   */
  public ResolvedObject.ObjectArray resolve(HeapSubRecord.ObjectArrayDump dump)
      throws HprofFormatException {
    long classId = dump.arrayClassId().value();
    ByteCursor data = dump.elements().duplicate();
    List<FieldValue.Reference> elements = new ArrayList<>(dump.length());
    for (int i = 0; i < dump.length(); i++) {
      elements.add((FieldValue.Reference) describe(readValue(data, BasicType.OBJECT)));
    }
    return new ResolvedObject.ObjectArray(
        dump.objectId(), dump.arrayClassId(), symbols.displayClassName(classId), elements);
  }

  /** Decodes the values of a primitive array. No class lookup is involved. */
  public ResolvedObject.PrimitiveArray resolve(HeapSubRecord.PrimitiveArrayDump dump)
      throws HprofFormatException {
    ByteCursor data = dump.elements().duplicate();
    int n = dump.length();
    Object values =
        switch (dump.elementType()) {
          case BOOLEAN -> {
            boolean[] a = new boolean[n];
            for (int i = 0; i < n; i++) {
              a[i] = data.readU1() != 0;
            }
            yield a;
          }
          case BYTE -> data.readBytes(n);
          case CHAR -> {
            char[] a = new char[n];
            for (int i = 0; i < n; i++) {
              a[i] = (char) data.readU2();
            }
            yield a;
          }
          case SHORT -> {
            short[] a = new short[n];
            for (int i = 0; i < n; i++) {
              a[i] = (short) data.readU2();
            }
            yield a;
          }
          case INT -> {
            int[] a = new int[n];
            for (int i = 0; i < n; i++) {
              a[i] = data.readI4();
            }
            yield a;
          }
          case LONG -> {
            long[] a = new long[n];
            for (int i = 0; i < n; i++) {
              a[i] = data.readI8();
            }
            yield a;
          }
          case FLOAT -> {
            float[] a = new float[n];
            for (int i = 0; i < n; i++) {
              a[i] = data.readFloat();
            }
            yield a;
          }
          case DOUBLE -> {
            double[] a = new double[n];
            for (int i = 0; i < n; i++) {
              a[i] = data.readDouble();
            }
            yield a;
          }
          case OBJECT -> throw new IllegalStateException("Primitive array of objects");
        };
    return new ResolvedObject.PrimitiveArray(dump.objectId(), dump.elementType(), values);
  }

  /** Names the static fields of a class and describes their reference targets. */
  public List<ResolvedField> resolveStatics(ClassDef classDef) {
    List<ResolvedField> statics = new ArrayList<>(classDef.staticFields().size());
    for (ClassDef.StaticField field : classDef.staticFields()) {
      statics.add(
          new ResolvedField(
              symbols.displayString(field.nameId().value()), describe(field.value())));
    }
    return statics;
  }

  private FieldValue describe(FieldValue value) {
    if (references == null
        || !(value instanceof FieldValue.Reference ref)
        || ref.isNull()) {
      return value;
    }
    return new FieldValue.Reference(ref.id(), references.describe(ref.id().value()));
  }
}
