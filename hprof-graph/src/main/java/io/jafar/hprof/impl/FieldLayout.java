package io.jafar.hprof.impl;

import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.Identifier;
import java.util.List;

/**
 * The complete instance field list of a class in on-wire order: fields declared by the class
 * itself, then those of its superclass, and so on up to the root.
 *
 * @param classId the class this layout belongs to
 * @param fields all instance fields, most-derived class first
 */
public record FieldLayout(Identifier classId, List<ClassDef.FieldDecl> fields) {

  public FieldLayout {
    fields = List.copyOf(fields);
  }

  /** Returns the number of blob bytes an instance of this class carries. */
  public long byteSize(int idSize) {
    long size = 0;
    for (ClassDef.FieldDecl field : fields) {
      size += field.type().sizeOf(idSize);
    }
    return size;
  }
}
