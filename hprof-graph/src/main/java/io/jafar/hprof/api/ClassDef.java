package io.jafar.hprof.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata of one dumped class, as decoded from its CLASS_DUMP sub-record. Field names are kept
 * as string ids and looked up in the symbol table when needed.
 *
 * @param classId class object id
 * @param superClassId superclass id, the null identifier for java.lang.Object and interfaces
 * @param classLoaderId class loader object id, the null identifier for the bootstrap loader
 * @param instanceSize instance size in bytes as reported by the VM
 * @param instanceFields instance fields declared by this class, in declaration order
 * @param staticFields static fields with their values, decoded once when the class was dumped
 */
public record ClassDef(
    Identifier classId,
    Identifier superClassId,
    Identifier classLoaderId,
    int instanceSize,
    List<FieldDecl> instanceFields,
    List<StaticField> staticFields) {

  public ClassDef {
    Objects.requireNonNull(classId, "classId must not be null");
    Objects.requireNonNull(superClassId, "superClassId must not be null");
    instanceFields = List.copyOf(instanceFields);
    staticFields = List.copyOf(staticFields);
  }

  /** Returns the superclass id, or empty for a root class. */
  public Optional<Identifier> superClass() {
    return superClassId.isNull() ? Optional.empty() : Optional.of(superClassId);
  }

  /** An instance field declaration. */
  public record FieldDecl(Identifier nameId, BasicType type) {}

  /** A static field with its decoded value. */
  public record StaticField(Identifier nameId, FieldValue value) {}
}
