package io.jafar.hprof.impl;

import io.jafar.hprof.api.ClassDef;
import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.Identifier;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Class definitions keyed by class object id.
 *
 * <p>Layouts are computed on first use and cached. Callers must not ask for a layout before the
 * segment group that may still define classes in its chain has been fully scanned; the decoder
 * defers instance resolution to the end of the group for that reason.
 */
public final class ClassRegistry {

  private final Long2ObjectOpenHashMap<ClassDef> classes = new Long2ObjectOpenHashMap<>();
  private final Long2ObjectOpenHashMap<FieldLayout> layouts = new Long2ObjectOpenHashMap<>();

  /**
   * Adds a class definition.
   *
   * @throws HprofFormatException with {@link ErrorKind#DUPLICATE_CLASS_DEF} if the id is already
   *     registered; the existing definition is kept
   */
  public void register(ClassDef classDef) throws HprofFormatException {
    long id = classDef.classId().value();
    if (classes.containsKey(id)) {
      throw new HprofFormatException(
          ErrorKind.DUPLICATE_CLASS_DEF, "class " + classDef.classId() + " dumped more than once");
    }
    classes.put(id, classDef);
  }

  public Optional<ClassDef> lookup(long classId) {
    return Optional.ofNullable(classes.get(classId));
  }

  public boolean contains(long classId) {
    return classes.containsKey(classId);
  }

  /**
   * Returns the full instance field layout of a class.
   *
   * @throws HprofFormatException with {@link ErrorKind#MISSING_CLASS_DEF} if the class itself is
   *     unknown, or {@link ErrorKind#DANGLING_SUPERCLASS} if its superclass chain leads to an
   *     unknown class or loops
   */
  public FieldLayout layout(long classId) throws HprofFormatException {
    FieldLayout cached = layouts.get(classId);
    if (cached != null) {
      return cached;
    }
    ClassDef def = classes.get(classId);
    if (def == null) {
      throw new HprofFormatException(
          ErrorKind.MISSING_CLASS_DEF,
          "class 0x" + Long.toHexString(classId) + " was never dumped");
    }

    List<ClassDef.FieldDecl> fields = new ArrayList<>();
    LongOpenHashSet visited = new LongOpenHashSet();
    ClassDef current = def;
    while (true) {
      if (!visited.add(current.classId().value())) {
        throw new HprofFormatException(
            ErrorKind.DANGLING_SUPERCLASS,
            "superclass chain of " + def.classId() + " loops at " + current.classId());
      }
      fields.addAll(current.instanceFields());
      Optional<Identifier> superId = current.superClass();
      if (superId.isEmpty()) {
        break;
      }
      ClassDef superDef = classes.get(superId.get().value());
      if (superDef == null) {
        throw new HprofFormatException(
            ErrorKind.DANGLING_SUPERCLASS,
            "superclass " + superId.get() + " of " + current.classId() + " was never dumped");
      }
      current = superDef;
    }

    FieldLayout layout = new FieldLayout(def.classId(), fields);
    layouts.put(classId, layout);
    return layout;
  }

  public int size() {
    return classes.size();
  }
}
