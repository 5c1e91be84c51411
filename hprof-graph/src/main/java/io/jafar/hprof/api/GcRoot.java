package io.jafar.hprof.api;

/**
 * A GC root sub-record. GC roots are entry points into the object graph.
 *
 * @param type root kind
 * @param objectId the object this root points to
 * @param threadSerial thread serial for JNI_LOCAL, JAVA_FRAME, NATIVE_STACK, THREAD_BLOCK and
 *     THREAD_OBJ roots, -1 otherwise
 * @param frameNumber stack frame depth for JNI_LOCAL and JAVA_FRAME roots, -1 otherwise
 * @param context JNI global ref id for JNI_GLOBAL roots, stack trace serial for THREAD_OBJ roots,
 *     0 otherwise
 */
public record GcRoot(
    Type type, Identifier objectId, int threadSerial, int frameNumber, long context) {

  /** GC root types. */
  public enum Type {
    /** Unknown root type. */
    UNKNOWN,
    /** JNI global reference. */
    JNI_GLOBAL,
    /** JNI local reference. */
    JNI_LOCAL,
    /** Reference from a Java stack frame. */
    JAVA_FRAME,
    /** Reference from native stack. */
    NATIVE_STACK,
    /** System class (loaded by bootstrap class loader). */
    STICKY_CLASS,
    /** Thread block. */
    THREAD_BLOCK,
    /** Monitor (synchronization) reference. */
    MONITOR_USED,
    /** Thread object. */
    THREAD_OBJ
  }

  @Override
  public String toString() {
    return "GcRoot[" + type + " -> " + objectId + "]";
  }
}
