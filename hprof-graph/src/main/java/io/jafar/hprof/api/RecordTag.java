package io.jafar.hprof.api;

/**
 * HPROF top-level record tags. These identify the type of each record in the heap dump file.
 *
 * @see <a href="https://hg.openjdk.org/jdk/jdk/file/tip/src/hotspot/share/services/heapDumper.cpp">
 *     HotSpot heapDumper.cpp</a>
 */
public enum RecordTag {
  STRING(0x01),
  LOAD_CLASS(0x02),
  UNLOAD_CLASS(0x03),
  STACK_FRAME(0x04),
  STACK_TRACE(0x05),
  ALLOC_SITES(0x06),
  HEAP_SUMMARY(0x07),
  START_THREAD(0x0A),
  END_THREAD(0x0B),
  HEAP_DUMP(0x0C),
  CPU_SAMPLES(0x0D),
  CONTROL_SETTINGS(0x0E),
  HEAP_DUMP_SEGMENT(0x1C),
  HEAP_DUMP_END(0x2C);

  private static final RecordTag[] BY_CODE = new RecordTag[256];

  static {
    for (RecordTag tag : values()) {
      BY_CODE[tag.code] = tag;
    }
  }

  public final int code;

  RecordTag(int code) {
    this.code = code;
  }

  /**
   * Looks up a tag by its wire code.
   *
   * @param code unsigned tag byte
   * @return the tag, or null if the code is not a known top-level tag
   */
  public static RecordTag fromCode(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }

  /** Returns a human-readable name for the given code, including unknown codes. */
  public static String nameOf(int code) {
    RecordTag tag = fromCode(code);
    return tag != null ? tag.name() : "UNKNOWN(0x" + Integer.toHexString(code) + ")";
  }
}
