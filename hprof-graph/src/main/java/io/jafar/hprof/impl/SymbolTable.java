package io.jafar.hprof.impl;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.internal.ModifiedUtf8;
import io.jafar.hprof.util.ClassNameUtil;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Strings from STRING records and class names bound by LOAD_CLASS records.
 *
 * <p>Lookups that cannot be answered yet return empty; a LOAD_CLASS record may name a string id
 * that only shows up later in the stream.
 */
public final class SymbolTable {

  /** Display name used for field and class names whose string is unknown. */
  public static final String MISSING_UTF8 = "(missing utf8)";

  private final Long2ObjectOpenHashMap<String> strings = new Long2ObjectOpenHashMap<>();
  // class object id -> name string id
  private final Long2LongOpenHashMap classNameIds = new Long2LongOpenHashMap();
  // class serial -> class object id
  private final Int2LongOpenHashMap classSerials = new Int2LongOpenHashMap();
  private final CharsetDecoder utf8 =
      StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT);

  /**
   * Adds a string. Bytes are decoded as UTF-8 and, failing that, as HotSpot modified UTF-8.
   *
   * @throws HprofFormatException with {@link ErrorKind#INVALID_SYMBOL} if neither decoding
   *     accepts the bytes; the string is not added
   */
  public void insertUtf8(long id, byte[] bytes) throws HprofFormatException {
    strings.put(id, decode(id, bytes));
  }

  private String decode(long id, byte[] bytes) throws HprofFormatException {
    try {
      return utf8.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException strict) {
      try {
        return ModifiedUtf8.decode(bytes);
      } catch (CharacterCodingException modified) {
        throw new HprofFormatException(
            ErrorKind.INVALID_SYMBOL,
            "string id " + id + " (" + bytes.length + " bytes) is not valid UTF-8");
      }
    }
  }

  /** Binds a class serial and class object id to the string id of the class name. */
  public void insertClassName(int classSerial, long classObjectId, long nameId) {
    classSerials.put(classSerial, classObjectId);
    classNameIds.put(classObjectId, nameId);
  }

  /** Forgets a class serial. The class name stays resolvable by class object id. */
  public void unloadClass(int classSerial) {
    classSerials.remove(classSerial);
  }

  public Optional<String> string(long id) {
    return Optional.ofNullable(strings.get(id));
  }

  /** Returns the class name in internal form (e.g. "java/lang/String") if known. */
  public Optional<String> className(long classObjectId) {
    if (!classNameIds.containsKey(classObjectId)) {
      return Optional.empty();
    }
    return string(classNameIds.get(classObjectId));
  }

  /** Returns the class object id bound to a class serial, if any. */
  public Optional<Long> classObjectId(int classSerial) {
    return classSerials.containsKey(classSerial)
        ? Optional.of(classSerials.get(classSerial))
        : Optional.empty();
  }

  /** Returns the class name in Java source form, or {@link #MISSING_UTF8}. */
  public String displayClassName(long classObjectId) {
    return className(classObjectId).map(ClassNameUtil::toJavaName).orElse(MISSING_UTF8);
  }

  /** Returns the string for a field name id, or {@link #MISSING_UTF8}. */
  public String displayString(long id) {
    String s = strings.get(id);
    return s != null ? s : MISSING_UTF8;
  }
}
