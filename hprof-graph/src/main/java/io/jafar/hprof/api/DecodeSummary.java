package io.jafar.hprof.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Totals of one decode run: how many records and objects went through and how many recoverable
 * errors of each kind were reported along the way.
 */
public record DecodeSummary(
    HprofHeader header,
    long recordCount,
    long classCount,
    long objectCount,
    long gcRootCount,
    Map<ErrorKind, Long> errors) {

  public DecodeSummary {
    EnumMap<ErrorKind, Long> copy = new EnumMap<>(ErrorKind.class);
    copy.putAll(errors);
    errors = Collections.unmodifiableMap(copy);
  }

  /** Returns the total number of recoverable errors. */
  public long errorCount() {
    return errors.values().stream().mapToLong(Long::longValue).sum();
  }

  /** Returns true if every record decoded cleanly. */
  public boolean isClean() {
    return errorCount() == 0;
  }

  /** Returns a one-line description of the recoverable errors, e.g. "2 UNKNOWN_TAG, 1 ...". */
  public String describeErrors() {
    if (isClean()) {
      return "no errors";
    }
    return errors.entrySet().stream()
        .map(e -> e.getValue() + " " + e.getKey())
        .collect(Collectors.joining(", "));
  }
}
