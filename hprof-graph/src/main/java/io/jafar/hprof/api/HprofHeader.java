package io.jafar.hprof.api;

/**
 * HPROF file header.
 *
 * @param formatVersion the version suffix of the magic string (e.g. "1.0.2")
 * @param idSize size of identifiers in bytes (4 or 8)
 * @param timestamp dump creation time in milliseconds since epoch
 * @param size header size in bytes; the first top-level record starts here
 */
public record HprofHeader(String formatVersion, int idSize, long timestamp, int size) {}
