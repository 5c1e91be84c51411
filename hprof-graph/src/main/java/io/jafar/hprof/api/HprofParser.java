package io.jafar.hprof.api;

import io.jafar.hprof.impl.HeapGraphDecoder;
import io.jafar.hprof.internal.HprofBuffer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for decoding HPROF heap dump files.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * DecodeSummary summary =
 *     HprofParser.parse(
 *         Path.of("heap.hprof"),
 *         event -> {
 *           if (event instanceof GraphEvent.ObjectResolved resolved) {
 *             System.out.println(resolved.object().className());
 *           }
 *         });
 * if (!summary.isClean()) {
 *   System.err.println("Partial graph: " + summary.describeErrors());
 * }
 * }</pre>
 *
 * <p>Decoding is single-threaded and streaming. Objects are resolved one at a time once the heap
 * dump segment group that contains them has been fully scanned, so the resolved graph is never
 * held in memory as a whole.
 */
public final class HprofParser {

  private static final Logger LOG = LoggerFactory.getLogger(HprofParser.class);

  private HprofParser() {}

  /**
   * Reads only the header of a heap dump file.
   *
   * @param path path to the HPROF file
   * @return the parsed header
   * @throws HprofFormatException if the header is malformed
   * @throws IOException if the file cannot be read
   */
  public static HprofHeader readHeader(Path path) throws IOException {
    Objects.requireNonNull(path, "path must not be null");
    try (HprofBuffer buffer = HprofBuffer.map(path, ParserOptions.DEFAULT.spliceSize())) {
      return HeapGraphDecoder.readHeader(buffer);
    }
  }

  /**
   * Decodes a heap dump file with default options.
   *
   * @param path path to the HPROF file
   * @param sink receiver of decode events
   * @return totals of the run, including recoverable errors
   * @throws HprofFormatException on a fatal format error
   * @throws IOException if the file cannot be read or the sink fails
   */
  public static DecodeSummary parse(Path path, GraphSink sink) throws IOException {
    return parse(path, ParserOptions.DEFAULT, sink);
  }

  /**
   * Decodes a heap dump file.
   *
   * @param path path to the HPROF file
   * @param options parser options
   * @param sink receiver of decode events
   * @return totals of the run, including recoverable errors
   * @throws HprofFormatException on a fatal format error
   * @throws IOException if the file cannot be read or the sink fails
   */
  public static DecodeSummary parse(Path path, ParserOptions options, GraphSink sink)
      throws IOException {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(sink, "sink must not be null");

    LOG.debug("Decoding heap dump {} ({} bytes)", path, Files.size(path));
    try (HprofBuffer buffer = HprofBuffer.map(path, options.spliceSize())) {
      return new HeapGraphDecoder(buffer, options, sink).decode();
    }
  }

  /**
   * Decodes a heap dump held in memory.
   *
   * @param data complete HPROF file content
   * @param options parser options
   * @param sink receiver of decode events
   * @return totals of the run, including recoverable errors
   * @throws HprofFormatException on a fatal format error
   * @throws IOException if the sink fails
   */
  public static DecodeSummary parse(byte[] data, ParserOptions options, GraphSink sink)
      throws IOException {
    Objects.requireNonNull(data, "data must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(sink, "sink must not be null");
    try (HprofBuffer buffer = HprofBuffer.wrap(data)) {
      return new HeapGraphDecoder(buffer, options, sink).decode();
    }
  }

  /**
   * Parser configuration options.
   *
   * @param resolveObjects decode heap dump segments; when false heap payloads are skipped unread
   * @param countRecords emit a {@link GraphEvent.RecordCounted} event per top-level record
   * @param includeGcRoots emit {@link GraphEvent.GcRootFound} events
   * @param describeReferences attach the target's type to reference values; costs one map entry
   *     per object of the current segment group
   * @param spliceSize maximum size of a single memory-mapped region of the file
   */
  public record ParserOptions(
      boolean resolveObjects,
      boolean countRecords,
      boolean includeGcRoots,
      boolean describeReferences,
      int spliceSize) {

    /** 256 MB mapped regions. */
    public static final int DEFAULT_SPLICE_SIZE = 256 * 1024 * 1024;

    /** Everything enabled. */
    public static final ParserOptions DEFAULT =
        new ParserOptions(true, true, true, true, DEFAULT_SPLICE_SIZE);

    /** Only count top-level records; heap dump payloads are never decoded. */
    public static final ParserOptions COUNT_ONLY =
        new ParserOptions(false, true, false, false, DEFAULT_SPLICE_SIZE);

    public ParserOptions {
      if (spliceSize < 16) {
        throw new IllegalArgumentException("spliceSize too small: " + spliceSize);
      }
    }

    public static Builder builder() {
      return new Builder();
    }

    public static class Builder {
      private boolean resolveObjects = true;
      private boolean countRecords = true;
      private boolean includeGcRoots = true;
      private boolean describeReferences = true;
      private int spliceSize = DEFAULT_SPLICE_SIZE;

      public Builder resolveObjects(boolean value) {
        this.resolveObjects = value;
        return this;
      }

      public Builder countRecords(boolean value) {
        this.countRecords = value;
        return this;
      }

      public Builder includeGcRoots(boolean value) {
        this.includeGcRoots = value;
        return this;
      }

      public Builder describeReferences(boolean value) {
        this.describeReferences = value;
        return this;
      }

      public Builder spliceSize(int value) {
        this.spliceSize = value;
        return this;
      }

      public ParserOptions build() {
        return new ParserOptions(
            resolveObjects, countRecords, includeGcRoots, describeReferences, spliceSize);
      }
    }
  }
}
