package io.jafar.hprof.cli;

import io.jafar.hprof.api.DecodeSummary;
import io.jafar.hprof.api.GraphSink;
import io.jafar.hprof.api.HprofFormatException;
import io.jafar.hprof.api.HprofParser;
import io.jafar.hprof.api.HprofParser.ParserOptions;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine;

/** Options shared by every subcommand that reads a heap dump. */
final class HeapDumpOptions {

  static final String DECODER_LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.io.jafar.hprof";

  private static final int MIN_SPLICE_SIZE = 16;

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "Heap dump file to decode",
      required = true)
  private String heapFile;

  @CommandLine.Option(
      names = "--splice-size",
      description = "Maximum size of one memory-mapped region (default: ${DEFAULT-VALUE})",
      defaultValue = "268435456")
  private int spliceSize;

  @CommandLine.Option(
      names = "--no-reference-types",
      description = "Do not look up the type of referenced objects")
  private boolean noReferenceTypes;

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Log decoder progress and print totals")
  private boolean verbose;

  ParserOptions.Builder options(CommandLine.Model.CommandSpec spec) {
    if (spliceSize < MIN_SPLICE_SIZE) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "--splice-size must be at least " + MIN_SPLICE_SIZE);
    }
    return ParserOptions.builder().spliceSize(spliceSize).describeReferences(!noReferenceTypes);
  }

  /**
   * Decodes the heap dump into {@code sink} and reports the outcome on the error stream.
   *
   * @return the process exit code
   */
  int decode(CommandLine.Model.CommandSpec spec, ParserOptions options, GraphSink sink) {
    PrintWriter err = spec.commandLine().getErr();
    if (verbose) {
      // read by slf4j-simple when the decoder loggers are created
      System.setProperty(DECODER_LOG_LEVEL_PROPERTY, "debug");
    }
    Path path = Paths.get(heapFile);
    if (!Files.isRegularFile(path)) {
      err.println("Error: Heap dump not found: " + heapFile);
      err.flush();
      return 1;
    }
    try {
      DecodeSummary summary = HprofParser.parse(path, options, writingTo(sink));
      if (!summary.isClean()) {
        err.println("Decoded with errors: " + summary.describeErrors());
      }
      if (verbose) {
        err.printf(
            "%d records, %d classes, %d objects, %d GC roots%n",
            summary.recordCount(),
            summary.classCount(),
            summary.objectCount(),
            summary.gcRootCount());
      }
      return 0;
    } catch (HprofFormatException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    } catch (OutputException e) {
      err.println("Error: Cannot write output: " + e.getCause().getMessage());
      return 1;
    } catch (IOException e) {
      err.println("Error: Cannot read " + heapFile + ": " + e.getMessage());
      return 1;
    } finally {
      err.flush();
    }
  }

  private static GraphSink writingTo(GraphSink sink) {
    return event -> {
      try {
        sink.handle(event);
      } catch (IOException e) {
        throw new OutputException(e);
      }
    };
  }

  /** Marks an I/O failure of the sink, as opposed to one reading the heap dump. */
  private static final class OutputException extends IOException {
    OutputException(IOException cause) {
      super(cause.getMessage(), cause);
    }
  }
}
