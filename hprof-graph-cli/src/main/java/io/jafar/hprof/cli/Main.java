package io.jafar.hprof.cli;

import io.jafar.hprof.api.HprofParser.ParserOptions;
import io.jafar.hprof.cli.sink.ColumnarSink;
import io.jafar.hprof.cli.sink.RecordCountSink;
import io.jafar.hprof.cli.sink.TextDumpSink;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "hprof-graph",
    description = "Decode HPROF heap dumps into an object graph",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      Main.DumpObjects.class,
      Main.CountRecords.class,
      Main.DumpObjectsToColumns.class
    })
public final class Main implements Callable<Integer> {

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(spec.commandLine().getErr());
    return CommandLine.ExitCode.USAGE;
  }

  @CommandLine.Command(
      name = "dump-objects",
      description = "Print every class, instance and array with its field values")
  static final class DumpObjects implements Callable<Integer> {

    @CommandLine.Mixin private HeapDumpOptions heapDump;

    @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
      PrintWriter out = spec.commandLine().getOut();
      ParserOptions options =
          heapDump.options(spec).countRecords(false).includeGcRoots(false).build();
      return heapDump.decode(spec, options, new TextDumpSink(out));
    }
  }

  @CommandLine.Command(
      name = "count-records",
      description = "Count top-level records by tag without decoding heap dump segments")
  static final class CountRecords implements Callable<Integer> {

    @CommandLine.Mixin private HeapDumpOptions heapDump;

    @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
      PrintWriter out = spec.commandLine().getOut();
      ParserOptions options =
          heapDump
              .options(spec)
              .resolveObjects(false)
              .countRecords(true)
              .includeGcRoots(false)
              .describeReferences(false)
              .build();
      return heapDump.decode(spec, options, new RecordCountSink(out));
    }
  }

  @CommandLine.Command(
      name = "dump-objects-to-columns",
      description = "Write instances and arrays as column batches, one JSON Lines file per class")
  static final class DumpObjectsToColumns implements Callable<Integer> {

    @CommandLine.Mixin private HeapDumpOptions heapDump;

    @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-o", "--output-dir"},
        description = "Directory for the table files (default: ${DEFAULT-VALUE})",
        defaultValue = "columns")
    private Path outputDir;

    @CommandLine.Option(
        names = "--batch-size",
        description =
            "Rows buffered per table before a batch is written (default: ${DEFAULT-VALUE})",
        defaultValue = "10000")
    private int batchSize;

    @Override
    public Integer call() {
      if (batchSize < 1) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "--batch-size must be positive: " + batchSize);
      }
      ColumnarSink sink;
      try {
        sink = new ColumnarSink(outputDir, batchSize);
      } catch (IOException e) {
        spec.commandLine().getErr().println("Error: Cannot create " + outputDir + ": " + e);
        return 1;
      }
      ParserOptions options =
          heapDump.options(spec).countRecords(false).includeGcRoots(false).build();
      int exitCode = heapDump.decode(spec, options, sink);
      if (exitCode == 0) {
        PrintWriter out = spec.commandLine().getOut();
        out.printf(
            "Wrote %d rows to %d tables in %s%n", sink.rowCount(), sink.tableCount(), outputDir);
        out.flush();
      }
      return exitCode;
    }
  }
}
