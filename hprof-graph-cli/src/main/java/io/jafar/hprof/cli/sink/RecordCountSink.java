package io.jafar.hprof.cli.sink;

import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.GraphSink;
import io.jafar.hprof.api.RecordTag;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Counts top-level records per tag and prints the table, most frequent first, when done. */
public final class RecordCountSink implements GraphSink {

  private final PrintWriter out;
  private final EnumMap<RecordTag, Long> counts = new EnumMap<>(RecordTag.class);

  public RecordCountSink(PrintWriter out) {
    this.out = out;
    for (RecordTag tag : RecordTag.values()) {
      counts.put(tag, 0L);
    }
  }

  @Override
  public void handle(GraphEvent event) {
    if (event instanceof GraphEvent.RecordCounted counted) {
      counts.merge(counted.tag(), 1L, Long::sum);
    } else if (event instanceof GraphEvent.Finished) {
      for (Map.Entry<RecordTag, Long> entry : sorted()) {
        out.println(entry.getKey() + ": " + entry.getValue());
      }
      out.flush();
    }
  }

  /** Returns the counts so far, every tag included. */
  public Map<RecordTag, Long> counts() {
    return Collections.unmodifiableMap(counts);
  }

  // stable sort keeps tag order among equal counts
  private List<Map.Entry<RecordTag, Long>> sorted() {
    List<Map.Entry<RecordTag, Long>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<RecordTag, Long>comparingByValue(Comparator.reverseOrder()));
    return entries;
  }
}
