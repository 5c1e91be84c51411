package io.jafar.hprof.impl;

import io.jafar.hprof.api.ErrorKind;
import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.GraphSink;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Counts recoverable errors per kind and forwards each one to the sink. */
final class DecodeErrors implements ErrorReporter {

  private static final Logger LOG = LoggerFactory.getLogger(DecodeErrors.class);

  private final GraphSink sink;
  private final EnumMap<ErrorKind, Long> counts = new EnumMap<>(ErrorKind.class);

  DecodeErrors(GraphSink sink) {
    this.sink = sink;
  }

  @Override
  public void report(ErrorKind kind, String context) throws IOException {
    if (kind.isFatal()) {
      throw new IllegalArgumentException("Fatal error kinds are thrown, not reported: " + kind);
    }
    LOG.warn("{}: {}", kind, context);
    counts.merge(kind, 1L, Long::sum);
    sink.handle(new GraphEvent.DecodeError(kind, context));
  }

  Map<ErrorKind, Long> counts() {
    return counts;
  }
}
