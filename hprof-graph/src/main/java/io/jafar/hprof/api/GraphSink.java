package io.jafar.hprof.api;

import java.io.IOException;

/**
 * Consumer of decode events. Implementations decide what to do with them (print, count,
 * persist); the decoder holds no reference to sink state.
 *
 * <p>An {@link IOException} thrown by a sink aborts the decode and is rethrown to the caller.
 */
@FunctionalInterface
public interface GraphSink {

  void handle(GraphEvent event) throws IOException;

  /** Returns a sink that forwards each event to {@code this} and then to {@code other}. */
  default GraphSink andThen(GraphSink other) {
    return event -> {
      handle(event);
      other.handle(event);
    };
  }
}
