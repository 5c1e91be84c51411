package io.jafar.hprof.api;

import java.util.List;
import java.util.Objects;

/** Events delivered to a {@link GraphSink} while a heap dump is decoded. */
public sealed interface GraphEvent
    permits GraphEvent.RecordCounted,
        GraphEvent.ClassResolved,
        GraphEvent.GcRootFound,
        GraphEvent.ObjectResolved,
        GraphEvent.DecodeError,
        GraphEvent.Finished {

  /** One event per top-level record with a known tag. */
  record RecordCounted(RecordTag tag) implements GraphEvent {}

  /**
   * A class dump was registered.
   *
   * @param className class name in Java source form
   * @param staticFields static fields with names looked up in the string table
   */
  record ClassResolved(ClassDef classDef, String className, List<ResolvedField> staticFields)
      implements GraphEvent {

    public ClassResolved {
      staticFields = List.copyOf(staticFields);
    }
  }

  /** A GC root sub-record. */
  record GcRootFound(GcRoot root) implements GraphEvent {}

  /** An instance or array with all values decoded. */
  record ObjectResolved(ResolvedObject object) implements GraphEvent {}

  /**
   * A recoverable error. The offending record or object has been dropped and decoding goes on.
   *
   * @param context human-readable description of what was being decoded
   */
  record DecodeError(ErrorKind kind, String context) implements GraphEvent {

    public DecodeError {
      Objects.requireNonNull(kind, "kind must not be null");
    }
  }

  /** Always the last event of a successful decode. */
  record Finished(DecodeSummary summary) implements GraphEvent {}
}
