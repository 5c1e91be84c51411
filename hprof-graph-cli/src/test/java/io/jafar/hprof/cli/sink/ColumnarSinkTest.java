package io.jafar.hprof.cli.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.jafar.hprof.api.BasicType;
import io.jafar.hprof.api.FieldValue;
import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.api.ResolvedField;
import io.jafar.hprof.api.ResolvedObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ColumnarSinkTest {

  @TempDir Path tempDir;

  private static Identifier id(long value) {
    return new Identifier(value, 8);
  }

  private static GraphEvent point(long objectId, int x, long owner) {
    return new GraphEvent.ObjectResolved(
        new ResolvedObject.Instance(
            id(objectId),
            id(0x10),
            "com.example.Point",
            List.of(
                new ResolvedField("x", FieldValue.Primitive.ofInt(x)),
                new ResolvedField(
                    "owner",
                    owner == 0
                        ? new FieldValue.Reference(Identifier.nullId(8))
                        : new FieldValue.Reference(id(owner), "com.example.Owner")))));
  }

  private static List<JsonObject> batches(Path file) throws IOException {
    return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
        .map(line -> JsonParser.parseString(line).getAsJsonObject())
        .collect(Collectors.toList());
  }

  @Test
  void instancesAreBufferedUntilFinished() throws IOException {
    ColumnarSink sink = new ColumnarSink(tempDir, 100);
    sink.handle(point(0x100, 1, 0x500));
    sink.handle(point(0x110, 2, 0));

    Path file = sink.tableFile("com.example.Point");
    assertFalse(Files.exists(file));

    sink.handle(new GraphEvent.Finished(null));

    List<JsonObject> batches = batches(file);
    assertEquals(1, batches.size());
    JsonObject batch = batches.get(0);
    assertEquals("com.example.Point", batch.get("table").getAsString());
    assertEquals(2, batch.get("rows").getAsInt());

    JsonObject columns = batch.getAsJsonObject("columns");
    assertEquals(List.of("id", "x", "owner"), List.copyOf(columns.keySet()));
    assertEquals(256, columns.getAsJsonArray("id").get(0).getAsLong());
    assertEquals(2, columns.getAsJsonArray("x").get(1).getAsInt());

    JsonArray owners = columns.getAsJsonArray("owner");
    JsonObject owner = owners.get(0).getAsJsonObject();
    assertEquals(0x500, owner.get("id").getAsLong());
    assertEquals("com.example.Owner", owner.get("type").getAsString());
    assertTrue(owners.get(1).isJsonNull());
    assertEquals(2, sink.rowCount());
    assertEquals(1, sink.tableCount());
  }

  @Test
  void fullBatchesAreAppended() throws IOException {
    ColumnarSink sink = new ColumnarSink(tempDir, 2);
    for (int i = 0; i < 5; i++) {
      sink.handle(point(0x100 + i, i, 0));
    }
    Path file = sink.tableFile("com.example.Point");
    assertEquals(2, batches(file).size());

    sink.handle(new GraphEvent.Finished(null));

    List<JsonObject> batches = batches(file);
    assertEquals(3, batches.size());
    assertEquals(List.of(2, 2, 1), batches.stream().map(b -> b.get("rows").getAsInt()).toList());
    JsonObject last = batches.get(2).getAsJsonObject("columns");
    assertEquals(4, last.getAsJsonArray("x").get(0).getAsInt());
  }

  @Test
  void arraysShareTables() throws IOException {
    ColumnarSink sink = new ColumnarSink(tempDir.resolve("out"), 10);
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.ObjectArray(
                id(0x300),
                id(0x30),
                "java.lang.Object[]",
                List.of(
                    new FieldValue.Reference(id(0x100), "com.example.Point"),
                    new FieldValue.Reference(Identifier.nullId(8))))));
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.PrimitiveArray(
                id(0x400), BasicType.DOUBLE, new double[] {0.5, Double.NaN})));
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.PrimitiveArray(id(0x410), BasicType.CHAR, new char[] {'h', 'i'})));
    sink.handle(new GraphEvent.Finished(null));

    JsonObject objects =
        batches(sink.tableFile(ColumnarSink.OBJECT_ARRAYS)).get(0).getAsJsonObject("columns");
    assertEquals("java.lang.Object[]", objects.getAsJsonArray("class").get(0).getAsString());
    JsonArray elements = objects.getAsJsonArray("elements").get(0).getAsJsonArray();
    assertEquals(0x100, elements.get(0).getAsJsonObject().get("id").getAsLong());
    assertTrue(elements.get(1).isJsonNull());

    JsonObject primitives =
        batches(sink.tableFile(ColumnarSink.PRIMITIVE_ARRAYS)).get(0).getAsJsonObject("columns");
    assertEquals("double[]", primitives.getAsJsonArray("type").get(0).getAsString());
    assertEquals("char[]", primitives.getAsJsonArray("type").get(1).getAsString());
    JsonArray doubles = primitives.getAsJsonArray("values").get(0).getAsJsonArray();
    assertEquals(0.5, doubles.get(0).getAsDouble());
    assertEquals("NaN", doubles.get(1).getAsString());
    JsonArray chars = primitives.getAsJsonArray("values").get(1).getAsJsonArray();
    assertEquals("h", chars.get(0).getAsString());
    assertEquals(2, sink.tableCount());
  }

  @Test
  void shadowedFieldsGetDistinctColumns() throws IOException {
    ColumnarSink sink = new ColumnarSink(tempDir, 10);
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.Instance(
                id(0x100),
                id(0x10),
                "com.example.Child",
                List.of(
                    new ResolvedField("value", FieldValue.Primitive.ofInt(1)),
                    new ResolvedField("value", FieldValue.Primitive.ofLong(2))))));
    sink.handle(new GraphEvent.Finished(null));

    JsonObject columns =
        batches(sink.tableFile("com.example.Child")).get(0).getAsJsonObject("columns");
    assertEquals(List.of("id", "value", "value#2"), List.copyOf(columns.keySet()));
    assertEquals(2, columns.getAsJsonArray("value#2").get(0).getAsLong());
  }

  @Test
  void columnsAddedLaterAreBackfilled() throws IOException {
    ColumnarSink sink = new ColumnarSink(tempDir, 10);
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.Instance(id(1), id(0x10), "com.example.Bag", List.of())));
    sink.handle(
        new GraphEvent.ObjectResolved(
            new ResolvedObject.Instance(
                id(2),
                id(0x10),
                "com.example.Bag",
                List.of(new ResolvedField("size", FieldValue.Primitive.ofShort((short) 3))))));
    sink.handle(new GraphEvent.Finished(null));

    JsonArray sizes =
        batches(sink.tableFile("com.example.Bag"))
            .get(0)
            .getAsJsonObject("columns")
            .getAsJsonArray("size");
    assertEquals(2, sizes.size());
    assertTrue(sizes.get(0).isJsonNull());
    assertEquals(3, sizes.get(1).getAsInt());
  }

  @Test
  void fileNames() {
    assertEquals("java.util.HashMap$Node.jsonl", ColumnarSink.fileName("java.util.HashMap$Node"));
    assertEquals("com.example.Foo.jsonl", ColumnarSink.fileName("com/example/Foo"));
    assertEquals("a_b.jsonl", ColumnarSink.fileName("a b"));
  }

  @Test
  void unsignedIdentifiers() {
    assertEquals("18446744073709551615", ColumnarSink.id(new Identifier(-1L, 8)).toString());
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> new ColumnarSink(tempDir, 0));
  }
}
