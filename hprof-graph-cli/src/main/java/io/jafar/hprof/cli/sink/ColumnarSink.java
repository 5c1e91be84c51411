package io.jafar.hprof.cli.sink;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonWriter;
import io.jafar.hprof.api.FieldValue;
import io.jafar.hprof.api.GraphEvent;
import io.jafar.hprof.api.GraphSink;
import io.jafar.hprof.api.Identifier;
import io.jafar.hprof.api.ResolvedField;
import io.jafar.hprof.api.ResolvedObject;
import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes resolved objects as column batches. Instances go to one table per class; object arrays
 * and primitive arrays each share a table. Every table is a JSON Lines file in the output
 * directory, one line per batch:
 *
 * <pre>{"table":"com.example.Foo","rows":2,"columns":{"id":[4096,4112],"x":[42,7]}}</pre>
 *
 * <p>References are written as {@code {"id":..,"type":..}} objects, null references as JSON null.
 * Non-finite floating point values are written as strings ("NaN", "Infinity").
 */
public final class ColumnarSink implements GraphSink {

  private static final Logger LOG = LoggerFactory.getLogger(ColumnarSink.class);

  static final String OBJECT_ARRAYS = "object-arrays";
  static final String PRIMITIVE_ARRAYS = "primitive-arrays";
  static final String FILE_SUFFIX = ".jsonl";

  private static final TypeAdapter<JsonElement> JSON = new Gson().getAdapter(JsonElement.class);

  private final Path outputDir;
  private final int batchSize;
  private final Map<String, Table> tables = new LinkedHashMap<>();
  private long rowCount;

  /**
   * @param outputDir directory for the table files, created if missing
   * @param batchSize rows buffered per table before a batch is appended to its file
   * @throws IOException if the directory cannot be created
   */
  public ColumnarSink(Path outputDir, int batchSize) throws IOException {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    this.outputDir = Files.createDirectories(outputDir);
    this.batchSize = batchSize;
  }

  @Override
  public void handle(GraphEvent event) throws IOException {
    if (event instanceof GraphEvent.ObjectResolved resolved) {
      add(resolved.object());
    } else if (event instanceof GraphEvent.Finished) {
      for (Table table : tables.values()) {
        flush(table);
      }
      LOG.debug("Wrote {} rows to {} tables in {}", rowCount, tables.size(), outputDir);
    }
  }

  /** Returns the number of distinct tables seen so far. */
  public int tableCount() {
    return tables.size();
  }

  /** Returns the number of rows accepted so far, written or still buffered. */
  public long rowCount() {
    return rowCount;
  }

  /** Returns the file a table is written to. */
  public Path tableFile(String table) {
    return outputDir.resolve(fileName(table));
  }

  private void add(ResolvedObject object) throws IOException {
    Map<String, JsonElement> row = new LinkedHashMap<>();
    row.put("id", id(object.id()));
    String tableName;
    if (object instanceof ResolvedObject.Instance instance) {
      tableName = instance.className();
      for (ResolvedField field : instance.fields()) {
        String column = field.name();
        // shadowed fields of superclasses
        for (int n = 2; row.containsKey(column); n++) {
          column = field.name() + "#" + n;
        }
        row.put(column, value(field.value()));
      }
    } else if (object instanceof ResolvedObject.ObjectArray array) {
      tableName = OBJECT_ARRAYS;
      row.put("class", new JsonPrimitive(array.className()));
      JsonArray elements = new JsonArray(array.length());
      for (FieldValue.Reference element : array.elements()) {
        elements.add(value(element));
      }
      row.put("elements", elements);
    } else {
      ResolvedObject.PrimitiveArray array = (ResolvedObject.PrimitiveArray) object;
      tableName = PRIMITIVE_ARRAYS;
      row.put("type", new JsonPrimitive(array.className()));
      JsonArray values = new JsonArray(array.length());
      for (int i = 0; i < array.length(); i++) {
        values.add(value(array.get(i)));
      }
      row.put("values", values);
    }

    Table table = tables.computeIfAbsent(tableName, Table::new);
    table.add(row);
    rowCount++;
    if (table.size >= batchSize) {
      flush(table);
    }
  }

  private void flush(Table table) throws IOException {
    if (table.size == 0) {
      return;
    }
    JsonObject batch = new JsonObject();
    batch.addProperty("table", table.name);
    batch.addProperty("rows", table.size);
    JsonObject columns = new JsonObject();
    table.columns.forEach(columns::add);
    batch.add("columns", columns);

    try (Writer out =
        Files.newBufferedWriter(
            tableFile(table.name),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND)) {
      JsonWriter json = new JsonWriter(out);
      JSON.write(json, batch);
      json.flush();
      out.write('\n');
    }
    LOG.debug("Appended {} rows to table {}", table.size, table.name);
    table.clear();
  }

  static String fileName(String table) {
    return table.replace('/', '.').replaceAll("[^A-Za-z0-9._$\\[\\]-]", "_") + FILE_SUFFIX;
  }

  static JsonElement value(FieldValue value) {
    if (value instanceof FieldValue.Reference ref) {
      if (ref.isNull()) {
        return JsonNull.INSTANCE;
      }
      JsonObject json = new JsonObject();
      json.add("id", id(ref.id()));
      json.addProperty("type", ref.targetType());
      return json;
    }
    FieldValue.Primitive primitive = (FieldValue.Primitive) value;
    return switch (primitive.type()) {
      case BOOLEAN -> new JsonPrimitive(primitive.asBoolean());
      case CHAR -> new JsonPrimitive(primitive.asChar());
      case FLOAT -> number(primitive.asFloat());
      case DOUBLE -> number(primitive.asDouble());
      default -> new JsonPrimitive(primitive.asLong());
    };
  }

  private static JsonPrimitive number(double d) {
    return Double.isFinite(d) ? new JsonPrimitive(d) : new JsonPrimitive(Double.toString(d));
  }

  private static JsonPrimitive number(float f) {
    return Float.isFinite(f) ? new JsonPrimitive(f) : new JsonPrimitive(Float.toString(f));
  }

  static JsonElement id(Identifier id) {
    long v = id.value();
    return v >= 0
        ? new JsonPrimitive(v)
        : new JsonPrimitive(new BigInteger(Long.toUnsignedString(v)));
  }

  private static final class Table {
    final String name;
    final Map<String, JsonArray> columns = new LinkedHashMap<>();
    int size;

    Table(String name) {
      this.name = name;
    }

    void add(Map<String, JsonElement> row) {
      for (Map.Entry<String, JsonElement> cell : row.entrySet()) {
        JsonArray column = columns.get(cell.getKey());
        if (column == null) {
          column = new JsonArray();
          for (int i = 0; i < size; i++) {
            column.add(JsonNull.INSTANCE);
          }
          columns.put(cell.getKey(), column);
        }
        column.add(cell.getValue());
      }
      size++;
      for (JsonArray column : columns.values()) {
        if (column.size() < size) {
          column.add(JsonNull.INSTANCE);
        }
      }
    }

    void clear() {
      columns.clear();
      size = 0;
    }
  }
}
