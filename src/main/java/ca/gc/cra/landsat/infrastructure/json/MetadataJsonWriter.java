package ca.gc.cra.landsat.infrastructure.json;

import ca.gc.cra.landsat.application.metadata.MetadataStore;
import ca.gc.cra.landsat.domain.metadata.MetadataRecord;
import ca.gc.cra.landsat.domain.metadata.MetadataValue;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

/**
 * Renders parsed MTL metadata as JSON with Jackson's streaming generator.
 *
 * <p>Output shape: {@code {"path": "...", "groups": {"PRODUCT_METADATA": {"GROUP": "PRODUCT_METADATA", ...}}}}.
 * Group and key order follow the source file; integers and floats are written as JSON numbers, except non-finite
 * floats which are written as strings.</p>
 *
 * @since 0.1.0
 */
public final class MetadataJsonWriter {
  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /** Creates a writer producing compact JSON. */
  public MetadataJsonWriter() {
    this(false);
  }

  /**
   * Creates a writer.
   *
   * @param pretty whether to indent the output
   */
  public MetadataJsonWriter(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Serializes a store to a string.
   *
   * @param store parsed metadata
   * @return JSON document
   */
  public String toJson(MetadataStore store) {
    StringWriter out = new StringWriter();
    try {
      write(store, out);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render metadata JSON", ex);
    }
    return out.toString();
  }

  /**
   * Serializes a store to a writer.
   *
   * @param store parsed metadata
   * @param out destination; flushed but not closed
   * @throws IOException if writing fails
   */
  public void write(MetadataStore store, Writer out) throws IOException {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeStringField("path", store.path().toString());
      gen.writeObjectFieldStart("groups");
      for (Map.Entry<String, MetadataRecord> group : store.asMap().entrySet()) {
        gen.writeObjectFieldStart(group.getKey());
        for (Map.Entry<String, MetadataValue> field : group.getValue().fields().entrySet()) {
          gen.writeFieldName(field.getKey());
          writeValue(gen, field.getValue());
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    out.flush();
  }

  private static void writeValue(JsonGenerator gen, MetadataValue value) throws IOException {
    if (value instanceof MetadataValue.IntegerValue integer) {
      gen.writeNumber(integer.value());
    } else if (value instanceof MetadataValue.LargeIntegerValue large) {
      gen.writeNumber(large.value());
    } else if (value instanceof MetadataValue.FloatValue number && Double.isFinite(number.value())) {
      gen.writeNumber(number.value());
    } else {
      gen.writeString(value.asText());
    }
  }
}
