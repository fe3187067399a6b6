package io.intellixity.pivot.examples.service;

import com.fasterxml.jackson.core.JsonGenerator;
import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.RowReducer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Writes a merged pivot result as {@code {"cols": [...], "rows": [[...], ...]}} while rows arrive.
 */
final class JsonRowWriter implements RowReducer<JsonGenerator> {
  private final JsonGenerator gen;
  private final List<ColumnMetadata> cols;

  JsonRowWriter(JsonGenerator gen, List<ColumnMetadata> cols) {
    this.gen = gen;
    this.cols = cols;
  }

  @Override
  public JsonGenerator init() {
    try {
      gen.writeStartObject();
      gen.writeArrayFieldStart("cols");
      for (ColumnMetadata c : cols) {
        gen.writeStartObject();
        gen.writeStringField("name", c.name());
        gen.writeStringField("display_name", c.displayName());
        if (c.baseType() != null) gen.writeStringField("base_type", c.baseType());
        if (c.source() != null) gen.writeStringField("source", c.source().name().toLowerCase(Locale.ROOT));
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("rows");
      return gen;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public JsonGenerator step(JsonGenerator acc, List<Object> row) {
    try {
      acc.writeStartArray();
      for (Object v : row) acc.writeObject(v);
      acc.writeEndArray();
      return acc;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public JsonGenerator complete(JsonGenerator acc) {
    try {
      acc.writeEndArray();
      acc.writeEndObject();
      acc.flush();
      return acc;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
