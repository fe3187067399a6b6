package io.intellixity.pivot.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.*;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.source() != null) {
      g.writeStringField("source", q.source());
    }

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (q.aggregations() != null && !q.aggregations().isEmpty()) {
      g.writeArrayFieldStart("aggregations");
      for (Aggregation a : q.aggregations()) {
        g.writeStartObject();
        g.writeStringField("kind", a.kind().name().toLowerCase(Locale.ROOT));
        if (a.field() != null) g.writeStringField("field", a.field());
        if (a.name() != null) g.writeStringField("name", a.name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.breakouts() != null && !q.breakouts().isEmpty()) {
      g.writeFieldName("breakouts");
      writeExprs(q.breakouts(), g, serializers);
    }

    if (q.expressions() != null && !q.expressions().isEmpty()) {
      g.writeObjectFieldStart("expressions");
      for (Map.Entry<String, Expr> e : q.expressions().entrySet()) {
        g.writeFieldName(e.getKey());
        writeExpr(e.getValue(), g, serializers);
      }
      g.writeEndObject();
    }

    if (q.fields() != null && !q.fields().isEmpty()) {
      g.writeFieldName("fields");
      writeExprs(q.fields(), g, serializers);
    }

    if (q.sort() != null && !q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) {
      g.writeNumberField("limit", q.limit());
    }

    if (q.params() != null && !q.params().isEmpty()) {
      g.writeObjectField("params", q.params());
    }

    g.writeEndObject();
  }

  private static void writeExprs(List<Expr> exprs, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartArray();
    for (Expr e : exprs) writeExpr(e, g, serializers);
    g.writeEndArray();
  }

  static void writeExpr(Expr e, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (e == null) {
      g.writeNull();
      return;
    }
    g.writeStartArray();
    if (e instanceof FieldRef f) {
      g.writeString("field");
      g.writeString(f.name());
    } else if (e instanceof ExpressionRef x) {
      g.writeString("expression");
      g.writeString(x.name());
    } else if (e instanceof Abs a) {
      g.writeString("abs");
      if (a.operand() instanceof Literal l) {
        serializers.defaultSerializeValue(l.value(), g);
      } else {
        writeExpr(a.operand(), g, serializers);
      }
    } else if (e instanceof Literal l) {
      g.writeString("value");
      serializers.defaultSerializeValue(l.value(), g);
    } else {
      throw new IllegalArgumentException("Unsupported expression: " + e.getClass().getName());
    }
    g.writeEndArray();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      String opKey = c.operator().name().toLowerCase(Locale.ROOT);
      g.writeStartObject();
      g.writeObjectFieldStart(opKey);
      g.writeStringField("field", c.property());
      if (c.not()) g.writeBooleanField("not", true);
      if (c.operator() == Operator.RANGE) {
        g.writeFieldName("lower");
        writeValue(c.lower(), g, serializers);
        g.writeFieldName("upper");
        writeValue(c.upper(), g, serializers);
      } else if (c.operator() == Operator.IN || c.operator() == Operator.NIN) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      } else {
        g.writeFieldName("value");
        writeValue(c.value(), g, serializers);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof QueryValues.Param p) {
      g.writeStartObject();
      g.writeStringField("param", p.name());
      g.writeEndObject();
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
