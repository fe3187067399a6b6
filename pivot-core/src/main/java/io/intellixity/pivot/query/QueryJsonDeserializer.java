package io.intellixity.pivot.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Query}.
 * <p>
 * Also accepts the singular container keys {@code breakout} / {@code aggregation}, bare strings as field
 * references, and array aggregation clauses such as {@code ["sum", "quantity"]}.
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Query JSON must be an object");

    Query q = new Query();

    JsonNode source = root.get("source");
    if (source != null && !source.isNull()) q.withSource(source.asText());

    JsonNode params = root.get("params");
    if (params != null && params.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(params, Map.class);
      q.withParams(m);
    }

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode aggs = firstPresent(root, "aggregations", "aggregation");
    if (aggs != null && aggs.isArray()) {
      List<Aggregation> out = new ArrayList<>();
      for (JsonNode a : aggs) out.add(parseAggregation(a));
      q.withAggregations(out);
    }

    JsonNode breakouts = firstPresent(root, "breakouts", "breakout");
    if (breakouts != null) {
      // explicit null is kept: it marks a query without a breakout container
      q.withBreakouts(breakouts.isNull() ? null : parseExprs(breakouts, codec, "breakouts"));
    }

    JsonNode expressions = root.get("expressions");
    if (expressions != null && expressions.isObject()) {
      Map<String, Expr> out = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = expressions.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        out.put(e.getKey(), parseExpr(e.getValue(), codec));
      }
      q.withExpressions(out);
    }

    JsonNode fields = root.get("fields");
    if (fields != null && fields.isArray()) {
      q.withFields(parseExprs(fields, codec, "fields"));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> out = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        out.add(new SortField(f, d));
      }
      q.withSort(out);
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) {
      q.withLimit(limit.isNumber() ? limit.intValue() : Integer.parseInt(limit.asText()));
    }

    return q;
  }

  private static JsonNode firstPresent(JsonNode root, String... keys) {
    for (String k : keys) {
      if (root.has(k)) return root.get(k);
    }
    return null;
  }

  private static List<Expr> parseExprs(JsonNode arr, ObjectCodec codec, String container) throws IOException {
    if (!arr.isArray()) throw new QueryValidationException(container + " must be an array");
    List<Expr> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseExpr(x, codec));
    return out;
  }

  static Expr parseExpr(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) throw new QueryValidationException("Expression must not be null");
    if (n.isTextual()) return new FieldRef(n.asText());
    if (n.isNumber() || n.isBoolean()) return new Literal(codec.treeToValue(n, Object.class));
    if (!n.isArray() || n.size() == 0 || !n.get(0).isTextual()) {
      throw new QueryValidationException("Unsupported expression: " + n);
    }
    String tag = n.get(0).asText().toLowerCase(Locale.ROOT);
    JsonNode arg = n.size() > 1 ? n.get(1) : null;
    return switch (tag) {
      case "field", "field-id" -> new FieldRef(requireText(arg, tag));
      case "expression" -> new ExpressionRef(requireText(arg, tag));
      case "abs" -> {
        if (arg == null) throw new QueryValidationException("abs requires an operand");
        yield new Abs(parseExpr(arg, codec));
      }
      case "value" -> new Literal(arg == null ? null : codec.treeToValue(arg, Object.class));
      default -> throw new QueryValidationException("Unsupported expression clause: " + tag);
    };
  }

  private static Aggregation parseAggregation(JsonNode a) {
    if (a.isObject()) {
      String kind = textOrNull(a.get("kind"));
      if (kind == null) throw new QueryValidationException("aggregation requires kind");
      return new Aggregation(kindOf(kind), textOrNull(a.get("field")), textOrNull(a.get("name")));
    }
    if (a.isArray() && a.size() > 0) {
      // ["count"] / ["sum", "quantity"] / ["sum", ["field", "quantity"]]
      JsonNode arg = a.size() > 1 ? a.get(1) : null;
      String field = null;
      if (arg != null && arg.isTextual()) field = arg.asText();
      if (arg != null && arg.isArray() && arg.size() > 1) field = arg.get(1).asText();
      return new Aggregation(kindOf(a.get(0).asText()), field, null);
    }
    if (a.isTextual()) return new Aggregation(kindOf(a.asText()), null, null);
    throw new QueryValidationException("Unsupported aggregation: " + a);
  }

  private static Aggregation.Kind kindOf(String s) {
    try {
      return Aggregation.Kind.valueOf(s.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unsupported aggregation kind: " + s, e);
    }
  }

  private static String requireText(JsonNode n, String tag) {
    if (n == null || !n.isTextual()) throw new QueryValidationException(tag + " requires a name");
    return n.asText();
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.isObject() && n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.isObject() && n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // Canonical NOT form: { "not": <element> }
    if (n.isObject() && n.has("not")) {
      QueryElement child = parseElement(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    // Canonical condition forms: { "eq": { field:..., value:..., not?:... } }
    if (n.isObject()) {
      Iterator<String> it = n.fieldNames();
      while (it.hasNext()) {
        String k = it.next();
        Operator op = tryOp(k);
        if (op == null) continue;
        JsonNode body = n.get(k);
        if (body == null || !body.isObject()) throw new QueryValidationException(k + " must be an object");
        return parseCondition(op, body, codec);
      }
    }

    // Back-compat: {clause: AND, elements:[...] } or {operator: EQ, property: state, ...}
    if (n.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(n, Map.class);
      if (m.containsKey("clause") || m.containsKey("elements")) return LogicalGroup.fromMap(m);
      if (m.containsKey("operator") && m.containsKey("property")) return Condition.fromMap(m);
    }

    throw new QueryValidationException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new QueryValidationException(op + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    if (op == Operator.RANGE) {
      Object lower = decodeValue(body.get("lower"), codec);
      Object upper = decodeValue(body.get("upper"), codec);
      return new Condition(field, op, null, lower, upper, not);
    }

    if (op == Operator.IN || op == Operator.NIN) {
      Object values = decodeValue(body.get("values"), codec);
      return new Condition(field, op, values, null, null, not);
    }

    Object value = decodeValue(body.get("value"), codec);
    return new Condition(field, op, value, null, null, not);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    // Param: {"param":"x"} or {"$param":"x"}
    if (v.isObject()) {
      JsonNode p = v.get("param");
      if (p == null) p = v.get("$param");
      if (p != null && p.isTextual()) return QueryValues.param(p.asText());
    }
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    try {
      return Operator.valueOf(key.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
