package io.intellixity.pivot.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pivot.plan.PivotAxis;
import io.intellixity.pivot.plan.PivotRequest;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryValidationException;

import java.util.*;

/**
 * Canonicalizes a raw pivot request map (e.g. decoded JSON) into a {@link PivotRequest}.
 *
 * Axis keys are accepted as {@code pivot-rows}/{@code pivot-cols}, {@code pivot_rows}/{@code pivot_cols} or
 * {@code pivotRows}/{@code pivotCols}. {@code query} may be a {@link Query} or its JSON map form.
 */
public final class PivotRequestNormalizer {
  private final ObjectMapper json;

  public PivotRequestNormalizer() {
    this(new ObjectMapper());
  }

  public PivotRequestNormalizer(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public PivotRequest normalize(Map<String, ?> raw) {
    if (raw == null) throw new QueryValidationException("Pivot request is required");
    Object q = raw.get("query");
    if (q == null) throw new QueryValidationException("Pivot request has no query");

    Query query;
    if (q instanceof Query given) {
      query = given;
    } else {
      try {
        query = json.convertValue(q, Query.class);
      } catch (IllegalArgumentException e) {
        Throwable cause = (e.getCause() != null) ? e.getCause() : e;
        throw new QueryValidationException("Invalid pivot query: " + cause.getMessage(), e);
      }
    }

    return new PivotRequest(query, axis(raw, PivotAxis.ROWS), axis(raw, PivotAxis.COLS));
  }

  private static List<Integer> axis(Map<String, ?> raw, PivotAxis axis) {
    Object v = null;
    for (String key : keyForms(axis)) {
      if (raw.containsKey(key)) {
        v = raw.get(key);
        break;
      }
    }
    if (v == null) return List.of();
    if (!(v instanceof Collection<?> c)) {
      throw new QueryValidationException("Invalid " + axis.key() + ": expected a list of breakout indexes");
    }
    List<Integer> out = new ArrayList<>(c.size());
    for (Object x : c) out.add(toIndex(axis, x));
    return out;
  }

  private static List<String> keyForms(PivotAxis axis) {
    String lisp = axis.key();
    String snake = lisp.replace('-', '_');
    String camel = lisp.substring(0, lisp.indexOf('-'))
        + Character.toUpperCase(lisp.charAt(lisp.indexOf('-') + 1))
        + lisp.substring(lisp.indexOf('-') + 2);
    return List.of(lisp, snake, camel);
  }

  private static int toIndex(PivotAxis axis, Object x) {
    if (x instanceof Integer i) return i;
    if (x instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())
        && n.doubleValue() <= Integer.MAX_VALUE && n.doubleValue() >= Integer.MIN_VALUE) {
      return n.intValue();
    }
    if (x instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        throw new QueryValidationException("Invalid " + axis.key() + ": breakout index '" + s + "' is not an integer", e);
      }
    }
    throw new QueryValidationException("Invalid " + axis.key() + ": breakout index " + x + " is not an integer");
  }
}
