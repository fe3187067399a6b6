package io.intellixity.pivot.compile;

import io.intellixity.pivot.query.*;

import java.util.*;

/**
 * Filter normalization pass (does NOT create a second filter AST model).
 *
 * Responsibilities:
 * - Resolve {@link QueryValues.Param} placeholders from {@link Query#params()}
 * - Drop empty groups and unwrap single-child groups
 * - Keep the public filter tree as {@link QueryElement} (including {@link NotElement})
 *
 * Notes:
 * - NULL semantics (EQ/NE null -> IS NULL/IS NOT NULL) are handled by renderers.
 */
public final class QueryNormalizer {

  public QueryElement normalize(Query query) {
    if (query == null) return null;
    return normalizeElement(query.filter(), query);
  }

  private QueryElement normalizeElement(QueryElement el, Query query) {
    if (el == null) return null;

    if (el instanceof Query q) {
      return normalize(q);
    }

    if (el instanceof NotElement n) {
      QueryElement child = normalizeElement(n.element(), query);
      if (child == n.element()) return n;
      return (child == null) ? null : new NotElement(child);
    }

    if (el instanceof LogicalGroup g) {
      List<QueryElement> in = g.elements();
      List<QueryElement> out = new ArrayList<>(in.size());
      boolean changed = false;
      for (QueryElement c : in) {
        QueryElement nc = normalizeElement(c, query);
        changed |= (nc != c);
        if (nc != null) out.add(nc);
      }
      if (out.isEmpty()) return null;
      if (out.size() == 1) return out.get(0);
      return changed ? new LogicalGroup(g.clause(), out) : g;
    }

    if (el instanceof Condition c) {
      Object v = eval(query, c.value());
      Object lo = eval(query, c.lower());
      Object hi = eval(query, c.upper());
      if (v == c.value() && lo == c.lower() && hi == c.upper()) return c;
      return new Condition(c.property(), c.operator(), v, lo, hi, c.not());
    }

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static Object eval(Query query, Object v) {
    if (v == null) return null;
    if (v instanceof QueryValues.Param p) {
      try {
        return query.param(p.name());
      } catch (IllegalArgumentException e) {
        throw new QueryValidationException(e.getMessage(), e);
      }
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      boolean changed = false;
      for (Object x : c) {
        Object nx = eval(query, x);
        changed |= (nx != x);
        out.add(nx);
      }
      return changed ? out : v;
    }
    return v;
  }
}
