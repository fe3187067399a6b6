package io.intellixity.pivot.spi.exec;

import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.QueryColumns;
import io.intellixity.pivot.query.*;
import io.intellixity.pivot.query.expr.*;

import java.util.*;

/**
 * Default, backend-agnostic query validation.
 *
 * Validates:
 * - source is present
 * - breakout list is present and breakouts/fields only reference defined expressions
 * - named expressions are not cyclic
 * - filter Condition properties are not blank
 * - sort fields name output columns
 * - limit is positive
 *
 * Violations throw {@link QueryValidationException}.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(Query query, QueryElement normalizedFilter) {
    Objects.requireNonNull(query, "query");

    if (query.source() == null || query.source().isBlank()) {
      throw new QueryValidationException("Query has no source");
    }
    if (query.breakouts() == null) {
      throw new QueryValidationException("Query has no breakout list");
    }

    Map<String, Expr> expressions = (query.expressions() == null) ? Map.of() : query.expressions();
    for (Map.Entry<String, Expr> e : expressions.entrySet()) {
      checkRefs(e.getValue(), expressions, "expression '" + e.getKey() + "'");
      checkAcyclic(e.getKey(), expressions, new ArrayDeque<>());
    }
    for (Expr b : query.breakouts()) checkRefs(b, expressions, "breakouts");
    if (query.fields() != null) {
      for (Expr f : query.fields()) checkRefs(f, expressions, "fields");
    }

    validateElement(normalizedFilter);
    validateSort(query);

    if (query.limit() != null && query.limit() <= 0) {
      throw new QueryValidationException("limit must be > 0: " + query.limit());
    }
  }

  private static void checkRefs(Expr e, Map<String, Expr> expressions, String usage) {
    if (e == null) throw new QueryValidationException("Null expression in " + usage);
    if (e instanceof ExpressionRef ref && !expressions.containsKey(ref.name())) {
      throw new QueryValidationException("Unknown expression '" + ref.name() + "' in " + usage);
    }
    if (e instanceof Abs a) checkRefs(a.operand(), expressions, usage);
  }

  private static void checkAcyclic(String name, Map<String, Expr> expressions, Deque<String> path) {
    if (path.contains(name)) throw new QueryValidationException("Cyclic expression '" + name + "' via " + path);
    path.push(name);
    Expr e = expressions.get(name);
    while (e instanceof Abs a) e = a.operand();
    if (e instanceof ExpressionRef ref) checkAcyclic(ref.name(), expressions, path);
    path.pop();
  }

  private static void validateSort(Query query) {
    if (query.sort() == null || query.sort().isEmpty()) return;
    Set<String> names = new HashSet<>();
    for (ColumnMetadata c : QueryColumns.describe(query)) names.add(c.name());
    for (SortField sf : query.sort()) {
      if (sf == null) continue;
      if (!names.contains(sf.field())) {
        throw new QueryValidationException("Unknown sort column '" + sf.field() + "'");
      }
    }
  }

  private static void validateElement(QueryElement el) {
    if (el == null) return;

    if (el instanceof Query q) {
      validateElement(q.filter());
      return;
    }
    if (el instanceof NotElement n) {
      validateElement(n.element());
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(c);
      return;
    }
    if (el instanceof Condition c) {
      if (c.property().isBlank()) throw new QueryValidationException("Blank property in filter");
      return;
    }

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }
}
