package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.SortField;
import io.intellixity.pivot.query.expr.Abs;
import io.intellixity.pivot.query.expr.Expr;
import io.intellixity.pivot.query.expr.ExpressionRef;
import io.intellixity.pivot.query.expr.Literal;

import java.util.*;

/**
 * Rewrites a base query into a derived pivot query: breakouts restricted to a subset, plus a constant
 * grouping marker expression that is projected and grouped by.
 */
public final class PivotQueryRewriter {
  /** Name of the synthetic grouping marker expression (and of its output column). */
  public static final String GROUPING_EXPRESSION = "pivot-grouping";

  private static final ExpressionRef MARKER = new ExpressionRef(GROUPING_EXPRESSION);

  /** Returns a new query; {@code base} is left untouched. */
  public Query rewrite(Query base, List<? extends Expr> breakouts, long groupNumber) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(breakouts, "breakouts");

    Map<String, Expr> expressions = new LinkedHashMap<>(base.expressions() == null ? Map.of() : base.expressions());
    expressions.put(GROUPING_EXPRESSION, new Abs(new Literal(groupNumber)));

    List<Expr> fields = new ArrayList<>(base.fields() == null ? List.of() : base.fields());
    if (!fields.contains(MARKER)) fields.add(MARKER);

    // every non-aggregated projected value must also be grouped by
    List<Expr> grouped = new ArrayList<>(breakouts.size() + 1);
    for (Expr b : breakouts) {
      if (b == null) throw new IllegalArgumentException("Null breakout in " + breakouts);
      grouped.add(b);
    }
    grouped.add(MARKER);

    return base.copy()
        .withExpressions(expressions)
        .withFields(fields)
        .withBreakouts(grouped)
        .withSort(retainedSort(base, grouped, fields));
  }

  /** Sorts on breakout columns the subset dropped no longer name an output column. */
  private static List<SortField> retainedSort(Query base, List<Expr> grouped, List<Expr> fields) {
    if (base.sort() == null || base.sort().isEmpty() || base.breakouts() == null) return base.sort();
    Set<String> dropped = new HashSet<>();
    for (Expr b : base.breakouts()) {
      if (b != null) dropped.add(b.columnName());
    }
    for (Expr b : grouped) dropped.remove(b.columnName());
    for (Expr f : fields) {
      if (f != null) dropped.remove(f.columnName());
    }
    if (dropped.isEmpty()) return base.sort();

    List<SortField> kept = new ArrayList<>(base.sort().size());
    for (SortField sf : base.sort()) {
      if (sf == null || !dropped.contains(sf.field())) kept.add(sf);
    }
    return kept;
  }

  /** True if {@code expr} is the grouping marker reference. */
  public static boolean isMarker(Expr expr) {
    return MARKER.equals(expr);
  }
}
