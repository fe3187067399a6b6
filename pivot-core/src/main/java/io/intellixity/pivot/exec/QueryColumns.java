package io.intellixity.pivot.exec;

import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.Expr;

import java.util.*;

/**
 * Structural output-column description of a query, without touching any backend.
 *
 * Order: breakouts, then projected fields that are not also breakouts, then aggregations.
 */
public final class QueryColumns {
  private QueryColumns() {}

  public static List<ColumnMetadata> describe(Query query) {
    Objects.requireNonNull(query, "query");
    List<ColumnMetadata> out = new ArrayList<>();
    List<Expr> breakouts = (query.breakouts() == null) ? List.of() : query.breakouts();
    for (Expr b : breakouts) {
      out.add(new ColumnMetadata(b.columnName(), b.columnName(), null, ColumnMetadata.Source.BREAKOUT));
    }
    if (query.fields() != null) {
      for (Expr f : query.fields()) {
        if (breakouts.contains(f)) continue;
        out.add(new ColumnMetadata(f.columnName(), f.columnName(), null, ColumnMetadata.Source.FIELD));
      }
    }
    List<Aggregation> aggs = query.aggregations();
    List<String> names = Aggregation.columnNames(aggs);
    for (int i = 0; i < names.size(); i++) {
      Aggregation a = aggs.get(i);
      out.add(new ColumnMetadata(names.get(i), displayName(a), baseType(a), ColumnMetadata.Source.AGGREGATION));
    }
    return out;
  }

  private static String displayName(Aggregation a) {
    if (a.name() != null) return a.name();
    return switch (a.kind()) {
      case COUNT -> "Count";
      case DISTINCT -> "Distinct values of " + a.field();
      case SUM -> "Sum of " + a.field();
      case AVG -> "Average of " + a.field();
      case MIN -> "Min of " + a.field();
      case MAX -> "Max of " + a.field();
    };
  }

  private static String baseType(Aggregation a) {
    return switch (a.kind()) {
      case COUNT, DISTINCT -> "integer";
      case AVG -> "float";
      default -> null;
    };
  }
}
