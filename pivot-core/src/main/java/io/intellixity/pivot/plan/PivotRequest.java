package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.Query;

import java.util.List;
import java.util.Objects;

/**
 * Base query plus the client's row/column partition of its breakouts (by index).
 *
 * @param query base query; never mutated by planning
 * @param pivotRows row-axis breakout indexes; empty means every breakout
 * @param pivotCols column-axis breakout indexes
 */
public record PivotRequest(Query query, List<Integer> pivotRows, List<Integer> pivotCols) {
  public PivotRequest {
    Objects.requireNonNull(query, "query");
    pivotRows = (pivotRows == null) ? List.of() : List.copyOf(pivotRows);
    pivotCols = (pivotCols == null) ? List.of() : List.copyOf(pivotCols);
  }

  public static PivotRequest of(Query query) {
    return new PivotRequest(query, List.of(), List.of());
  }
}
