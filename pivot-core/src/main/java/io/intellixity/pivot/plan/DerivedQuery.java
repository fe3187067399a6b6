package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.Query;

import java.util.List;
import java.util.Objects;

/**
 * One rewritten pivot query.
 *
 * @param query base query restricted to {@code breakoutIndexes} plus the grouping marker
 * @param breakoutIndexes surviving breakouts, as indexes into the base query's breakout list
 * @param groupNumber value of the grouping marker for every row of this query
 */
public record DerivedQuery(Query query, List<Integer> breakoutIndexes, long groupNumber) {
  public DerivedQuery {
    Objects.requireNonNull(query, "query");
    breakoutIndexes = List.copyOf(breakoutIndexes);
  }
}
