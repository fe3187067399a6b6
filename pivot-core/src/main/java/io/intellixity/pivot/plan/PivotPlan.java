package io.intellixity.pivot.plan;

import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.query.Query;

import java.util.List;

/**
 * @param schemaQuery full-breakout query (group number 0) the expected schema was described from
 * @param expectedSchema shape every merged row conforms to
 * @param queries derived queries in execution order
 */
public record PivotPlan(Query schemaQuery, List<ColumnMetadata> expectedSchema, List<DerivedQuery> queries) {
  public PivotPlan {
    expectedSchema = List.copyOf(expectedSchema);
    queries = List.copyOf(queries);
  }

  public List<Long> groupNumbers() {
    return queries.stream().map(DerivedQuery::groupNumber).toList();
  }
}
