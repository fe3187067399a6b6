package io.intellixity.pivot.plan;

import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.QueryEngine;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryValidationException;
import io.intellixity.pivot.query.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns one pivot request into the expected schema plus the ordered derived queries.
 *
 * Axis validation errors surface as {@link InvalidPivotRequestException}; any other failure while building the
 * queries is wrapped in {@link PivotQueryGenerationException} carrying the base query.
 */
public final class PivotQueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(PivotQueryPlanner.class);

  private final QueryEngine engine;
  private final PivotQueryRewriter rewriter;

  public PivotQueryPlanner(QueryEngine engine) {
    this(engine, new PivotQueryRewriter());
  }

  public PivotQueryPlanner(QueryEngine engine, PivotQueryRewriter rewriter) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
  }

  public PivotPlan plan(PivotRequest request) {
    Objects.requireNonNull(request, "request");
    Query base = request.query();
    List<Expr> allBreakouts = base.breakouts();
    int breakoutCount = (allBreakouts == null) ? 0 : allBreakouts.size();

    BreakoutCombinations.validate(breakoutCount, request.pivotRows(), request.pivotCols());

    try {
      if (allBreakouts == null) throw new QueryValidationException("Query has no breakout list");

      Query schemaQuery = rewriter.rewrite(base, allBreakouts, 0L);
      List<ColumnMetadata> expectedSchema = engine.describeExpectedColumns(schemaQuery);

      List<List<Integer>> combinations =
          BreakoutCombinations.enumerate(breakoutCount, request.pivotRows(), request.pivotCols());
      List<DerivedQuery> queries = new ArrayList<>(combinations.size());
      for (List<Integer> combination : combinations) {
        List<Expr> breakouts = new ArrayList<>(combination.size());
        for (int i : combination) breakouts.add(allBreakouts.get(i));
        long groupNumber = GroupNumbers.groupNumber(breakoutCount, combination);
        queries.add(new DerivedQuery(rewriter.rewrite(base, breakouts, groupNumber), combination, groupNumber));
      }

      PivotPlan plan = new PivotPlan(schemaQuery, expectedSchema, queries);
      if (log.isDebugEnabled()) {
        log.debug("pivot.plan source={} breakouts={} pivotRows={} pivotCols={} schemaCols={} groups={}",
            base.source(), breakoutCount, request.pivotRows(), request.pivotCols(),
            expectedSchema.size(), plan.groupNumbers());
      }
      return plan;
    } catch (InvalidPivotRequestException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PivotQueryGenerationException(base, e);
    }
  }
}
