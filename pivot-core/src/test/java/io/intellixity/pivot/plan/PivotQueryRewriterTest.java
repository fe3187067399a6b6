package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.SortField;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.pivot.query.expr.Exprs.*;
import static org.junit.jupiter.api.Assertions.*;

final class PivotQueryRewriterTest {
  private static final ExpressionRef MARKER = expression(PivotQueryRewriter.GROUPING_EXPRESSION);

  private static Query base() {
    return Query.from("orders")
        .withBreakouts(List.of(field("state"), field("category")))
        .withAggregation(Aggregation.count());
  }

  @Test
  void restrictsBreakoutsAndAddsGroupingMarker() {
    Query q = new PivotQueryRewriter().rewrite(base(), List.of(field("category")), 5L);

    assertEquals(List.of(field("category"), MARKER), q.breakouts());
    assertEquals(abs(5L), q.expressions().get("pivot-grouping"));
    assertEquals(List.of(MARKER), q.fields());
    assertEquals("orders", q.source());
    assertEquals(List.of(Aggregation.count()), q.aggregations());
  }

  @Test
  void leavesBaseQueryUntouched() {
    Query base = base();
    Query snapshot = base.copy();

    new PivotQueryRewriter().rewrite(base, List.of(), 3L);

    assertEquals(snapshot, base);
    assertFalse(base.expressions().containsKey("pivot-grouping"));
  }

  @Test
  void replacesExistingMarkerDefinition() {
    Query base = base().withExpression("pivot-grouping", value(42)).withField(MARKER);

    Query q = new PivotQueryRewriter().rewrite(base, List.of(field("state")), 2L);

    assertEquals(abs(2L), q.expressions().get("pivot-grouping"));
    assertEquals(List.of(MARKER), q.fields());
    assertEquals(value(42), base.expressions().get("pivot-grouping"));
  }

  @Test
  void keepsExistingExpressionsAndFields() {
    Query base = base().withExpression("doubled", abs(field("quantity"))).withField(expression("doubled"));

    Query q = new PivotQueryRewriter().rewrite(base, List.of(), 3L);

    assertEquals(List.of("doubled", "pivot-grouping"), List.copyOf(q.expressions().keySet()));
    assertEquals(List.of(expression("doubled"), MARKER), q.fields());
    assertEquals(List.of(MARKER), q.breakouts());
  }

  @Test
  void dropsSortOnBreakoutsOutsideTheSubset() {
    SortField byCategory = new SortField("category", SortField.Direction.DESC);
    SortField byState = new SortField("state", SortField.Direction.ASC);
    SortField byCount = new SortField("count", SortField.Direction.DESC);
    SortField byMarker = new SortField("pivot-grouping", SortField.Direction.ASC);
    Query base = base().withSort(List.of(byCategory, byCount, byState, byMarker));

    Query stateOnly = new PivotQueryRewriter().rewrite(base, List.of(field("state")), 2L);
    Query total = new PivotQueryRewriter().rewrite(base, List.of(), 3L);
    Query full = new PivotQueryRewriter().rewrite(base, base.breakouts(), 0L);

    assertEquals(List.of(byCount, byState, byMarker), stateOnly.sort());
    assertEquals(List.of(byCount, byMarker), total.sort());
    assertEquals(base.sort(), full.sort());
    assertEquals(4, base.sort().size());
  }

  @Test
  void keepsSortOnProjectedFieldEvenWhenItsBreakoutIsDropped() {
    SortField byCategory = new SortField("category", SortField.Direction.ASC);
    Query base = base().withField(field("category")).withSort(List.of(byCategory));

    Query q = new PivotQueryRewriter().rewrite(base, List.of(field("state")), 2L);

    assertEquals(List.of(byCategory), q.sort());
  }

  @Test
  void recognizesMarker() {
    assertTrue(PivotQueryRewriter.isMarker(MARKER));
    assertFalse(PivotQueryRewriter.isMarker(field("pivot-grouping")));
  }
}
