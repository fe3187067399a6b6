package io.intellixity.pivot.run;

import io.intellixity.pivot.exec.*;
import io.intellixity.pivot.plan.DerivedQuery;
import io.intellixity.pivot.plan.InvalidPivotRequestException;
import io.intellixity.pivot.plan.PivotPlan;
import io.intellixity.pivot.plan.PivotQueryPlanner;
import io.intellixity.pivot.plan.PivotRequest;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.aggregation.Aggregation;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.intellixity.pivot.query.expr.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

final class PivotQueryRunnerTest {
  private static List<Map<String, Object>> data() {
    return List.of(
        Map.of("state", "CA", "category", "Gizmo", "channel", "web", "quantity", 1),
        Map.of("state", "CA", "category", "Widget", "channel", "store", "quantity", 2),
        Map.of("state", "NY", "category", "Gizmo", "channel", "web", "quantity", 3),
        Map.of("state", "NY", "category", "Gizmo", "channel", "store", "quantity", 4),
        Map.of("state", "TX", "category", "Widget", "channel", "web", "quantity", 5)
    );
  }

  private static Query base() {
    return Query.from("orders")
        .withBreakouts(List.of(field("state"), field("category"), field("channel")))
        .withAggregation(Aggregation.count())
        .withAggregation(Aggregation.sum("quantity"));
  }

  @Test
  void mergedResultConcatenatesEveryDerivedQuery() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data());
    PivotRequest request = new PivotRequest(base(), List.of(1, 0), List.of(2));

    QueryResult result = new PivotQueryRunner(engine).run(request);

    PivotPlan plan = new PivotQueryPlanner(engine).plan(request);
    int expectedRows = 0;
    for (DerivedQuery dq : plan.queries()) {
      expectedRows += engine.execute(dq.query(), QueryResult.collector(), CancellationSignal.NONE).size();
    }

    assertEquals(6, result.cols().size());
    assertEquals(plan.expectedSchema(), result.cols());
    assertEquals(expectedRows, result.rows().size());
    for (List<Object> row : result.rows()) assertEquals(result.cols().size(), row.size());

    List<Long> markers = new ArrayList<>();
    for (List<Object> row : result.rows()) {
      Long g = (Long) row.get(3);
      if (markers.isEmpty() || !markers.get(markers.size() - 1).equals(g)) markers.add(g);
    }
    assertEquals(List.of(1L, 3L, 4L, 5L, 7L), markers);

    List<Object> grandTotal = result.rows().get(result.rows().size() - 1);
    assertEquals(Arrays.asList(null, null, null, 7L, 5L, 15L), grandTotal);
  }

  @Test
  void absentBreakoutsAreNullInEveryGroup() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data());

    QueryResult result = new PivotQueryRunner(engine).run(new PivotRequest(base(), List.of(1, 0), List.of(2)));

    for (List<Object> row : result.rows()) {
      long g = (Long) row.get(3);
      for (int i = 0; i < 3; i++) {
        boolean absent = (g & (1L << i)) != 0;
        assertEquals(absent, row.get(i) == null, "group " + g + " column " + i);
      }
    }
  }

  @Test
  void rawRequestIsNormalizedFirst() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data());
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("query", Map.of(
        "source", "orders",
        "breakouts", List.of(List.of("field", "state"), List.of("field", "category"), List.of("field", "channel")),
        "aggregations", List.of(Map.of("kind", "count"), Map.of("kind", "sum", "field", "quantity"))
    ));
    raw.put("pivot_rows", List.of(1, 0));
    raw.put("pivot_cols", List.of(2));

    List<List<Object>> rows = new PivotQueryRunner(engine).run(raw, Map.of("executed-by", 1), null,
        schema -> QueryResult.collector());

    QueryResult direct = new PivotQueryRunner(new InMemoryQueryEngine(data()))
        .run(new PivotRequest(base(), List.of(1, 0), List.of(2)));
    assertEquals(direct.rows(), rows);
  }

  @Test
  void reducerFactorySeesTheExpectedSchemaAndIsCompleted() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data());
    List<List<ColumnMetadata>> seen = new ArrayList<>();

    String out = new PivotQueryRunner(engine).run(PivotRequest.of(base()), ExecutionContext.defaults(), schema -> {
      seen.add(schema);
      return new RowReducer<StringBuilder>() {
        @Override public StringBuilder init() { return new StringBuilder(); }
        @Override public StringBuilder step(StringBuilder acc, List<Object> row) { return acc.append('.'); }
        @Override public StringBuilder complete(StringBuilder acc) { return acc.append('!'); }
      };
    }).toString();

    assertEquals(1, seen.size());
    assertEquals(List.of("state", "category", "channel", "pivot-grouping", "count", "sum"),
        seen.get(0).stream().map(ColumnMetadata::name).toList());
    assertTrue(out.endsWith("!"));
  }

  @Test
  void cancellationAfterFirstQueryReturnsItsRows() {
    CancellationToken token = new CancellationToken();
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data()).afterExecute(token::cancel);

    QueryResult result = new PivotQueryRunner(engine)
        .run(new PivotRequest(base(), List.of(1, 0), List.of(2)), new ExecutionContext(token, Map.of()));

    assertEquals(1, engine.executed().size());
    assertFalse(result.rows().isEmpty());
    for (List<Object> row : result.rows()) assertEquals(1L, row.get(3));
  }

  @Test
  void engineFailurePropagates() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data()).failOnExecution(2);
    PivotQueryRunner runner = new PivotQueryRunner(engine);
    PivotRequest request = PivotRequest.of(base());

    assertThrows(IllegalStateException.class, () -> runner.run(request));
    assertEquals(3, engine.executed().size());
  }

  @Test
  void invalidRequestFailsBeforeExecution() {
    InMemoryQueryEngine engine = new InMemoryQueryEngine(data());
    PivotQueryRunner runner = new PivotQueryRunner(engine);
    PivotRequest request = new PivotRequest(base(), List.of(0), List.of(5));

    assertThrows(InvalidPivotRequestException.class, () -> runner.run(request));
    assertTrue(engine.executed().isEmpty());
  }
}
