package io.intellixity.pivot.jdbc;

import io.intellixity.pivot.exec.CancellationSignal;
import io.intellixity.pivot.exec.CancellationToken;
import io.intellixity.pivot.exec.ExecutionContext;
import io.intellixity.pivot.exec.QueryResult;
import io.intellixity.pivot.exec.RowReducer;
import io.intellixity.pivot.jdbc.dialect.AnsiTestDialect;
import io.intellixity.pivot.plan.PivotRequest;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryFilters;
import io.intellixity.pivot.query.SortField;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.run.PivotQueryRunner;
import org.h2.jdbcx.JdbcDataSource;
import org.h2.tools.RunScript;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.*;

import static io.intellixity.pivot.query.expr.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryEngineTest {
  private static JdbcDataSource ds;

  @BeforeAll
  static void createTables() throws Exception {
    ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:pivot_jdbc;DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    try (Connection c = ds.getConnection();
         Reader script = new InputStreamReader(
             Objects.requireNonNull(JdbcQueryEngineTest.class.getClassLoader().getResourceAsStream("h2-pivot-data.sql"),
                 "h2-pivot-data.sql"),
             StandardCharsets.UTF_8)) {
      RunScript.execute(c, script);
    }
  }

  private static JdbcQueryEngine engine(int fetchSize) {
    return new JdbcQueryEngine(new JdbcHandle("h2", ds, null, fetchSize), new AnsiTestDialect());
  }

  private static Query base() {
    return Query.from("orders")
        .withBreakouts(List.of(field("state"), field("category"), field("channel")))
        .withAggregation(Aggregation.count())
        .withAggregation(Aggregation.sum("quantity"));
  }

  private static long num(Object v) {
    return ((Number) v).longValue();
  }

  @Test
  void executesGroupedQueryOrderedByBreakouts() {
    Query q = Query.from("orders")
        .withBreakouts(List.of(field("state")))
        .withAggregation(Aggregation.sum("quantity"));

    List<List<Object>> rows = engine(0).execute(q, QueryResult.collector(), CancellationSignal.NONE);

    assertEquals(3, rows.size());
    assertEquals(List.of("CA", "NY", "TX"), rows.stream().map(r -> r.get(0)).toList());
    assertEquals(List.of(3L, 7L, 5L), rows.stream().map(r -> num(r.get(1))).toList());
  }

  @Test
  void bindsFilterValuesAndAppliesLimit() {
    Query q = Query.from("orders")
        .withFilter(QueryFilters.in("state", List.of("CA", "NY")))
        .withBreakouts(List.of(field("category")))
        .withAggregation(Aggregation.count())
        .withLimit(1);

    List<List<Object>> rows = engine(0).execute(q, QueryResult.collector(), null);

    assertEquals(1, rows.size());
    assertEquals("Gizmo", rows.get(0).get(0));
    assertEquals(3L, num(rows.get(0).get(1)));
  }

  @Test
  void pivotRunAgainstDatabase() {
    QueryResult result = new PivotQueryRunner(engine(2)).run(new PivotRequest(base(), List.of(1, 0), List.of(2)));

    assertEquals(6, result.cols().size());
    List<Long> markers = new ArrayList<>();
    for (List<Object> row : result.rows()) {
      assertEquals(6, row.size());
      long g = num(row.get(3));
      if (markers.isEmpty() || markers.get(markers.size() - 1) != g) markers.add(g);
      for (int i = 0; i < 3; i++) assertEquals((g & (1L << i)) != 0, row.get(i) == null);
    }
    assertEquals(List.of(1L, 3L, 4L, 5L, 7L), markers);

    List<Object> grandTotal = result.rows().get(result.rows().size() - 1);
    assertEquals(5L, num(grandTotal.get(4)));
    assertEquals(15L, num(grandTotal.get(5)));
  }

  @Test
  void pivotRunKeepsBreakoutSortWhereTheColumnExists() {
    Query sorted = Query.from("orders")
        .withBreakouts(List.of(field("state"), field("category")))
        .withAggregation(Aggregation.count())
        .withSort(List.of(new SortField("category", SortField.Direction.DESC)));
    assertEquals(4, engine(0).execute(sorted, QueryResult.collector(), null).size());

    QueryResult result = new PivotQueryRunner(engine(0)).run(new PivotRequest(sorted, List.of(0, 1), List.of()));

    assertEquals(8, result.rows().size());
    assertEquals(List.of("Widget", "Widget", "Gizmo", "Gizmo"),
        result.rows().subList(0, 4).stream().map(r -> r.get(1)).toList());
    assertEquals(List.of("CA", "NY", "TX"),
        result.rows().subList(4, 7).stream().map(r -> r.get(0)).toList());
    assertEquals(5L, num(result.rows().get(7).get(3)));
  }

  @Test
  void stopsReadingOnceCancelled() {
    CancellationToken token = new CancellationToken();
    RowReducer<Integer> cancelAfterFirst = new RowReducer<>() {
      @Override public Integer init() { return 0; }
      @Override public Integer step(Integer acc, List<Object> row) {
        token.cancel();
        return acc + 1;
      }
    };

    Integer seen = new PivotQueryRunner(engine(1))
        .run(PivotRequest.of(base()), new ExecutionContext(token, Map.of()), schema -> cancelAfterFirst);

    assertEquals(1, seen);
  }

  @Test
  void sqlErrorsAreWrapped() {
    Query q = Query.from("no_such_table").withAggregation(Aggregation.count());
    JdbcQueryEngine engine = engine(0);

    RuntimeException ex = assertThrows(RuntimeException.class,
        () -> engine.execute(q, QueryResult.collector(), null));
    assertTrue(ex.getCause() instanceof SQLException);
  }
}
