package io.intellixity.pivot.compile;

import io.intellixity.pivot.plan.PivotRequest;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.pivot.query.expr.Exprs.field;
import static org.junit.jupiter.api.Assertions.*;

final class PivotRequestNormalizerTest {
  private static final Query QUERY = Query.from("orders").withBreakouts(List.of(field("state"), field("category")));

  private static Map<String, Object> raw(String rowsKey, String colsKey) {
    Map<String, Object> m = new HashMap<>();
    m.put("query", QUERY);
    m.put(rowsKey, List.of(1));
    m.put(colsKey, List.of(0));
    return m;
  }

  @Test
  void acceptsEveryAxisKeyConvention() {
    PivotRequestNormalizer n = new PivotRequestNormalizer();
    PivotRequest expected = new PivotRequest(QUERY, List.of(1), List.of(0));

    assertEquals(expected, n.normalize(raw("pivot-rows", "pivot-cols")));
    assertEquals(expected, n.normalize(raw("pivot_rows", "pivot_cols")));
    assertEquals(expected, n.normalize(raw("pivotRows", "pivotCols")));
  }

  @Test
  void missingAxesAreEmpty() {
    PivotRequest r = new PivotRequestNormalizer().normalize(Map.of("query", QUERY));
    assertEquals(List.of(), r.pivotRows());
    assertEquals(List.of(), r.pivotCols());
  }

  @Test
  void decodesQueryMapAndCoercesIndexes() {
    Map<String, Object> raw = Map.of(
        "query", Map.of("source", "orders", "breakout", List.of("state", List.of("field", "category"))),
        "pivot-rows", List.of(1.0, "0"),
        "pivot-cols", List.of()
    );

    PivotRequest r = new PivotRequestNormalizer().normalize(raw);

    assertEquals(QUERY.breakouts(), r.query().breakouts());
    assertEquals(List.of(1, 0), r.pivotRows());
  }

  @Test
  void rejectsNonIntegralIndex() {
    PivotRequestNormalizer n = new PivotRequestNormalizer();
    Map<String, Object> raw = Map.of("query", QUERY, "pivot-rows", List.of(1.5));

    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> n.normalize(raw));
    assertTrue(ex.getMessage().contains("pivot-rows"));
  }

  @Test
  void rejectsNonListAxis() {
    PivotRequestNormalizer n = new PivotRequestNormalizer();
    Map<String, Object> raw = Map.of("query", QUERY, "pivot-cols", 2);

    assertThrows(QueryValidationException.class, () -> n.normalize(raw));
  }

  @Test
  void rejectsMissingOrMalformedQuery() {
    PivotRequestNormalizer n = new PivotRequestNormalizer();

    assertThrows(QueryValidationException.class, () -> n.normalize(Map.of("pivot-rows", List.of(0))));
    assertThrows(QueryValidationException.class,
        () -> n.normalize(Map.of("query", Map.of("breakouts", List.of(List.of("bogus", "x"))))));
  }
}
