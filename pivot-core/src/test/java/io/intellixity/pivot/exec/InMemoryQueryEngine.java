package io.intellixity.pivot.exec;

import io.intellixity.pivot.query.Condition;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.*;

import java.util.*;
import java.util.function.Predicate;

/**
 * Test engine evaluating aggregate queries over in-memory rows.
 * <p>
 * Supports EQ filter conditions, COUNT and SUM. Groups come out in first-seen order.
 * Records every executed query and can be told to fail the n-th execution.
 */
public final class InMemoryQueryEngine implements QueryEngine {
  private final List<Map<String, Object>> data;
  private final List<Query> executed = new ArrayList<>();
  private int failOnExecution = -1;
  private Runnable afterExecute = () -> {};

  public InMemoryQueryEngine(List<Map<String, Object>> data) {
    this.data = List.copyOf(data);
  }

  /** Fail the {@code n}-th (0-based) call to {@link #execute}. */
  public InMemoryQueryEngine failOnExecution(int n) {
    this.failOnExecution = n;
    return this;
  }

  /** Callback run after each successful execution. */
  public InMemoryQueryEngine afterExecute(Runnable afterExecute) {
    this.afterExecute = afterExecute;
    return this;
  }

  public List<Query> executed() {
    return executed;
  }

  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public List<ColumnMetadata> describeExpectedColumns(Query query) {
    return QueryColumns.describe(query);
  }

  @Override
  public <A> A execute(Query query, RowReducer<A> reducer, CancellationSignal cancellation) {
    int n = executed.size();
    executed.add(query);
    if (n == failOnExecution) throw new IllegalStateException("engine failure on execution " + n);

    List<ColumnMetadata> cols = describeExpectedColumns(query);
    Predicate<Map<String, Object>> filter = filterOf(query);

    Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    for (Map<String, Object> row : data) {
      if (!filter.test(row)) continue;
      List<Object> key = new ArrayList<>();
      for (Expr b : query.breakouts()) key.add(eval(b, row, query.expressions()));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }

    A acc = reducer.init();
    for (Map.Entry<List<Object>, List<Map<String, Object>>> g : groups.entrySet()) {
      if (cancellation.isCancelled()) break;
      List<Object> out = new ArrayList<>(g.getKey());
      for (Expr f : query.fields()) {
        if (query.breakouts().contains(f)) continue;
        out.add(eval(f, g.getValue().get(0), query.expressions()));
      }
      for (Aggregation a : query.aggregations()) out.add(aggregate(a, g.getValue()));
      if (out.size() != cols.size()) throw new IllegalStateException("row width " + out.size() + " != " + cols.size());
      acc = reducer.step(acc, out);
    }
    afterExecute.run();
    return reducer.complete(acc);
  }

  private static Predicate<Map<String, Object>> filterOf(Query query) {
    if (query.filter() == null) return r -> true;
    if (query.filter() instanceof Condition c) return r -> Objects.equals(r.get(c.property()), c.value());
    throw new UnsupportedOperationException("filter: " + query.filter());
  }

  private static Object eval(Expr e, Map<String, Object> row, Map<String, Expr> expressions) {
    if (e instanceof FieldRef f) return row.get(f.name());
    if (e instanceof ExpressionRef r) return eval(expressions.get(r.name()), row, expressions);
    if (e instanceof Abs a) return Math.abs(((Number) eval(a.operand(), row, expressions)).longValue());
    if (e instanceof Literal l) return l.value();
    throw new UnsupportedOperationException("expr: " + e);
  }

  private static Object aggregate(Aggregation a, List<Map<String, Object>> rows) {
    return switch (a.kind()) {
      case COUNT -> (long) rows.size();
      case SUM -> {
        long sum = 0;
        for (Map<String, Object> r : rows) sum += ((Number) r.get(a.field())).longValue();
        yield sum;
      }
      default -> throw new UnsupportedOperationException("aggregation: " + a.kind());
    };
  }
}
