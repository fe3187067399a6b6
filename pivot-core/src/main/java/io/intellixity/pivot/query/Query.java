package io.intellixity.pivot.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.Expr;

import java.util.*;

/**
 * Structured analytical query: source, filter, aggregations and breakouts (grouping expressions).
 * <p>
 * Instances are mutable through the fluent {@code with*} methods; code that derives new queries from a
 * caller-owned instance works on a {@link #copy()}.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query implements QueryElement {
  private String source;
  private QueryElement filter;
  private List<Aggregation> aggregations = new ArrayList<>();
  private List<Expr> breakouts = new ArrayList<>();
  private Map<String, Expr> expressions = new LinkedHashMap<>();
  private List<Expr> fields = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();
  private Integer limit;
  private Map<String, Object> params = new LinkedHashMap<>();

  public Query() {}

  /** Source table (or view) name. */
  public String source() { return source; }
  public QueryElement filter() { return filter; }
  public List<Aggregation> aggregations() { return aggregations; }
  /** Grouping expressions, in order. A null list marks a malformed query. */
  public List<Expr> breakouts() { return breakouts; }
  /** Named computed expressions, referenced by {@link io.intellixity.pivot.query.expr.ExpressionRef}. */
  public Map<String, Expr> expressions() { return expressions; }
  /** Extra projected expressions (besides breakouts and aggregations). */
  public List<Expr> fields() { return fields; }
  public List<SortField> sort() { return sort; }
  public Integer limit() { return limit; }
  /** Named params referenced by filter values (QueryValues.Param). */
  public Map<String, Object> params() { return params; }

  public Query withSource(String source) { this.source = source; return this; }
  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withAggregations(List<Aggregation> aggregations) { this.aggregations = new ArrayList<>(aggregations == null ? List.of() : aggregations); return this; }
  public Query withAggregation(Aggregation aggregation) { this.aggregations.add(aggregation); return this; }
  public Query withBreakouts(List<? extends Expr> breakouts) { this.breakouts = (breakouts == null) ? null : new ArrayList<>(breakouts); return this; }
  public Query withBreakout(Expr breakout) { this.breakouts.add(breakout); return this; }
  public Query withExpressions(Map<String, ? extends Expr> expressions) { this.expressions = (expressions == null) ? null : new LinkedHashMap<>(expressions); return this; }
  public Query withExpression(String name, Expr expr) { this.expressions.put(name, expr); return this; }
  public Query withFields(List<? extends Expr> fields) { this.fields = (fields == null) ? null : new ArrayList<>(fields); return this; }
  public Query withField(Expr field) { this.fields.add(field); return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public Query withLimit(Integer limit) { this.limit = limit; return this; }
  public Query withParams(Map<String, Object> params) { this.params = new LinkedHashMap<>(params == null ? Map.of() : params); return this; }
  public Query withParam(String name, Object value) { this.params.put(name, value); return this; }
  public Object param(String name) {
    if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
    return params.get(name);
  }

  /** Copy whose containers can be modified without affecting this query (filter and expressions are immutable values). */
  public Query copy() {
    Query q = new Query();
    q.source = source;
    q.filter = filter;
    q.aggregations = new ArrayList<>(aggregations);
    q.breakouts = (breakouts == null) ? null : new ArrayList<>(breakouts);
    q.expressions = (expressions == null) ? null : new LinkedHashMap<>(expressions);
    q.fields = (fields == null) ? null : new ArrayList<>(fields);
    q.sort = new ArrayList<>(sort);
    q.limit = limit;
    q.params = new LinkedHashMap<>(params);
    return q;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Query q)) return false;
    return Objects.equals(source, q.source) && Objects.equals(filter, q.filter)
        && Objects.equals(aggregations, q.aggregations) && Objects.equals(breakouts, q.breakouts)
        && Objects.equals(expressions, q.expressions) && Objects.equals(fields, q.fields)
        && Objects.equals(sort, q.sort) && Objects.equals(limit, q.limit) && Objects.equals(params, q.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, filter, aggregations, breakouts, expressions, fields, sort, limit, params);
  }

  @Override
  public String toString() {
    return "Query{source=" + source + ", aggregations=" + aggregations + ", breakouts=" + breakouts
        + ", expressions=" + expressions + ", fields=" + fields + "}";
  }

  public static Query from(String source) {
    return new Query().withSource(source);
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }
}
