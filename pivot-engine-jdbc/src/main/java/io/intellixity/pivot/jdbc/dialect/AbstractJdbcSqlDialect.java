package io.intellixity.pivot.jdbc.dialect;

import io.intellixity.pivot.jdbc.SqlStatement;
import io.intellixity.pivot.query.*;
import io.intellixity.pivot.query.aggregation.Aggregation;
import io.intellixity.pivot.query.expr.*;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Renders an aggregate query as:
 * SELECT breakouts, extra fields, aggregations FROM source WHERE filter GROUP BY breakouts ORDER BY ... + limit
 *
 * DB-specific dialects override hooks for quoting and limits.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();
    public String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }
    public List<Object> binds() { return binds; }
  }

  /** Quote an identifier (column, alias or single table name part). */
  protected abstract String quoteIdent(String ident);

  @Override
  public final SqlStatement renderSelect(Query query, QueryElement normalizedFilter) {
    Objects.requireNonNull(query, "query");
    Map<String, Expr> expressions = (query.expressions() == null) ? Map.of() : query.expressions();
    List<Expr> breakouts = (query.breakouts() == null) ? List.of() : query.breakouts();

    List<String> selectItems = new ArrayList<>();
    for (Expr b : breakouts) {
      selectItems.add(renderExpr(b, expressions) + " AS " + quoteIdent(b.columnName()));
    }
    if (query.fields() != null) {
      for (Expr f : query.fields()) {
        if (breakouts.contains(f)) continue;
        selectItems.add(renderExpr(f, expressions) + " AS " + quoteIdent(f.columnName()));
      }
    }
    List<Aggregation> aggs = query.aggregations();
    List<String> aggNames = Aggregation.columnNames(aggs);
    for (int i = 0; i < aggs.size(); i++) {
      selectItems.add(renderAggregation(aggs.get(i)) + " AS " + quoteIdent(aggNames.get(i)));
    }
    if (selectItems.isEmpty()) selectItems.add("*");

    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", selectItems))
        .append(" FROM ")
        .append(renderSource(query.source()));

    RenderCtx ctx = new RenderCtx();
    String where = renderPredicateSql(normalizedFilter, ctx, false);
    if (where != null && !where.isBlank()) sql.append(" WHERE ").append(where);

    if (!breakouts.isEmpty()) {
      List<String> groupBy = new ArrayList<>();
      for (Expr b : breakouts) groupBy.add(renderExpr(b, expressions));
      sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    }

    String orderBy = renderOrderBy(query.sort(), breakouts, expressions);
    if (!orderBy.isEmpty()) sql.append(" ORDER BY ").append(orderBy);

    SqlStatement stmt = new SqlStatement(sql.toString(), ctx.binds());
    return (query.limit() == null) ? stmt : applyLimit(stmt, query.limit());
  }

  /** Default is ANSI FETCH FIRST; dialects override (Postgres LIMIT, etc.). */
  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return new SqlStatement(base.sql() + " FETCH FIRST " + limit + " ROWS ONLY", base.binds());
  }

  /** {@code schema.table} sources are quoted part by part. */
  protected String renderSource(String source) {
    if (source == null || source.isBlank()) throw new QueryValidationException("Query has no source");
    List<String> parts = new ArrayList<>();
    for (String p : source.split("\\.")) parts.add(quoteIdent(p));
    return String.join(".", parts);
  }

  /**
   * Explicit sort names output columns; without one, rows come ordered by the breakouts that read
   * source columns (constant breakouts such as the pivot-grouping marker are skipped).
   */
  protected String renderOrderBy(List<SortField> sort, List<Expr> breakouts, Map<String, Expr> expressions) {
    List<String> parts = new ArrayList<>();
    if (sort != null && !sort.isEmpty()) {
      for (SortField sf : sort) {
        parts.add(quoteIdent(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
      }
      return String.join(", ", parts);
    }
    for (Expr b : breakouts) {
      if (!readsColumns(b, expressions)) continue;
      parts.add(renderExpr(b, expressions) + " ASC");
    }
    return String.join(", ", parts);
  }

  protected String renderAggregation(Aggregation a) {
    return switch (a.kind()) {
      case COUNT -> a.field() == null ? "COUNT(*)" : "COUNT(" + quoteIdent(a.field()) + ")";
      case DISTINCT -> "COUNT(DISTINCT " + quoteIdent(a.field()) + ")";
      case SUM -> "SUM(" + quoteIdent(a.field()) + ")";
      case AVG -> "AVG(" + quoteIdent(a.field()) + ")";
      case MIN -> "MIN(" + quoteIdent(a.field()) + ")";
      case MAX -> "MAX(" + quoteIdent(a.field()) + ")";
    };
  }

  /**
   * Renders a scalar expression inline. Literals are inlined rather than bound so that the same
   * expression text appears in SELECT and GROUP BY.
   */
  protected String renderExpr(Expr e, Map<String, Expr> expressions) {
    if (e instanceof FieldRef f) return quoteIdent(f.name());
    if (e instanceof ExpressionRef r) {
      Expr def = expressions.get(r.name());
      if (def == null) throw new QueryValidationException("Unknown expression: " + r.name());
      return renderExpr(def, expressions);
    }
    if (e instanceof Abs a) return "ABS(" + renderExpr(a.operand(), expressions) + ")";
    if (e instanceof Literal l) return renderLiteral(l.value());
    throw new IllegalArgumentException("Unsupported expression: " + e);
  }

  protected String renderLiteral(Object v) {
    if (v == null) return "NULL";
    if (v instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (v instanceof Number n) return n.toString();
    return "'" + String.valueOf(v).replace("'", "''") + "'";
  }

  private static boolean readsColumns(Expr e, Map<String, Expr> expressions) {
    if (e instanceof FieldRef) return true;
    if (e instanceof Abs a) return readsColumns(a.operand(), expressions);
    if (e instanceof ExpressionRef r) {
      Expr def = expressions.get(r.name());
      return def != null && readsColumns(def, expressions);
    }
    return false;
  }

  private String renderPredicateSql(QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (clause == null) clause = Clause.AND;
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String property = c.property();
    if (property == null || property.isBlank()) throw new QueryValidationException("Condition has no property");
    String expr = quoteIdent(property);

    boolean not = c.not() ^ negate;
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", value, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", value, not, ctx);
      case GT -> unaryNonNull(expr, ">", value, not, ctx);
      case GE -> unaryNonNull(expr, ">=", value, not, ctx);
      case LT -> unaryNonNull(expr, "<", value, not, ctx);
      case LE -> unaryNonNull(expr, "<=", value, not, ctx);
      case LIKE -> unaryNonNull(expr, "LIKE", value, not, ctx);
      case IN -> listSql(expr, "IN", toList(value), not, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), not, ctx);
      case RANGE -> {
        Object lo = c.lower();
        Object hi = c.upper();
        if (lo == null || hi == null) throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + property + "'");
        yield betweenSql(expr, lo, hi, not, ctx);
      }
    };
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(value);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unaryNonNull(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, not, ctx);
  }

  private static String betweenSql(String expr, Object lower, Object upper, boolean not, RenderCtx ctx) {
    String p1 = ctx.add(lower);
    String p2 = ctx.add(upper);
    String sql = expr + " BETWEEN " + p1 + " AND " + p2;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, boolean not, RenderCtx ctx) {
    // IN () is always false, NOT IN () always true; fold the negation in.
    if (vals.isEmpty()) return ("IN".equals(op) ^ not) ? "FALSE" : "TRUE";
    List<String> ph = new ArrayList<>();
    for (Object x : vals) ph.add(ctx.add(x));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return List.of(v);
  }
}
