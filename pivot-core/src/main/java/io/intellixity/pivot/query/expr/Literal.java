package io.intellixity.pivot.query.expr;

/** Constant value; numbers, strings and booleans. */
public record Literal(Object value) implements Expr {
  @Override public String columnName() { return "value"; }
}
