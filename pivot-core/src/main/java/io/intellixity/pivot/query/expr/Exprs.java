package io.intellixity.pivot.query.expr;

public final class Exprs {
  private Exprs() {}

  public static FieldRef field(String name) { return new FieldRef(name); }
  public static ExpressionRef expression(String name) { return new ExpressionRef(name); }
  public static Abs abs(Expr operand) { return new Abs(operand); }
  public static Abs abs(long value) { return new Abs(new Literal(value)); }
  public static Literal value(Object value) { return new Literal(value); }
}
