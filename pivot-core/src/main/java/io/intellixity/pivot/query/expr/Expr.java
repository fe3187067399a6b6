package io.intellixity.pivot.query.expr;

/**
 * Scalar expression usable as a breakout, a projected field or a named expression definition.
 * <p>
 * JSON clause forms: {@code ["field", name]}, {@code ["expression", name]}, {@code ["abs", operand]},
 * {@code ["value", literal]}.
 */
public interface Expr {
  /** Output column name when this expression is projected. */
  String columnName();
}
