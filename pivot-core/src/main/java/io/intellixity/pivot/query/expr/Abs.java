package io.intellixity.pivot.query.expr;

import java.util.Objects;

public record Abs(Expr operand) implements Expr {
  public Abs {
    Objects.requireNonNull(operand, "operand");
  }

  @Override public String columnName() { return "abs"; }
}
