package io.intellixity.pivot.query.expr;

import java.util.Objects;

/** Reference to a named entry of {@link io.intellixity.pivot.query.Query#expressions()}. */
public record ExpressionRef(String name) implements Expr {
  public ExpressionRef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("expression name is required");
  }

  @Override public String columnName() { return name; }
}
