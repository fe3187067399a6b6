package io.intellixity.pivot.query.expr;

import java.util.Objects;

/** Reference to a column of the query source. */
public record FieldRef(String name) implements Expr {
  public FieldRef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("field name is required");
  }

  @Override public String columnName() { return name; }
}
