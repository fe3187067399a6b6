package io.intellixity.pivot.query;

import java.util.Objects;

/** Sort on an output column name (breakout field, expression name or aggregation column name). */
public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }
}
