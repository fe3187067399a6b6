package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.QueryValidationException;

/** A pivot axis references a breakout index the base query does not have. */
public final class InvalidPivotRequestException extends QueryValidationException {
  private final PivotAxis axis;
  private final int index;
  private final int breakoutCount;

  public InvalidPivotRequestException(PivotAxis axis, int index, int breakoutCount) {
    super("Invalid " + axis.key() + ": specified breakout at index " + index
        + ", but we only have " + breakoutCount + " breakouts");
    this.axis = axis;
    this.index = index;
    this.breakoutCount = breakoutCount;
  }

  public PivotAxis axis() { return axis; }
  public int index() { return index; }
  public int breakoutCount() { return breakoutCount; }
}
