package io.intellixity.pivot.plan;

/** Client-specified partition of breakout indexes. */
public enum PivotAxis {
  ROWS("pivot-rows"),
  COLS("pivot-cols");

  private final String key;

  PivotAxis(String key) {
    this.key = key;
  }

  /** Request key (lisp-case form). */
  public String key() {
    return key;
  }
}
