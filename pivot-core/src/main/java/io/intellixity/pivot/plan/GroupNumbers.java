package io.intellixity.pivot.plan;

import java.util.Collection;

/**
 * Canonical group numbers, compatible with SQL {@code GROUPING()} bit semantics:
 * bit {@code i} is 0 when breakout {@code i} is present and 1 when it is absent.
 */
public final class GroupNumbers {
  /** Largest breakout count whose group numbers fit a non-negative long. */
  public static final int MAX_BREAKOUTS = 62;

  private GroupNumbers() {}

  public static long groupNumber(int breakoutCount, Collection<Integer> indexes) {
    if (breakoutCount < 0 || breakoutCount > MAX_BREAKOUTS) {
      throw new IllegalArgumentException("breakoutCount must be in [0, " + MAX_BREAKOUTS + "]: " + breakoutCount);
    }
    long present = 0L;
    for (int i : indexes) {
      if (i < 0 || i >= breakoutCount) throw new IllegalArgumentException("breakout index out of range: " + i);
      present |= 1L << i;
    }
    return allAbsent(breakoutCount) ^ present;
  }

  /** Group number of the empty subset. */
  public static long allAbsent(int breakoutCount) {
    return (1L << breakoutCount) - 1;
  }
}
