package io.intellixity.pivot.merge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Position map from expected-schema columns to one query's own columns.
 */
public final class ColumnMapping {
  /** Marks an expected column the query does not produce. */
  public static final int ABSENT = -1;

  private final int[] sourceIndexes;
  private final int sourceWidth;

  public ColumnMapping(int[] sourceIndexes, int sourceWidth) {
    this.sourceIndexes = sourceIndexes.clone();
    this.sourceWidth = sourceWidth;
  }

  /** Number of expected columns. */
  public int size() { return sourceIndexes.length; }

  /** Index into the query's row for expected column {@code position}, or {@link #ABSENT}. */
  public int sourceIndex(int position) { return sourceIndexes[position]; }

  /** True if rows of the query already have the expected shape. */
  public boolean isIdentity() {
    if (sourceWidth != sourceIndexes.length) return false;
    for (int i = 0; i < sourceIndexes.length; i++) {
      if (sourceIndexes[i] != i) return false;
    }
    return true;
  }

  /** Row reshaped to the expected schema; absent columns become null. */
  public List<Object> apply(List<Object> row) {
    List<Object> out = new ArrayList<>(sourceIndexes.length);
    for (int idx : sourceIndexes) {
      out.add(idx == ABSENT ? null : row.get(idx));
    }
    return out;
  }

  @Override
  public String toString() {
    return Arrays.toString(sourceIndexes);
  }
}
