package io.intellixity.pivot.merge;

import io.intellixity.pivot.exec.ColumnMetadata;

import java.util.List;

public final class ColumnAligner {
  private ColumnAligner() {}

  /**
   * Maps each expected column to the first query column with the same name.
   *
   * If the query has several columns with one name the first wins; callers must not depend on which.
   */
  public static ColumnMapping align(List<ColumnMetadata> expectedSchema, List<ColumnMetadata> queryColumns) {
    int[] idx = new int[expectedSchema.size()];
    for (int i = 0; i < idx.length; i++) {
      String name = expectedSchema.get(i).name();
      idx[i] = ColumnMapping.ABSENT;
      for (int j = 0; j < queryColumns.size(); j++) {
        if (name.equals(queryColumns.get(j).name())) {
          idx[i] = j;
          break;
        }
      }
    }
    return new ColumnMapping(idx, queryColumns.size());
  }
}
