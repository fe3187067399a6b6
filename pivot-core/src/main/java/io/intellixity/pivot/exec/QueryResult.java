package io.intellixity.pivot.exec;

import java.util.ArrayList;
import java.util.List;

/** Fully buffered query result: column metadata plus rows. */
public record QueryResult(List<ColumnMetadata> cols, List<List<Object>> rows) {
  public QueryResult {
    cols = List.copyOf(cols);
    rows = List.copyOf(rows);
  }

  /** Reducer collecting rows into a list. */
  public static RowReducer<List<List<Object>>> collector() {
    return new RowReducer<>() {
      @Override
      public List<List<Object>> init() {
        return new ArrayList<>();
      }

      @Override
      public List<List<Object>> step(List<List<Object>> acc, List<Object> row) {
        acc.add(row);
        return acc;
      }
    };
  }
}
