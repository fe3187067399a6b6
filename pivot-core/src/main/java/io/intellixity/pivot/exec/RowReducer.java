package io.intellixity.pivot.exec;

import java.util.List;

/**
 * Reducing function fed with result rows: {@link #init()} once, {@link #step} per row, {@link #complete} once.
 *
 * @param <A> accumulator type
 */
public interface RowReducer<A> {
  A init();

  A step(A acc, List<Object> row);

  default A complete(A acc) {
    return acc;
  }
}
