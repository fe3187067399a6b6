package io.intellixity.pivot.exec;

import io.intellixity.pivot.query.Query;

import java.util.List;

/** Executes single structured queries. */
public interface QueryEngine {
  /** Engine identifier (useful for logging). */
  String id();

  /**
   * Output columns the query would produce, in order. Must not execute the query.
   */
  List<ColumnMetadata> describeExpectedColumns(Query query);

  /**
   * Execute the query, feeding every row to {@code reducer} in engine order.
   *
   * Implementations check {@code cancellation} at least between rows and stop emitting once it is set;
   * the accumulator built so far is then passed to {@link RowReducer#complete} and returned.
   */
  <A> A execute(Query query, RowReducer<A> reducer, CancellationSignal cancellation);
}
