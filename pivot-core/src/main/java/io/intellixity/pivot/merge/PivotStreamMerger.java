package io.intellixity.pivot.merge;

import io.intellixity.pivot.exec.CancellationSignal;
import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.QueryEngine;
import io.intellixity.pivot.exec.RowReducer;
import io.intellixity.pivot.plan.DerivedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs derived queries one after another and concatenates their rows into one reducer, each row reshaped
 * to the expected schema.
 *
 * Per query: check cancellation, describe its columns, align them to the expected schema, execute.
 * Rows of query {@code k} are all delivered before any row of query {@code k+1}. Engine failures propagate
 * and abort the remaining queries.
 */
public final class PivotStreamMerger {
  private static final Logger log = LoggerFactory.getLogger(PivotStreamMerger.class);

  private final QueryEngine engine;

  public PivotStreamMerger(QueryEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Drives {@code reducer} through every query: calls {@link RowReducer#init()} once and {@link RowReducer#step}
   * per row. {@link RowReducer#complete} is left to the caller.
   *
   * On cancellation the accumulator built so far is returned.
   */
  public <A> A run(List<DerivedQuery> queries,
                   List<ColumnMetadata> expectedSchema,
                   RowReducer<A> reducer,
                   CancellationSignal cancellation) {
    Objects.requireNonNull(queries, "queries");
    Objects.requireNonNull(expectedSchema, "expectedSchema");
    Objects.requireNonNull(reducer, "reducer");
    CancellationSignal signal = (cancellation == null) ? CancellationSignal.NONE : cancellation;

    A acc = reducer.init();
    for (int k = 0; k < queries.size(); k++) {
      if (signal.isCancelled()) {
        log.debug("pivot.merge_cancelled before={} of={}", k, queries.size());
        return acc;
      }

      DerivedQuery dq = queries.get(k);
      ColumnMapping mapping = ColumnAligner.align(expectedSchema, engine.describeExpectedColumns(dq.query()));
      long start = System.nanoTime();
      QueryRowReducer<A> step = new QueryRowReducer<>(reducer, mapping, acc);
      acc = engine.execute(dq.query(), step, signal);

      if (log.isDebugEnabled()) {
        log.debug("pivot.merge_query index={} group={} mapping={} identity={} rows={} durationMs={}",
            k, dq.groupNumber(), mapping, mapping.isIdentity(), step.rows,
            (System.nanoTime() - start) / 1_000_000.0);
      }
    }
    return acc;
  }

  /** Per-query reducer: starts from the carried accumulator and reshapes each row before forwarding it. */
  private static final class QueryRowReducer<A> implements RowReducer<A> {
    private final RowReducer<A> downstream;
    private final ColumnMapping mapping;
    private final boolean passthrough;
    private final A carried;
    private long rows;

    QueryRowReducer(RowReducer<A> downstream, ColumnMapping mapping, A carried) {
      this.downstream = downstream;
      this.mapping = mapping;
      this.passthrough = mapping.isIdentity();
      this.carried = carried;
    }

    @Override
    public A init() {
      return carried;
    }

    @Override
    public A step(A acc, List<Object> row) {
      rows++;
      return downstream.step(acc, passthrough ? row : mapping.apply(row));
    }
  }
}
