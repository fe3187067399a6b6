package io.intellixity.pivot.spi.exec;

import io.intellixity.pivot.compile.QueryNormalizer;
import io.intellixity.pivot.exec.CancellationSignal;
import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.QueryColumns;
import io.intellixity.pivot.exec.QueryEngine;
import io.intellixity.pivot.exec.RowReducer;
import io.intellixity.pivot.exec.handle.EngineHandle;
import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryElement;
import io.intellixity.pivot.spi.sql.Dialect;
import io.intellixity.pivot.spi.sql.NativeStatement;

import java.util.List;
import java.util.Objects;

/**
 * Template-method orchestrator for single-query execution.
 *
 * Responsibilities:
 * - Normalize the filter via {@link QueryNormalizer}
 * - Validate via {@link QueryValidationStrategy}
 * - Render native statements using {@link Dialect}
 * - Delegate execution to the backend-specific {@link #executeSelect} hook
 */
public abstract class AbstractQueryEngine<S extends NativeStatement, H extends EngineHandle<?>> implements QueryEngine {
  private final H handle;
  private final Dialect<S> dialect;
  private final QueryNormalizer queryNormalizer;
  private final QueryValidationStrategy queryValidation;

  /**
   * DI-friendly constructor: callers provide the supporting normalizer/validation.
   *
   * This makes it easy to override behavior in tests or in applications without modifying engines.
   */
  protected AbstractQueryEngine(Dialect<S> dialect,
                                H handle,
                                QueryNormalizer queryNormalizer,
                                QueryValidationStrategy queryValidation) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.queryNormalizer = Objects.requireNonNull(queryNormalizer, "queryNormalizer");
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractQueryEngine(Dialect<S> dialect, H handle) {
    this(dialect, handle, new QueryNormalizer(), new DefaultQueryValidationStrategy());
  }

  /**
   * Backend-specific execution: run {@code statement}, call {@code reducer.step} per row in backend order and
   * stop once {@code cancellation} is set. Returns the (not yet completed) accumulator.
   */
  protected abstract <A> A executeSelect(S statement,
                                         List<ColumnMetadata> columns,
                                         RowReducer<A> reducer,
                                         A init,
                                         CancellationSignal cancellation);

  @Override
  public String id() {
    return dialect.id() + ":" + handle.id();
  }

  public final H handle() { return handle; }
  protected final Dialect<S> dialect() { return dialect; }
  protected final QueryNormalizer queryNormalizer() { return queryNormalizer; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  /** Structural description; nothing is sent to the backend. */
  @Override
  public List<ColumnMetadata> describeExpectedColumns(Query query) {
    Objects.requireNonNull(query, "query");
    queryValidation().validate(query, queryNormalizer.normalize(query));
    return QueryColumns.describe(query);
  }

  @Override
  public final <A> A execute(Query query, RowReducer<A> reducer, CancellationSignal cancellation) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(reducer, "reducer");
    CancellationSignal signal = (cancellation == null) ? CancellationSignal.NONE : cancellation;

    S stmt = render(query);

    A acc = reducer.init();
    if (signal.isCancelled()) return reducer.complete(acc);
    acc = executeSelect(stmt, QueryColumns.describe(query), reducer, acc, signal);
    return reducer.complete(acc);
  }

  /** Prepares a statement for {@link #executeSelect}; exposed for tests and explain-style tooling. */
  public final S render(Query query) {
    Objects.requireNonNull(query, "query");
    QueryElement filter = queryNormalizer.normalize(query);
    queryValidation().validate(query, filter);
    return dialect.renderSelect(query, filter);
  }
}
