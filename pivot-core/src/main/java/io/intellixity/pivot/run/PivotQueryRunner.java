package io.intellixity.pivot.run;

import io.intellixity.pivot.compile.PivotRequestNormalizer;
import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.ExecutionContext;
import io.intellixity.pivot.exec.QueryEngine;
import io.intellixity.pivot.exec.QueryResult;
import io.intellixity.pivot.exec.RowReducer;
import io.intellixity.pivot.merge.PivotStreamMerger;
import io.intellixity.pivot.plan.PivotPlan;
import io.intellixity.pivot.plan.PivotQueryPlanner;
import io.intellixity.pivot.plan.PivotRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Entry point for pivot queries: normalize, plan, then stream every derived query's rows into one reducer.
 *
 * The result has the shape of a single-query result: columns are the expected schema, rows are the
 * concatenation of all derived queries' rows.
 */
public final class PivotQueryRunner {
  private static final Logger log = LoggerFactory.getLogger(PivotQueryRunner.class);

  private final QueryEngine engine;
  private final PivotRequestNormalizer normalizer;
  private final PivotQueryPlanner planner;
  private final PivotStreamMerger merger;

  public PivotQueryRunner(QueryEngine engine) {
    this(engine, new PivotRequestNormalizer(), new PivotQueryPlanner(engine), new PivotStreamMerger(engine));
  }

  public PivotQueryRunner(QueryEngine engine,
                          PivotRequestNormalizer normalizer,
                          PivotQueryPlanner planner,
                          PivotStreamMerger merger) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.merger = Objects.requireNonNull(merger, "merger");
  }

  /**
   * Run a raw (e.g. JSON-decoded) request.
   *
   * @param rawRequest map with {@code query} and the axis keys in any supported naming convention
   * @param info optional request info, merged into the context's info
   * @param context optional execution context (cancellation)
   * @param rff reducer factory, called once with the expected schema before any row is emitted
   */
  public <A> A run(Map<String, Object> rawRequest,
                   Map<String, Object> info,
                   ExecutionContext context,
                   Function<List<ColumnMetadata>, RowReducer<A>> rff) {
    ExecutionContext ctx = (context == null) ? ExecutionContext.defaults() : context;
    if (info != null && !info.isEmpty()) ctx = ctx.withInfo(info);
    return run(normalizer.normalize(rawRequest), ctx, rff);
  }

  public <A> A run(PivotRequest request,
                   ExecutionContext context,
                   Function<List<ColumnMetadata>, RowReducer<A>> rff) {
    return execute(planner.plan(request), context, rff);
  }

  /** Normalize and plan a raw request without executing anything. */
  public PivotPlan plan(Map<String, Object> rawRequest) {
    return planner.plan(normalizer.normalize(rawRequest));
  }

  /** Execute a plan produced by {@link #plan}; the reducer is completed before returning. */
  public <A> A execute(PivotPlan plan,
                       ExecutionContext context,
                       Function<List<ColumnMetadata>, RowReducer<A>> rff) {
    Objects.requireNonNull(plan, "plan");
    Objects.requireNonNull(rff, "rff");
    ExecutionContext ctx = (context == null) ? ExecutionContext.defaults() : context;

    if (log.isDebugEnabled()) {
      log.debug("pivot.run engine={} queries={} groups={} info={}",
          engine.id(), plan.queries().size(), plan.groupNumbers(), ctx.info());
    }

    RowReducer<A> reducer = Objects.requireNonNull(rff.apply(plan.expectedSchema()), "reducer");
    A acc = merger.run(plan.queries(), plan.expectedSchema(), reducer, ctx.cancellation());
    return reducer.complete(acc);
  }

  /** Run and buffer the merged result. */
  public QueryResult run(PivotRequest request, ExecutionContext context) {
    AtomicReference<List<ColumnMetadata>> cols = new AtomicReference<>();
    List<List<Object>> rows = run(request, context, schema -> {
      cols.set(schema);
      return QueryResult.collector();
    });
    return new QueryResult(cols.get(), rows);
  }

  public QueryResult run(PivotRequest request) {
    return run(request, ExecutionContext.defaults());
  }
}
