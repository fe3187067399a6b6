package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.Query;

/** The base query's structure does not support the pivot rewriting. */
public final class PivotQueryGenerationException extends RuntimeException {
  private final transient Query query;

  public PivotQueryGenerationException(Query query, Throwable cause) {
    super("Error generating pivot queries", cause);
    this.query = query;
  }

  /** The offending base query. */
  public Query query() { return query; }
}
