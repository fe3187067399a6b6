package io.intellixity.pivot.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run execution settings.
 *
 * @param cancellation observed between derived queries (and by the engine between rows)
 * @param info free-form request info (executed-by, context, ...) carried for logging
 */
public record ExecutionContext(CancellationSignal cancellation, Map<String, Object> info) {
  public ExecutionContext {
    cancellation = (cancellation == null) ? CancellationSignal.NONE : cancellation;
    // decoded request info may carry null values
    info = (info == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(info));
  }

  public static ExecutionContext defaults() {
    return new ExecutionContext(CancellationSignal.NONE, Map.of());
  }

  public ExecutionContext withInfo(Map<String, Object> info) {
    return new ExecutionContext(cancellation, info);
  }
}
