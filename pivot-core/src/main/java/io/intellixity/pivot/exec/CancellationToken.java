package io.intellixity.pivot.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/** Thread-safe, one-way cancellation flag. */
public final class CancellationToken implements CancellationSignal {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }
}
