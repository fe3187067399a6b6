package io.intellixity.pivot.exec;

/** Cooperative cancellation flag observed by engines and the pivot stream merger. */
public interface CancellationSignal {
  CancellationSignal NONE = () -> false;

  boolean isCancelled();
}
