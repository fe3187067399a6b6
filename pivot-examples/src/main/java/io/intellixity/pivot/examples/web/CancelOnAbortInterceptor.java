package io.intellixity.pivot.examples.web;

import io.intellixity.pivot.exec.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.async.CallableProcessingInterceptor;

import java.util.concurrent.Callable;

/**
 * Ties a streamed pivot run to its async request: timeout, error (client gone) or completion cancel the
 * token, so queries not yet started are skipped.
 */
final class CancelOnAbortInterceptor implements CallableProcessingInterceptor {
  private static final Logger log = LoggerFactory.getLogger(CancelOnAbortInterceptor.class);

  private final CancellationToken token;

  CancelOnAbortInterceptor(CancellationToken token) {
    this.token = token;
  }

  @Override
  public <T> Object handleTimeout(NativeWebRequest request, Callable<T> task) {
    cancel("timeout", null);
    return RESULT_NONE;
  }

  @Override
  public <T> Object handleError(NativeWebRequest request, Callable<T> task, Throwable t) {
    cancel("error", t);
    return RESULT_NONE;
  }

  @Override
  public <T> void afterCompletion(NativeWebRequest request, Callable<T> task) {
    token.cancel();
  }

  private void cancel(String reason, Throwable t) {
    if (token.isCancelled()) return;
    token.cancel();
    if (log.isDebugEnabled()) {
      log.debug("pivot.http_cancelled reason={} error={}", reason, (t == null) ? null : t.toString());
    }
  }
}
