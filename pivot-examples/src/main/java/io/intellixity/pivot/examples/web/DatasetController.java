package io.intellixity.pivot.examples.web;

import io.intellixity.pivot.examples.service.PivotService;
import io.intellixity.pivot.exec.CancellationToken;
import io.intellixity.pivot.plan.PivotPlan;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.async.WebAsyncUtils;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.UncheckedIOException;
import java.util.Map;

@RestController
@RequestMapping("/api/dataset")
public final class DatasetController {
  private final PivotService pivots;

  public DatasetController(PivotService pivots) {
    this.pivots = pivots;
  }

  /**
   * Runs a pivot request ({@code query} plus {@code pivot-rows}/{@code pivot-cols}) and streams
   * {@code {cols, rows}} back. Request errors surface before the response is committed; once streaming,
   * a timeout or a dropped client stops the remaining derived queries.
   */
  @PostMapping(value = "/pivot", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StreamingResponseBody> pivot(@RequestBody Map<String, Object> request,
                                                     HttpServletRequest servletRequest) {
    PivotPlan plan = pivots.plan(request);
    CancellationToken token = new CancellationToken();
    WebAsyncUtils.getAsyncManager(servletRequest)
        .registerCallableInterceptor(CancelOnAbortInterceptor.class.getName(), new CancelOnAbortInterceptor(token));

    StreamingResponseBody body = out -> {
      try {
        pivots.stream(plan, Map.of("context", "ad-hoc"), token, out);
      } catch (UncheckedIOException e) {
        // write failures reach the container as plain IOExceptions (client disconnects)
        throw e.getCause();
      }
    };
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body);
  }
}
