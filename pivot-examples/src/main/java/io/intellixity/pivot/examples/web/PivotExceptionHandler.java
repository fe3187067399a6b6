package io.intellixity.pivot.examples.web;

import io.intellixity.pivot.plan.InvalidPivotRequestException;
import io.intellixity.pivot.plan.PivotQueryGenerationException;
import io.intellixity.pivot.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public final class PivotExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PivotExceptionHandler.class);

  @ExceptionHandler(InvalidPivotRequestException.class)
  public ResponseEntity<Map<String, Object>> invalidPivot(InvalidPivotRequestException e) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("axis", e.axis().key());
    body.put("index", e.index());
    body.put("breakoutCount", e.breakoutCount());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<Map<String, Object>> invalidQuery(QueryValidationException e) {
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }

  @ExceptionHandler(PivotQueryGenerationException.class)
  public ResponseEntity<Map<String, Object>> generationFailed(PivotQueryGenerationException e) {
    log.warn("pivot.generation_failed query={}", e.query(), e);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("cause", e.getCause() == null ? null : e.getCause().getMessage());
    body.put("query", e.query());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
