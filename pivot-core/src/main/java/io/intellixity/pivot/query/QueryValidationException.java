package io.intellixity.pivot.query;

/**
 * Raised when a Query or pivot request references invalid/unknown fields or otherwise fails validation.
 * <p>
 * Intended to be thrown by backend-agnostic validation (and optionally by engines as a safety net).
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
