package io.intellixity.pivot.spi.exec;

import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryElement;

/**
 * SPI hook to validate queries before backend rendering/execution.
 * <p>
 * Engines call this after {@link io.intellixity.pivot.compile.QueryNormalizer} normalization and before
 * dialect rendering. Applications/backends may plug in stricter rules or additional validation.
 */
public interface QueryValidationStrategy {
  void validate(Query query, QueryElement normalizedFilter);
}
