package io.intellixity.pivot.spi.sql;

import io.intellixity.pivot.query.Query;
import io.intellixity.pivot.query.QueryElement;

/** Backend-agnostic SPI: renders an aggregate query (with its normalized filter) into a native statement. */
public interface Dialect<S extends NativeStatement> {
  String id();

  S renderSelect(Query query, QueryElement normalizedFilter);
}
