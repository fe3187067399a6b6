package io.intellixity.pivot.jdbc;

import io.intellixity.pivot.spi.sql.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SQL with named bind placeholders ({@code :b1}, {@code :b2}...) and the bind values in placeholder order.
 */
public record SqlStatement(String sql, List<Object> binds) implements NativeStatement {
  public SqlStatement {
    // bind values may be null
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }
}
