package io.intellixity.pivot.jdbc.postgres;

import io.intellixity.pivot.jdbc.SqlStatement;
import io.intellixity.pivot.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.pivot.jdbc.dialect.JdbcDialect;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected SqlStatement applyLimit(SqlStatement base, int limit) {
    return new SqlStatement(base.sql() + " LIMIT " + limit, base.binds());
  }
}
