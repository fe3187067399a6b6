package io.intellixity.pivot.jdbc.dialect;

import io.intellixity.pivot.jdbc.SqlStatement;
import io.intellixity.pivot.spi.sql.Dialect;

/** Dialect for JDBC engines (statement rendering only). */
public interface JdbcDialect extends Dialect<SqlStatement> {
}
