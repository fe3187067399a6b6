package io.intellixity.pivot.jdbc;

import io.intellixity.pivot.compile.QueryNormalizer;
import io.intellixity.pivot.exec.CancellationSignal;
import io.intellixity.pivot.exec.ColumnMetadata;
import io.intellixity.pivot.exec.RowReducer;
import io.intellixity.pivot.jdbc.dialect.JdbcDialect;
import io.intellixity.pivot.spi.exec.AbstractQueryEngine;
import io.intellixity.pivot.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.*;

public final class JdbcQueryEngine extends AbstractQueryEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);
  private final DataSource ds;

  public JdbcQueryEngine(JdbcHandle handle,
                         JdbcDialect dialect,
                         QueryNormalizer normalizer,
                         QueryValidationStrategy validation) {
    super(dialect, Objects.requireNonNull(handle, "handle"), normalizer, validation);
    this.ds = handle.client();
  }

  public JdbcQueryEngine(JdbcHandle handle, JdbcDialect dialect) {
    super(dialect, Objects.requireNonNull(handle, "handle"));
    this.ds = handle.client();
  }

  /** Backward-compatible constructor: wraps raw client+schema into a handle. */
  public JdbcQueryEngine(DataSource ds, JdbcDialect dialect, String schemaName) {
    this(new JdbcHandle("jdbc", ds, schemaName), dialect);
  }

  @Override
  protected <A> A executeSelect(SqlStatement ss,
                                List<ColumnMetadata> columns,
                                RowReducer<A> reducer,
                                A init,
                                CancellationSignal cancellation) {
    JdbcHandle h = handle();
    try (Connection c = ds.getConnection()) {
      if (h.schema() != null) c.setSchema(h.schema());
      // Cursor-based fetching needs an open transaction on most drivers (Postgres included).
      boolean streaming = h.fetchSize() > 0;
      if (streaming) c.setAutoCommit(false);

      String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
      long start = System.nanoTime();
      debugSql(ss, jdbcSql);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        if (streaming) ps.setFetchSize(h.fetchSize());
        bindAll(ps, ss);
        A acc = init;
        long rows = 0;
        try (ResultSet rs = ps.executeQuery()) {
          int width = rs.getMetaData().getColumnCount();
          while (!cancellation.isCancelled() && rs.next()) {
            List<Object> row = new ArrayList<>(width);
            for (int i = 1; i <= width; i++) row.add(rs.getObject(i));
            acc = reducer.step(acc, row);
            rows++;
          }
        }
        if (streaming) c.rollback();
        debugDone(ss, rows, cancellation.isCancelled(), System.nanoTime() - start);
        return acc;
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      ps.setObject(i + 1, encode(stmt.binds().get(i)));
    }
  }

  /** Values without a standard setObject mapping. */
  private static Object encode(Object v) {
    if (v instanceof Instant inst) return Timestamp.from(inst);
    if (v instanceof Enum<?> e) return e.name();
    return v;
  }

  private void debugSql(SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("pivot.jdbc op=SELECT bindCount={} handleId={} schema={} sql={}",
        ss.binds().size(), h.id(), h.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("pivot.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(SqlStatement ss, long rows, boolean cancelled, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pivot.jdbc_done op=SELECT durationMs={} rows={} cancelled={} bindCount={}",
        durationNanos / 1_000_000.0, rows, cancelled, ss.binds().size());
  }
}
