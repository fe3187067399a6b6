package io.intellixity.pivot.jdbc;

import io.intellixity.pivot.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC-family engine handle (resolved by application code). */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;
  private final int fetchSize;

  public JdbcHandle(String id, DataSource client, String schema, int fetchSize) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    if (fetchSize < 0) throw new IllegalArgumentException("fetchSize must be >= 0");
    this.fetchSize = fetchSize;
  }

  public JdbcHandle(String id, DataSource client, String schema) {
    this(id, client, schema, 0);
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  /** Rows fetched per round trip; 0 leaves the driver default (and autocommit untouched). */
  public int fetchSize() { return fetchSize; }
}
