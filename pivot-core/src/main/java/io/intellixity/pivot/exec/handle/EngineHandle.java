package io.intellixity.pivot.exec.handle;

/**
 * Resolved runtime handle for a backend engine family.
 *
 * Example:
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client/handle used by an engine (DataSource, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle, or null. */
  String namespace();
}
