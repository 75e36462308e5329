package io.intellixity.docsql.exec.handle;

/**
 * Runtime handle onto one store.
 *
 * For JDBC, client() is a javax.sql.DataSource and namespace() the schema.
 */
public interface EngineHandle<TClient> {
  /** Identifier for logging. */
  String id();

  /** Native client used by the adapter. */
  TClient client();

  /** Schema / database; may be null for the store default. */
  String namespace();
}
