package io.intellixity.docsql.error;

/**
 * Invalid static configuration: an unknown column type, a malformed adapter config, or an entity
 * declaring more than one primary key. Raised before any statement reaches the store.
 */
public final class ConfigurationException extends DocsqlException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
