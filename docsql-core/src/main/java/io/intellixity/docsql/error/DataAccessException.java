package io.intellixity.docsql.error;

/** Store-side failure. The driver's exception (usually a {@link java.sql.SQLException}) is the cause. */
public class DataAccessException extends DocsqlException {
  public DataAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
