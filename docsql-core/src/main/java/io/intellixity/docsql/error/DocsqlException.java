package io.intellixity.docsql.error;

/** Base type for every failure raised by docsql. Unchecked. */
public class DocsqlException extends RuntimeException {
  public DocsqlException(String message) {
    super(message);
  }

  public DocsqlException(String message, Throwable cause) {
    super(message, cause);
  }
}
