package io.intellixity.docsql.error;

/**
 * A multi-statement write was rolled back. {@link #getCause()} is the failure that aborted it, untouched.
 */
public final class TransactionException extends DocsqlException {
  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
