package io.intellixity.docsql.query;

import io.intellixity.docsql.error.DocsqlException;

/**
 * Raised when a filter cannot be turned into a predicate: a blank field, or an operator token that ended up
 * being used as a column name.
 */
public final class QueryValidationException extends DocsqlException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
