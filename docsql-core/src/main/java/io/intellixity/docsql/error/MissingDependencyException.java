package io.intellixity.docsql.error;

/** The JDBC driver (or another runtime library) required by the configured backend is not on the classpath. */
public final class MissingDependencyException extends DocsqlException {
  private final String dependency;

  public MissingDependencyException(String dependency, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
  }

  public String dependency() {
    return dependency;
  }
}
