package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.error.ConfigurationException;
import io.intellixity.docsql.jdbc.dialect.*;

import java.util.Locale;
import java.util.function.Supplier;

/** Supported relational backends: JDBC driver class, URL prefix and SQL dialect. */
public enum BackendKind {
  H2("org.h2.Driver", "jdbc:h2:", H2Dialect::new),
  POSTGRES("org.postgresql.Driver", "jdbc:postgresql:", PostgresDialect::new),
  MYSQL("com.mysql.cj.jdbc.Driver", "jdbc:mysql:", MySqlDialect::new),
  SQLITE("org.sqlite.JDBC", "jdbc:sqlite:", SqliteDialect::new),
  MSSQL("com.microsoft.sqlserver.jdbc.SQLServerDriver", "jdbc:sqlserver:", MsSqlDialect::new);

  private final String driverClassName;
  private final String urlPrefix;
  private final Supplier<JdbcDialect> dialect;

  BackendKind(String driverClassName, String urlPrefix, Supplier<JdbcDialect> dialect) {
    this.driverClassName = driverClassName;
    this.urlPrefix = urlPrefix;
    this.dialect = dialect;
  }

  public String driverClassName() { return driverClassName; }
  public String urlPrefix() { return urlPrefix; }
  public JdbcDialect newDialect() { return dialect.get(); }

  /** Parse a backend name; common aliases ({@code pg}, {@code postgresql}, {@code mariadb}, {@code sqlserver}) accepted. */
  public static BackendKind fromId(String id) {
    if (id == null || id.isBlank()) throw new ConfigurationException("Backend kind is required");
    String v = id.trim().toLowerCase(Locale.ROOT);
    return switch (v) {
      case "h2" -> H2;
      case "postgres", "postgresql", "pg" -> POSTGRES;
      case "mysql", "mysql2", "mariadb" -> MYSQL;
      case "sqlite", "sqlite3" -> SQLITE;
      case "mssql", "sqlserver" -> MSSQL;
      default -> throw new ConfigurationException("Unknown backend kind '" + id + "'");
    };
  }

  /** Backend implied by a JDBC URL, or {@code null} when the prefix is not recognized. */
  public static BackendKind fromJdbcUrl(String url) {
    if (url == null) return null;
    for (BackendKind k : values()) {
      if (url.startsWith(k.urlPrefix)) return k;
    }
    if (url.startsWith("jdbc:mariadb:")) return MYSQL;
    return null;
  }
}
