package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.error.ConfigurationException;

import java.util.Objects;
import java.util.Properties;

/**
 * Connection and table settings for a {@link JdbcTableAdapter}. Validated on {@link Builder#build()}.
 */
public final class AdapterConfig {
  public static final String DEFAULT_PREFIX = "docsql.";
  public static final int DEFAULT_POOL_SIZE = 10;

  private final BackendKind backend;
  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final String schema;
  private final String tableName;
  private final int maxPoolSize;

  private AdapterConfig(Builder b) {
    this.backend = b.backend;
    this.jdbcUrl = b.jdbcUrl;
    this.username = b.username;
    this.password = b.password;
    this.schema = (b.schema == null || b.schema.isBlank()) ? null : b.schema;
    this.tableName = (b.tableName == null || b.tableName.isBlank()) ? null : b.tableName;
    this.maxPoolSize = b.maxPoolSize;
  }

  public BackendKind backend() { return backend; }
  public String jdbcUrl() { return jdbcUrl; }
  public String username() { return username; }
  public String password() { return password; }
  public String schema() { return schema; }
  /** Table override; {@code null} means the entity's own table name. */
  public String tableName() { return tableName; }
  public int maxPoolSize() { return maxPoolSize; }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read {@code <prefix>backend}, {@code url}, {@code username}, {@code password}, {@code schema},
   * {@code table} and {@code pool.maxSize}. The backend may be omitted when the URL identifies it.
   */
  public static AdapterConfig fromProperties(Properties props, String prefix) {
    Objects.requireNonNull(props, "props");
    String p = (prefix == null) ? DEFAULT_PREFIX : prefix;
    Builder b = builder()
        .jdbcUrl(props.getProperty(p + "url"))
        .username(props.getProperty(p + "username"))
        .password(props.getProperty(p + "password"))
        .schema(props.getProperty(p + "schema"))
        .tableName(props.getProperty(p + "table"));
    String backend = props.getProperty(p + "backend");
    if (backend != null && !backend.isBlank()) b.backend(BackendKind.fromId(backend));
    String pool = props.getProperty(p + "pool.maxSize");
    if (pool != null && !pool.isBlank()) {
      try {
        b.maxPoolSize(Integer.parseInt(pool.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid " + p + "pool.maxSize: '" + pool + "'", e);
      }
    }
    return b.build();
  }

  public static AdapterConfig fromProperties(Properties props) {
    return fromProperties(props, DEFAULT_PREFIX);
  }

  @Override
  public String toString() {
    return "AdapterConfig{backend=" + backend + ", jdbcUrl=" + jdbcUrl + ", username=" + username
        + ", schema=" + schema + ", tableName=" + tableName + ", maxPoolSize=" + maxPoolSize + "}";
  }

  public static final class Builder {
    private BackendKind backend;
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema;
    private String tableName;
    private int maxPoolSize = DEFAULT_POOL_SIZE;

    private Builder() {}

    public Builder backend(BackendKind v) { this.backend = v; return this; }
    public Builder jdbcUrl(String v) { this.jdbcUrl = v; return this; }
    public Builder username(String v) { this.username = v; return this; }
    public Builder password(String v) { this.password = v; return this; }
    public Builder schema(String v) { this.schema = v; return this; }
    public Builder tableName(String v) { this.tableName = v; return this; }
    public Builder maxPoolSize(int v) { this.maxPoolSize = v; return this; }

    public AdapterConfig build() {
      if (jdbcUrl == null || jdbcUrl.isBlank()) throw new ConfigurationException("JDBC url is required");
      if (!jdbcUrl.startsWith("jdbc:")) throw new ConfigurationException("Not a JDBC url: '" + jdbcUrl + "'");
      if (backend == null) backend = BackendKind.fromJdbcUrl(jdbcUrl);
      if (backend == null) throw new ConfigurationException("Cannot infer backend kind from url '" + jdbcUrl + "'; set it explicitly");
      if (maxPoolSize < 1) throw new ConfigurationException("maxPoolSize must be >= 1, got " + maxPoolSize);
      return new AdapterConfig(this);
    }
  }
}
