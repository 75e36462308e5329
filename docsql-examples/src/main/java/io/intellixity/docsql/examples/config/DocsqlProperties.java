package io.intellixity.docsql.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "docsql")
public class DocsqlProperties {
  /** h2, postgres, mysql, sqlite or mssql; inferred from the url when empty. */
  private String backend;
  private String url;
  private String username;
  private String password;
  private String schema;
  private String table;
  private int poolMaxSize = 10;
  /** Drop and recreate the table on startup. */
  private boolean createTable = true;

  public String getBackend() { return backend; }
  public void setBackend(String backend) { this.backend = backend; }
  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getSchema() { return schema; }
  public void setSchema(String schema) { this.schema = schema; }
  public String getTable() { return table; }
  public void setTable(String table) { this.table = table; }
  public int getPoolMaxSize() { return poolMaxSize; }
  public void setPoolMaxSize(int poolMaxSize) { this.poolMaxSize = poolMaxSize; }
  public boolean isCreateTable() { return createTable; }
  public void setCreateTable(boolean createTable) { this.createTable = createTable; }
}
