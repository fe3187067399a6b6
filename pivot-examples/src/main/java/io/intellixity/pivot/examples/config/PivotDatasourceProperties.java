package io.intellixity.pivot.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pivot.datasource")
public class PivotDatasourceProperties {
  private String jdbcUrl;
  private String username;
  private String password;
  private String schema = "public";
  private int maximumPoolSize = 10;

  /** Rows per round trip while streaming a derived query; 0 buffers per driver default. */
  private int fetchSize = 500;

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getSchema() { return schema; }
  public void setSchema(String schema) { this.schema = schema; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public int getFetchSize() { return fetchSize; }
  public void setFetchSize(int fetchSize) { this.fetchSize = fetchSize; }
}
