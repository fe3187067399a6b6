package io.intellixity.pivot.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.pivot.compile.PivotRequestNormalizer;
import io.intellixity.pivot.exec.QueryEngine;
import io.intellixity.pivot.jdbc.JdbcHandle;
import io.intellixity.pivot.jdbc.JdbcQueryEngine;
import io.intellixity.pivot.jdbc.postgres.PostgresDialect;
import io.intellixity.pivot.merge.PivotStreamMerger;
import io.intellixity.pivot.plan.PivotQueryPlanner;
import io.intellixity.pivot.run.PivotQueryRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PivotDatasourceProperties.class)
public class PivotExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource pivotDataSource(PivotDatasourceProperties props) {
    if (props.getJdbcUrl() == null || props.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing pivot.datasource.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(props.getJdbcUrl());
    hc.setUsername(props.getUsername());
    hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getMaximumPoolSize());
    hc.setReadOnly(true);
    hc.setPoolName("pivot");
    return new HikariDataSource(hc);
  }

  @Bean
  public QueryEngine queryEngine(HikariDataSource ds, PivotDatasourceProperties props) {
    JdbcHandle handle = new JdbcHandle("jdbc:pivot", ds, props.getSchema(), props.getFetchSize());
    return new JdbcQueryEngine(handle, new PostgresDialect());
  }

  @Bean
  public PivotQueryRunner pivotQueryRunner(QueryEngine engine, ObjectMapper json) {
    // Boot's mapper, so raw "query" maps go through the same Jackson configuration as request bodies.
    return new PivotQueryRunner(engine,
        new PivotRequestNormalizer(json),
        new PivotQueryPlanner(engine),
        new PivotStreamMerger(engine));
  }
}
