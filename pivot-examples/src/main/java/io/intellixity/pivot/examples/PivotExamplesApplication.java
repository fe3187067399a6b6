package io.intellixity.pivot.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class PivotExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PivotExamplesApplication.class, args);
  }
}
