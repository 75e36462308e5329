package io.intellixity.docsql.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class DocsqlExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(DocsqlExamplesApplication.class, args);
  }
}
