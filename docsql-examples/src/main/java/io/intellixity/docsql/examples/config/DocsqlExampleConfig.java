package io.intellixity.docsql.examples.config;

import io.intellixity.docsql.exec.TableAdapter;
import io.intellixity.docsql.jdbc.AdapterConfig;
import io.intellixity.docsql.jdbc.BackendKind;
import io.intellixity.docsql.jdbc.JdbcTableAdapter;
import io.intellixity.docsql.schema.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DocsqlProperties.class)
public class DocsqlExampleConfig {

  @Bean
  public EntityDefinition productEntity() {
    return EntityDefinition.builder("products")
        .field(FieldDefinition.builder("id").columnType(ColumnType.INTEGER).primaryKey(true).build())
        .field(FieldDefinition.builder("name").columnType(ColumnType.STRING).max(120).build())
        .field(FieldDefinition.builder("description").columnType(ColumnType.TEXT).build())
        .field(FieldDefinition.builder("price").columnType(ColumnType.DECIMAL).build())
        .field(FieldDefinition.builder("quantity").columnType(ColumnType.INTEGER).build())
        .field(FieldDefinition.builder("status").columnType(ColumnType.STRING).columnLength(16).build())
        .field(FieldDefinition.builder("displayName").columnType(ColumnType.STRING).virtual(true).build())
        .index(IndexDefinition.on("status"))
        .index(IndexDefinition.unique("name"))
        .build();
  }

  @Bean(destroyMethod = "disconnect")
  public TableAdapter productAdapter(EntityDefinition productEntity, DocsqlProperties props) {
    AdapterConfig.Builder b = AdapterConfig.builder()
        .jdbcUrl(props.getUrl())
        .username(props.getUsername())
        .password(props.getPassword())
        .schema(props.getSchema())
        .tableName(props.getTable())
        .maxPoolSize(props.getPoolMaxSize());
    if (props.getBackend() != null && !props.getBackend().isBlank()) b.backend(BackendKind.fromId(props.getBackend()));

    TableAdapter adapter = new JdbcTableAdapter(productEntity, b.build());
    adapter.connect();
    if (props.isCreateTable()) adapter.createTable();
    return adapter;
  }
}
