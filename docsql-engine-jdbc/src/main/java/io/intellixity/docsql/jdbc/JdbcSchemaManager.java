package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.error.ConfigurationException;
import io.intellixity.docsql.error.DataAccessException;
import io.intellixity.docsql.jdbc.dialect.JdbcDialect;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Table and index DDL for one table.
 *
 * <p>{@link #createTable} renders every statement before touching the store, so an unsupported column type
 * fails without dropping or creating anything.
 */
public final class JdbcSchemaManager {
  private static final Logger log = LoggerFactory.getLogger(JdbcSchemaManager.class);

  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final JdbcStatementExecutor executor;
  private final TableRef table;

  public JdbcSchemaManager(JdbcHandle handle, JdbcDialect dialect, JdbcStatementExecutor executor, TableRef table) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.table = Objects.requireNonNull(table, "table");
  }

  public TableRef table() { return table; }

  public void createTable(List<FieldDefinition> fields, List<IndexDefinition> indexes,
                          boolean dropTableIfExists, boolean createIndexes) {
    SqlStatement create = dialect.renderCreateTable(table, columnDefinitions(fields));
    List<SqlStatement> indexDdl = new ArrayList<>();
    if (createIndexes && indexes != null) {
      for (IndexDefinition def : indexes) indexDdl.add(dialect.renderCreateIndex(table, def));
    }

    if (dropTableIfExists) dropTable();

    log.info("Creating '{}' table...", table);
    runAll("CREATE_TABLE", List.of(create));
    runAll("CREATE_INDEX", indexDdl);
    log.info("Table '{}' created.", table);
  }

  /** Column definitions in field order; virtual fields are skipped. */
  List<String> columnDefinitions(List<FieldDefinition> fields) {
    List<String> columns = new ArrayList<>();
    for (FieldDefinition f : fields) {
      if (f.virtual()) continue;
      ColumnType type = ColumnType.fromId(f.columnType()).orElseThrow(() -> new ConfigurationException(
          "Field '" + f.columnName() + "' columnType '" + f.columnType() + "' is not a valid type."));

      if (f.primaryKey()) {
        columns.add(f.userGenerated() && !type.isAutoIncrement()
            ? dialect.typedPrimaryKey(f, type)
            : dialect.autoIncrementPrimaryKey(f.columnName()));
      } else {
        columns.add(dialect.columnDefinition(f, type));
      }
    }
    return columns;
  }

  public void dropTable() {
    dropTable(table.name());
  }

  /** Drop a table in the same schema as this one. */
  public void dropTable(String tableName) {
    TableRef target = new TableRef(table.schema(), tableName);
    log.info("Dropping '{}' table...", target);
    runAll("DROP_TABLE", List.of(dialect.renderDropTable(target)));
  }

  public void createIndex(IndexDefinition def) {
    runAll("CREATE_INDEX", List.of(dialect.renderCreateIndex(table, def)));
  }

  public void removeIndex(IndexDefinition def) {
    runAll("DROP_INDEX", List.of(dialect.renderDropIndex(table, def)));
  }

  private void runAll(String op, List<SqlStatement> statements) {
    if (statements.isEmpty()) return;
    try (Connection c = handle.client().getConnection()) {
      for (SqlStatement ss : statements) executor.update(c, op, ss);
    } catch (SQLException e) {
      throw new DataAccessException(op + " failed on '" + table + "': " + e.getMessage(), e);
    }
  }
}
