package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.IndexDefinition;

import java.util.Locale;

/** MySQL / MariaDB dialect. */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  // MySQL has no "OFFSET without LIMIT"; the documented idiom is the largest BIGINT UNSIGNED
  static final String MAX_ROWS = "18446744073709551615";

  @Override public String id() { return "mysql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected void appendPaging(StringBuilder sql, Integer limit, Integer offset) {
    if (limit == null && offset == null) return;
    sql.append(" LIMIT ").append(limit != null ? String.valueOf(limit) : MAX_ROWS);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  @Override
  protected String emptyInsertValues() {
    return "() VALUES ()";
  }

  @Override
  public SqlStatement renderCreateIndex(TableRef table, IndexDefinition index) {
    String type = (index.unique() || index.type() == null) ? "" : index.type().trim().toUpperCase(Locale.ROOT);
    boolean method = type.equals("BTREE") || type.equals("HASH");
    String prefix = index.unique() ? "UNIQUE " : (!type.isEmpty() && !method ? type + " " : "");
    String sql = "CREATE " + prefix + "INDEX " + quoteIdent(indexName(table, index))
        + (method ? " USING " + type : "")
        + " ON " + qualify(table) + " (" + columnList(index.fields()) + ")";
    return SqlStatement.update(sql);
  }

  @Override
  public SqlStatement renderDropIndex(TableRef table, IndexDefinition index) {
    return SqlStatement.update("DROP INDEX " + quoteIdent(indexName(table, index)) + " ON " + qualify(table));
  }

  @Override
  public String autoIncrementPrimaryKey(String column) {
    return quoteIdent(column) + " INT UNSIGNED NOT NULL AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String sqlType(ColumnType type, Integer length) {
    return switch (type) {
      case TEXT -> "TEXT";
      case FLOAT -> "FLOAT";
      case DOUBLE -> "DOUBLE";
      case DATETIME -> "DATETIME";
      case BINARY -> "BLOB";
      case UUID -> "CHAR(36)";
      default -> super.sqlType(type, length);
    };
  }
}
