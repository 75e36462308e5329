package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.schema.ColumnType;

/** SQLite dialect. SQLite has no TRUNCATE and no OFFSET without LIMIT. */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  protected void appendPaging(StringBuilder sql, Integer limit, Integer offset) {
    if (limit == null && offset == null) return;
    sql.append(" LIMIT ").append(limit != null ? limit : -1);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  @Override
  public SqlStatement renderTruncate(TableRef table) {
    return SqlStatement.update("DELETE FROM " + qualify(table));
  }

  @Override
  public String autoIncrementPrimaryKey(String column) {
    return quoteIdent(column) + " INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  @Override
  protected String sqlType(ColumnType type, Integer length) {
    return switch (type) {
      case TEXT, JSON, JSONB -> "TEXT";
      case DOUBLE -> "REAL";
      case DATETIME -> "DATETIME";
      case UUID -> "CHAR(36)";
      default -> super.sqlType(type, length);
    };
  }
}
