package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.IndexDefinition;

/**
 * SQL Server dialect.
 *
 * <p>OFFSET / FETCH is only legal after ORDER BY, so the query assembler injects an identity ordering when
 * an offset comes without a sort. A bare limit renders as {@code TOP (n)}.
 */
public final class MsSqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "mssql"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "[" + ident.replace("]", "]]") + "]";
  }

  @Override
  public boolean requiresOrderByForOffset() {
    return true;
  }

  @Override
  protected String selectHead(SelectPlan plan) {
    if (plan.limit() != null && plan.offset() == null) return "SELECT TOP (" + plan.limit() + ")";
    return "SELECT";
  }

  @Override
  protected void appendPaging(StringBuilder sql, Integer limit, Integer offset) {
    if (offset == null) return;
    sql.append(" OFFSET ").append(offset).append(" ROWS");
    if (limit != null) sql.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
  }

  @Override
  public SqlStatement renderDropIndex(TableRef table, IndexDefinition index) {
    return SqlStatement.update("DROP INDEX " + quoteIdent(indexName(table, index)) + " ON " + qualify(table));
  }

  @Override
  public String autoIncrementPrimaryKey(String column) {
    return quoteIdent(column) + " INT IDENTITY(1,1) PRIMARY KEY";
  }

  @Override
  protected String sqlType(ColumnType type, Integer length) {
    return switch (type) {
      case STRING -> "NVARCHAR(" + (length == null ? DEFAULT_STRING_LENGTH : length) + ")";
      case TEXT, JSON, JSONB -> "NVARCHAR(MAX)";
      case DOUBLE -> "FLOAT";
      case BOOLEAN -> "BIT";
      case DATETIME, TIMESTAMP -> "DATETIME2";
      case BINARY -> "VARBINARY(MAX)";
      case UUID -> "UNIQUEIDENTIFIER";
      default -> super.sqlType(type, length);
    };
  }
}
