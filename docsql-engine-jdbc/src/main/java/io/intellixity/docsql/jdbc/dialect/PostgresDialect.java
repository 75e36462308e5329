package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SqlStatement.ExecKind;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.IndexDefinition;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides; generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected ExecKind insertExecKind(String idColumn) {
    return (idColumn == null) ? ExecKind.UPDATE : ExecKind.QUERY_ONE_VALUE;
  }

  @Override
  protected String applyInsertReturning(String insertSql, String idColumn) {
    if (idColumn == null) return insertSql;
    return insertSql + " RETURNING " + quoteIdent(idColumn);
  }

  @Override
  protected void appendPaging(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  @Override
  protected String renderIlike(String expr, String placeholder) {
    return expr + " ILIKE " + placeholder;
  }

  @Override
  protected String indexMethod(IndexDefinition index) {
    if (index.unique() || index.type() == null || index.type().isBlank()) return "";
    return " USING " + index.type();
  }

  @Override
  public String autoIncrementPrimaryKey(String column) {
    return quoteIdent(column) + " SERIAL PRIMARY KEY";
  }

  @Override
  protected String sqlType(ColumnType type, Integer length) {
    return switch (type) {
      case TINYINT -> "SMALLINT";
      case TEXT -> "TEXT";
      case DATETIME, TIMESTAMP -> "TIMESTAMPTZ";
      case BINARY -> "BYTEA";
      case JSONB -> "JSONB";
      default -> super.sqlType(type, length);
    };
  }
}
