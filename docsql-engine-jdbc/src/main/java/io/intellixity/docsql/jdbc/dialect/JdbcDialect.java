package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.query.QueryElement;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;

import java.util.List;
import java.util.Map;

/**
 * SQL rendering and backend quirks for one database family.
 *
 * <p>Rendered statements carry {@code :bN} markers; see {@link io.intellixity.docsql.jdbc.NamedParamSql}.
 */
public interface JdbcDialect {
  String id();

  String quoteIdent(String ident);

  /** Schema-qualified, quoted table name. */
  default String qualify(TableRef table) {
    return (table.schema() == null)
        ? quoteIdent(table.name())
        : quoteIdent(table.schema()) + "." + quoteIdent(table.name());
  }

  // ---- DML ----

  SqlStatement renderSelect(SelectPlan plan);

  /** INSERT of one row; when {@code idColumn} is set the statement also yields the generated key. */
  SqlStatement renderInsert(TableRef table, Map<String, ?> values, String idColumn);

  /** UPDATE assigning {@code sets} and adding {@code increments} to current values; a {@code null} filter hits all rows. */
  SqlStatement renderUpdate(TableRef table, Map<String, ?> sets, Map<String, ?> increments, QueryElement where);

  SqlStatement renderDelete(TableRef table, QueryElement where);

  /** Remove every row of the table. */
  SqlStatement renderTruncate(TableRef table);

  // ---- DDL ----

  /** Column definition for a non-key field. */
  String columnDefinition(FieldDefinition field, ColumnType type);

  /** Primary key column keeping the declared type (caller-assigned ids). */
  String typedPrimaryKey(FieldDefinition field, ColumnType type);

  /** Auto-increment integer primary key column. */
  String autoIncrementPrimaryKey(String column);

  SqlStatement renderCreateTable(TableRef table, List<String> columnDefinitions);

  SqlStatement renderDropTable(TableRef table);

  SqlStatement renderCreateIndex(TableRef table, IndexDefinition index);

  SqlStatement renderDropIndex(TableRef table, IndexDefinition index);

  // ---- quirks ----

  /** True when OFFSET is only valid after an ORDER BY. */
  default boolean requiresOrderByForOffset() {
    return false;
  }

  /** Normalize a COUNT(*) value; some drivers return it as text or as a decimal. */
  default long coerceCount(Object raw) {
    if (raw == null) return 0L;
    if (raw instanceof Number n) return n.longValue();
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return 0L;
    try {
      return Long.parseLong(s);
    } catch (NumberFormatException e) {
      return new java.math.BigDecimal(s).longValue();
    }
  }
}
