package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.SqlStatement.ExecKind;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.query.*;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - SELECT / COUNT: table + QueryElement filter + sort + paging
 * - DML: insert / update / delete / truncate
 * - DDL: create / drop table and index
 *
 * DB-specific dialects override hooks for quoting, paging, insert key retrieval and column types.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  public static final int DEFAULT_STRING_LENGTH = 255;

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();

    public String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }

    /** Values for '?' placeholders that already sit in a raw fragment. */
    void addPositional(List<Object> values) {
      binds.addAll(values);
    }

    public List<Object> binds() { return binds; }
  }

  // ---- SELECT ----

  @Override
  public SqlStatement renderSelect(SelectPlan plan) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder();
    if (plan.counting()) {
      sql.append("SELECT COUNT(*) AS ").append(quoteIdent("count"));
    } else {
      sql.append(selectHead(plan)).append(" *");
    }
    sql.append(" FROM ").append(qualify(plan.table()));
    appendWhere(sql, plan.filter(), ctx);
    if (!plan.counting()) {
      appendOrderBy(sql, plan.sort());
      appendPaging(sql, plan.limit(), plan.offset());
    }
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY);
  }

  /** Leading keyword(s) of a row SELECT, before the projection. */
  protected String selectHead(SelectPlan plan) {
    return "SELECT";
  }

  protected void appendOrderBy(StringBuilder sql, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      if (sf.raw()) {
        parts.add(sf.field());
      } else {
        parts.add(column(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
      }
    }
    sql.append(" ORDER BY ").append(String.join(", ", parts));
  }

  /** Default is the SQL:2008 OFFSET / FETCH form; dialects override. */
  protected void appendPaging(StringBuilder sql, Integer limit, Integer offset) {
    if (offset != null) sql.append(" OFFSET ").append(offset).append(" ROWS");
    if (limit != null) {
      sql.append(offset != null ? " FETCH NEXT " : " FETCH FIRST ").append(limit).append(" ROWS ONLY");
    }
  }

  // ---- DML ----

  @Override
  public SqlStatement renderInsert(TableRef table, Map<String, ?> values, String idColumn) {
    RenderCtx ctx = new RenderCtx();
    String sql;
    if (values == null || values.isEmpty()) {
      sql = "INSERT INTO " + qualify(table) + " " + emptyInsertValues();
    } else {
      List<String> cols = new ArrayList<>();
      List<String> ph = new ArrayList<>();
      for (var e : values.entrySet()) {
        cols.add(column(e.getKey()));
        ph.add(ctx.add(e.getValue()));
      }
      sql = "INSERT INTO " + qualify(table) +
          " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    }
    sql = applyInsertReturning(sql, idColumn);
    return new SqlStatement(sql, ctx.binds(), insertExecKind(idColumn));
  }

  protected String emptyInsertValues() {
    return "DEFAULT VALUES";
  }

  /**
   * Decide execution strategy for insert.
   *
   * <p>Default uses JDBC generated keys when a key column is requested. Dialects with SQL-level returning
   * override to return {@link ExecKind#QUERY_ONE_VALUE}.</p>
   */
  protected ExecKind insertExecKind(String idColumn) {
    return (idColumn == null) ? ExecKind.UPDATE : ExecKind.UPDATE_GENERATED_KEYS;
  }

  protected String applyInsertReturning(String insertSql, String idColumn) {
    return insertSql;
  }

  @Override
  public SqlStatement renderUpdate(TableRef table, Map<String, ?> sets, Map<String, ?> increments, QueryElement where) {
    Map<String, ?> s = (sets == null) ? Map.of() : sets;
    Map<String, ?> inc = (increments == null) ? Map.of() : increments;
    if (s.isEmpty() && inc.isEmpty()) throw new IllegalArgumentException("Update has no SET columns");

    RenderCtx ctx = new RenderCtx();
    List<String> parts = new ArrayList<>();
    for (var e : s.entrySet()) {
      parts.add(column(e.getKey()) + " = " + ctx.add(e.getValue()));
    }
    for (var e : inc.entrySet()) {
      String col = column(e.getKey());
      parts.add(col + " = " + col + " + " + ctx.add(e.getValue()));
    }
    StringBuilder sql = new StringBuilder("UPDATE ").append(qualify(table)).append(" SET ").append(String.join(", ", parts));
    appendWhere(sql, where, ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(TableRef table, QueryElement where) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(qualify(table));
    appendWhere(sql, where, ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderTruncate(TableRef table) {
    return SqlStatement.update("TRUNCATE TABLE " + qualify(table));
  }

  // ---- predicates ----

  protected void appendWhere(StringBuilder sql, QueryElement filter, RenderCtx ctx) {
    String where = renderPredicate(filter, ctx);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);
  }

  protected String renderPredicate(QueryElement el, RenderCtx ctx) {
    if (el == null) return "";
    String sql = renderPredicateSql(el, ctx, false);
    return sql == null ? "" : sql;
  }

  private String renderPredicateSql(QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (clause == null) clause = Clause.AND;
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (el instanceof RawElement r) {
      ctx.addPositional(r.bindings());
      String sql = "(" + r.condition() + ")";
      return negate ? "NOT " + sql : sql;
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String expr = column(c.property());
    boolean not = c.not() ^ negate;
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, !not)
          : binarySql(expr, c.operator().sql(), scalar(c), not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, not)
          : binarySql(expr, c.operator().sql(), scalar(c), not, ctx);
      case GT, GE, LT, LE, LIKE -> binarySql(expr, c.operator().sql(), nonNull(c), not, ctx);
      case ILIKE -> {
        String sql = renderIlike(expr, ctx.add(nonNull(c)));
        yield not ? "NOT (" + sql + ")" : sql;
      }
      case IN, NIN -> listSql(expr, c.operator().sql(), toList(c), not, ctx);
    };
  }

  /** Case-insensitive match; dialects with a native operator override. */
  protected String renderIlike(String expr, String placeholder) {
    return "LOWER(" + expr + ") LIKE LOWER(" + placeholder + ")";
  }

  private static String nullCheckSql(String expr, boolean isNull) {
    return expr + (isNull ? " IS NULL" : " IS NOT NULL");
  }

  private static String binarySql(String expr, String op, Object value, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(value);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, boolean not, RenderCtx ctx) {
    // constant predicates spelled portably; not every backend has TRUE / FALSE literals
    if (vals.isEmpty()) {
      boolean matchesAll = op.startsWith("NOT") ^ not;
      return matchesAll ? "1 = 1" : "1 = 0";
    }
    List<String> ph = new ArrayList<>();
    for (Object x : vals) ph.add(ctx.add(x));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static Object scalar(Condition c) {
    Object v = c.value();
    if (v instanceof Collection<?> || v instanceof Map<?, ?> || (v != null && v.getClass().isArray())) {
      throw new QueryValidationException("Field '" + c.property() + "' cannot be compared with a list or object; "
          + "use $in / $nin for lists");
    }
    return v;
  }

  private static Object nonNull(Condition c) {
    Object v = scalar(c);
    if (v == null) throw new QueryValidationException(c.operator() + " on '" + c.property() + "' requires a non-null value");
    return v;
  }

  private static List<Object> toList(Condition c) {
    Object v = c.value();
    if (v instanceof Collection<?> col) return new ArrayList<>(col);
    if (v == null) return List.of();
    throw new QueryValidationException(c.operator() + " on '" + c.property() + "' requires a list value");
  }

  /** Quoted column for a field name; operator tokens and blanks are rejected. */
  protected String column(String field) {
    if (field == null || field.isBlank()) {
      throw new QueryValidationException("Filter condition has no field name; operators must sit under a field");
    }
    if (field.startsWith("$")) {
      throw new QueryValidationException("Operator '" + field + "' cannot be used as a field name");
    }
    return quoteIdent(field);
  }

  // ---- DDL ----

  @Override
  public String columnDefinition(FieldDefinition field, ColumnType type) {
    return quoteIdent(field.columnName()) + " " + sqlType(type, field.stringLength());
  }

  @Override
  public String typedPrimaryKey(FieldDefinition field, ColumnType type) {
    return columnDefinition(field, type) + " PRIMARY KEY";
  }

  @Override
  public SqlStatement renderCreateTable(TableRef table, List<String> columnDefinitions) {
    if (columnDefinitions.isEmpty()) throw new IllegalArgumentException("Table '" + table + "' has no columns");
    return SqlStatement.update("CREATE TABLE " + qualify(table) + " (" + String.join(", ", columnDefinitions) + ")");
  }

  @Override
  public SqlStatement renderDropTable(TableRef table) {
    return SqlStatement.update("DROP TABLE IF EXISTS " + qualify(table));
  }

  @Override
  public SqlStatement renderCreateIndex(TableRef table, IndexDefinition index) {
    String sql = "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX " + quoteIdent(indexName(table, index))
        + " ON " + qualify(table) + indexMethod(index) + " (" + columnList(index.fields()) + ")";
    return SqlStatement.update(sql);
  }

  @Override
  public SqlStatement renderDropIndex(TableRef table, IndexDefinition index) {
    String name = quoteIdent(indexName(table, index));
    String qualified = (table.schema() == null) ? name : quoteIdent(table.schema()) + "." + name;
    return SqlStatement.update("DROP INDEX " + qualified);
  }

  /** Access-method clause placed between the table and the column list. Default ignores the hint. */
  protected String indexMethod(IndexDefinition index) {
    return "";
  }

  protected String columnList(List<String> fields) {
    List<String> cols = new ArrayList<>(fields.size());
    for (String f : fields) cols.add(quoteIdent(f));
    return String.join(", ", cols);
  }

  public static String indexName(TableRef table, IndexDefinition index) {
    if (index.name() != null && !index.name().isBlank()) return index.name();
    String raw = table.name() + "_" + String.join("_", index.fields()) + (index.unique() ? "_unique" : "_index");
    return raw.toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
  }

  /** Column type for {@code type}; {@code length} only matters for strings. */
  protected String sqlType(ColumnType type, Integer length) {
    return switch (type) {
      case INCREMENTS, INTEGER -> "INTEGER";
      case BIG_INCREMENTS, BIG_INTEGER -> "BIGINT";
      case TINYINT -> "TINYINT";
      case SMALLINT -> "SMALLINT";
      case STRING -> "VARCHAR(" + (length == null ? DEFAULT_STRING_LENGTH : length) + ")";
      case TEXT -> "CLOB";
      case FLOAT -> "REAL";
      case DOUBLE -> "DOUBLE PRECISION";
      case DECIMAL -> "DECIMAL(8, 2)";
      case BOOLEAN -> "BOOLEAN";
      case DATE -> "DATE";
      case DATETIME, TIMESTAMP -> "TIMESTAMP";
      case TIME -> "TIME";
      case BINARY -> "BLOB";
      case JSON, JSONB -> "JSON";
      case UUID -> "UUID";
    };
  }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
