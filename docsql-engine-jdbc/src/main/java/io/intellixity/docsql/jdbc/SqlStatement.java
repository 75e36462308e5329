package io.intellixity.docsql.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SQL plus its positional bind values. {@code sql} may still contain {@code :bN} markers; they are
 * rewritten to {@code ?} by {@link NamedParamSql#toJdbcSql(String)} right before execution.
 */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (used for SELECT/COUNT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (no generated keys). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys(). */
    UPDATE_GENERATED_KEYS,
    /** Execute via PreparedStatement.executeQuery() and read the first row (INSERT ... RETURNING). */
    QUERY_ONE_VALUE
  }

  public SqlStatement {
    // bind values may be null, so no List.copyOf
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  /** Bind-free statement run with executeUpdate(), e.g. DDL. */
  public static SqlStatement update(String sql) {
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }
}
