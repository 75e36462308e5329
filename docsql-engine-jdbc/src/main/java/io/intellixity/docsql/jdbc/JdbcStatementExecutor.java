package io.intellixity.docsql.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.docsql.error.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Runs {@link SqlStatement}s on a caller-supplied connection. Connections are never closed here, except by
 * {@link #stream(Connection, SqlStatement)} which takes ownership of the one it is given.
 */
public final class JdbcStatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private final JdbcHandle handle;

  public JdbcStatementExecutor(JdbcHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  public List<Map<String, Object>> query(Connection c, String op, SqlStatement ss) throws SQLException {
    String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) out.add(JdbcRows.toMap(rs));
        debugDone(op, ss, out.size(), System.nanoTime() - start);
        return out;
      }
    }
  }

  /** First column of the first row, or {@code null} when there is no row. */
  public Object queryValue(Connection c, String op, SqlStatement ss) throws SQLException {
    String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        Object v = rs.next() ? JdbcRows.value(rs.getObject(1)) : null;
        debugDone(op, ss, v, System.nanoTime() - start);
        return v;
      }
    }
  }

  public long update(Connection c, String op, SqlStatement ss) throws SQLException {
    String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      long n = ps.executeUpdate();
      debugDone(op, ss, n, System.nanoTime() - start);
      return n;
    }
  }

  /**
   * Execute an INSERT and return the generated key, read from the column labelled {@code idColumn} when the
   * backend reports one, otherwise from the first column. {@code null} when no key came back.
   */
  public Object insertForId(Connection c, SqlStatement ss, String idColumn) throws SQLException {
    String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("INSERT", ss, jdbcSql);
    return switch (ss.execKind()) {
      case QUERY_ONE_VALUE -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) yield null;
            Object v = JdbcRows.keyValue(rs, idColumn);
            debugDone("INSERT", ss, "returning", System.nanoTime() - start);
            yield v;
          }
        }
      }
      case UPDATE_GENERATED_KEYS -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql, Statement.RETURN_GENERATED_KEYS)) {
          bindAll(ps, ss);
          int n = ps.executeUpdate();
          try (ResultSet rs = ps.getGeneratedKeys()) {
            if (rs == null || !rs.next()) yield null;
            Object v = JdbcRows.keyValue(rs, idColumn);
            debugDone("INSERT", ss, n, System.nanoTime() - start);
            yield v;
          }
        }
      }
      case UPDATE -> {
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          int n = ps.executeUpdate();
          debugDone("INSERT", ss, n, System.nanoTime() - start);
          yield null;
        }
      }
      case QUERY -> throw new IllegalArgumentException("Invalid execKind=QUERY for insert; use QUERY_ONE_VALUE/UPDATE/UPDATE_GENERATED_KEYS");
    };
  }

  /** Lazily read rows; the returned stream owns {@code c} and closes it on {@link Stream#close()}. */
  public Stream<Map<String, Object>> stream(Connection c, SqlStatement ss) {
    String jdbcSql = NamedParamSql.toJdbcSql(ss.sql());
    debugSql("STREAM", ss, jdbcSql);
    PreparedStatement ps = null;
    try {
      ps = c.prepareStatement(jdbcSql);
      bindAll(ps, ss);
      ResultSet rs = ps.executeQuery();
      return new ResultSetIterator(c, ps, rs).stream();
    } catch (SQLException e) {
      DataAccessException failure = new DataAccessException("Failed to open stream: " + e.getMessage(), e);
      closeQuietly(ps, failure);
      closeQuietly(c, failure);
      throw failure;
    }
  }

  private static void closeQuietly(AutoCloseable resource, DataAccessException failure) {
    if (resource == null) return;
    try {
      resource.close();
    } catch (Exception e) {
      failure.addSuppressed(e);
    }
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      ps.setObject(i + 1, encode(ss.binds().get(i)));
    }
  }

  /** Lists and maps are sent as JSON text; everything else goes to the driver as is. */
  static Object encode(Object v) {
    if (v instanceof Map<?, ?> || v instanceof Collection<?>) {
      try {
        return JSON.writeValueAsString(v);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Cannot encode value as JSON: " + v.getClass().getName(), e);
      }
    }
    if (v instanceof Character ch) return String.valueOf(ch);
    return v;
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("docsql.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), handle.id(), handle.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("docsql.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("docsql.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
