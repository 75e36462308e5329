package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.error.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Row iterator over an open ResultSet that owns its statement and connection. Everything is released when the
 * rows are exhausted or {@link #close()} is called, whichever happens first.
 */
final class ResultSetIterator implements Iterator<Map<String, Object>>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResultSetIterator.class);

  private final Connection conn;
  private final PreparedStatement ps;
  private final ResultSet rs;
  private Boolean hasNext;
  private boolean closed;
  private long rows;

  ResultSetIterator(Connection conn, PreparedStatement ps, ResultSet rs) {
    this.conn = conn;
    this.ps = ps;
    this.rs = rs;
  }

  @Override
  public boolean hasNext() {
    if (closed) return false;
    if (hasNext == null) {
      try {
        hasNext = rs.next();
      } catch (SQLException e) {
        close();
        throw new DataAccessException("Failed to advance result set", e);
      }
      if (!hasNext) close();
    }
    return hasNext;
  }

  @Override
  public Map<String, Object> next() {
    if (!hasNext()) throw new NoSuchElementException("No more rows");
    try {
      Map<String, Object> row = JdbcRows.toMap(rs);
      hasNext = null;
      rows++;
      return row;
    } catch (SQLException e) {
      close();
      throw new DataAccessException("Failed to read row", e);
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    SQLException failure = null;
    for (AutoCloseable c : new AutoCloseable[] {rs, ps, conn}) {
      try {
        c.close();
      } catch (SQLException e) {
        if (failure == null) failure = e; else failure.addSuppressed(e);
      } catch (Exception e) {
        throw new IllegalStateException(e);
      }
    }
    if (log.isDebugEnabled()) log.debug("docsql.jdbc_stream_closed rows={}", rows);
    if (failure != null) throw new DataAccessException("Failed to release streamed result set", failure);
  }

  Stream<Map<String, Object>> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false).onClose(this::close);
  }
}
