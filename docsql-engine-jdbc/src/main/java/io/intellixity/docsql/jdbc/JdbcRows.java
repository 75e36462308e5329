package io.intellixity.docsql.jdbc;

import java.sql.*;
import java.util.*;

/** Reads JDBC rows into column-label keyed maps. */
public final class JdbcRows {
  private JdbcRows() {}

  public static Map<String, Object> toMap(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      row.put(md.getColumnLabel(i), value(rs.getObject(i)));
    }
    return row;
  }

  /** LOBs and arrays are materialized so rows stay valid after the ResultSet closes. */
  static Object value(Object v) throws SQLException {
    if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
    if (v instanceof Blob b) return b.getBytes(1, (int) b.length());
    if (v instanceof java.sql.Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    return v;
  }

  /** Value of {@code label} (case-insensitive), else of the first column. */
  static Object keyValue(ResultSet rs, String label) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    if (label != null) {
      for (int i = 1; i <= md.getColumnCount(); i++) {
        if (label.equalsIgnoreCase(md.getColumnLabel(i))) return value(rs.getObject(i));
      }
    }
    return value(rs.getObject(1));
  }
}
