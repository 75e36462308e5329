package io.intellixity.docsql.jdbc;

/**
 * Rewrites SQL carrying named markers ({@code :b1}, {@code :b2}, ...) into JDBC SQL with {@code ?} placeholders.
 *
 * Rules:
 * - A marker is ':' followed by [A-Za-z_][A-Za-z0-9_]*.
 * - '::' is a Postgres cast, not a marker.
 * - Nothing inside '...' literals, "..." / `...` / [...] identifiers is touched.
 * - Existing '?' placeholders pass through, so raw fragments and markers can be mixed as long as
 *   bind values are listed in textual order.
 */
public final class NamedParamSql {
  private NamedParamSql() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled closing char is an escape: '' "" `` ]]
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        out.append(ch);
        continue;
      }
      if (ch == '[') {
        quote = ']';
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
