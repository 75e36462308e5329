package io.intellixity.docsql.query;

import java.util.Objects;

/**
 * One ORDER BY key. When {@code raw} is set, {@code field} is an SQL ordering expression passed through
 * unquoted and {@code direction} is ignored.
 */
public record SortField(String field, Direction direction, boolean raw) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public SortField(String field, Direction direction) {
    this(field, direction, false);
  }

  public enum Direction { ASC, DESC }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }
  public static SortField raw(String expression) { return new SortField(expression, Direction.ASC, true); }

  /**
   * Parse a sort token: {@code &expr} is a raw ordering expression, {@code -field} is descending,
   * anything else is ascending.
   */
  public static SortField parse(String token) {
    Objects.requireNonNull(token, "token");
    if (token.startsWith("&")) return raw(token.substring(1));
    if (token.startsWith("-")) return desc(token.substring(1));
    return asc(token);
  }
}
