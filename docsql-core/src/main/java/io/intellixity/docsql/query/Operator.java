package io.intellixity.docsql.query;

public enum Operator {
  EQ("="),
  NE("<>"),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IN("IN"),
  NIN("NOT IN"),

  LIKE("LIKE"),
  // Case-insensitive LIKE; dialects without ILIKE lower both sides.
  ILIKE("ILIKE");

  private final String sql;

  Operator(String sql) {
    this.sql = sql;
  }

  /** Generic SQL spelling of the operator. */
  public String sql() {
    return sql;
  }
}
