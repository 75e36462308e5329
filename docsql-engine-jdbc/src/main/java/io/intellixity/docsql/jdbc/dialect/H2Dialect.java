package io.intellixity.docsql.jdbc.dialect;

/** H2 dialect; the generic base already renders H2-compatible SQL. */
public final class H2Dialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "h2"; }

  @Override
  public String autoIncrementPrimaryKey(String column) {
    return quoteIdent(column) + " INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
  }
}
