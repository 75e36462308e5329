package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.jdbc.dialect.JdbcDialect;
import io.intellixity.docsql.query.*;
import io.intellixity.docsql.query.compile.FilterCompiler;
import io.intellixity.docsql.query.compile.PredicateBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns {@link QueryParams} into a {@link SelectPlan}: compiled filter, free-text search, sort and paging.
 *
 * <p>Search is one {@code LIKE '%text%'} per search field; the alternatives are OR-ed together and the group is
 * AND-ed with the filter. Counting plans keep filter and search only.
 */
public final class QueryAssembler {
  private final JdbcDialect dialect;
  private final TableRef table;
  private final String idColumn;

  public QueryAssembler(JdbcDialect dialect, TableRef table, String idColumn) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = Objects.requireNonNull(table, "table");
    this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
  }

  public SelectPlan plan(QueryParams params, boolean counting) {
    QueryParams p = (params == null) ? new QueryParams() : params;
    QueryElement filter = filter(p);
    if (counting) return SelectPlan.count(table, filter);

    List<SortField> sort = new ArrayList<>(p.sortFields());
    Integer limit = positive(p.limit());
    Integer offset = positive(p.offset());
    if (offset != null && sort.isEmpty() && dialect.requiresOrderByForOffset()) {
      sort.add(SortField.asc(idColumn));
    }
    return new SelectPlan(table, filter, sort, limit, offset, false);
  }

  public SqlStatement select(QueryParams params) {
    return dialect.renderSelect(plan(params, false));
  }

  public SqlStatement count(QueryParams params) {
    return dialect.renderSelect(plan(params, true));
  }

  /** Filter plus search, or {@code null} when neither restricts anything. */
  public QueryElement filter(QueryParams p) {
    PredicateBuilder where = FilterCompiler.compile(new PredicateBuilder(), p.query());
    if (p.hasSearch()) {
      PredicateBuilder search = new PredicateBuilder();
      for (String field : p.searchFields()) {
        search.orWhere(QueryFilters.like(field, "%" + p.search() + "%"));
      }
      where.where(search.build());
    }
    return where.build();
  }

  private static Integer positive(Integer v) {
    return (v != null && v > 0) ? v : null;
  }
}
