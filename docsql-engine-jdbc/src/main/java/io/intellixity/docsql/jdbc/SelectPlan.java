package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.query.QueryElement;
import io.intellixity.docsql.query.SortField;

import java.util.List;

/**
 * Dialect-neutral SELECT: filter, order and paging over one table. {@code limit} / {@code offset} are
 * {@code null} when not applied. A counting plan never carries sort or paging.
 */
public record SelectPlan(TableRef table, QueryElement filter, List<SortField> sort,
                         Integer limit, Integer offset, boolean counting) {
  public SelectPlan {
    sort = (sort == null) ? List.of() : List.copyOf(sort);
    if (counting && (!sort.isEmpty() || limit != null || offset != null)) {
      throw new IllegalArgumentException("count plan cannot carry sort or paging");
    }
  }

  public static SelectPlan count(TableRef table, QueryElement filter) {
    return new SelectPlan(table, filter, List.of(), null, null, true);
  }
}
