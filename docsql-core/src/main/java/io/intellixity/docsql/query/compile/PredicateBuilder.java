package io.intellixity.docsql.query.compile;

import io.intellixity.docsql.query.Clause;
import io.intellixity.docsql.query.LogicalGroup;
import io.intellixity.docsql.query.NotElement;
import io.intellixity.docsql.query.QueryElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates predicates chained with AND / OR and folds them into one {@link QueryElement}.
 *
 * <p>The chain follows SQL precedence: {@code a AND b OR c} reads as {@code (a AND b) OR c}. The join of the
 * first entry is ignored, so a chain may start with {@link #orWhere(QueryElement)}.
 *
 * <p>Grouping is done by compiling into a fresh builder and attaching its {@link #build()} result to the
 * parent; builders are never shared between levels.
 */
public final class PredicateBuilder {
  private enum Join { AND, OR }

  private record Entry(Join join, QueryElement element) {}

  private final List<Entry> entries = new ArrayList<>();

  /** Conjoin {@code element}; a {@code null} element is ignored. */
  public PredicateBuilder where(QueryElement element) {
    return add(Join.AND, element);
  }

  public PredicateBuilder orWhere(QueryElement element) {
    return add(Join.OR, element);
  }

  public PredicateBuilder whereNot(QueryElement element) {
    return add(Join.AND, element == null ? null : new NotElement(element));
  }

  public PredicateBuilder orWhereNot(QueryElement element) {
    return add(Join.OR, element == null ? null : new NotElement(element));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Fold the chain; {@code null} when nothing was added. */
  public QueryElement build() {
    if (entries.isEmpty()) return null;

    List<QueryElement> disjuncts = new ArrayList<>();
    List<QueryElement> run = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      Entry e = entries.get(i);
      if (i > 0 && e.join() == Join.OR) {
        disjuncts.add(fold(Clause.AND, run));
        run = new ArrayList<>();
      }
      run.add(e.element());
    }
    disjuncts.add(fold(Clause.AND, run));
    return fold(Clause.OR, disjuncts);
  }

  private PredicateBuilder add(Join join, QueryElement element) {
    if (element != null) entries.add(new Entry(join, element));
    return this;
  }

  private static QueryElement fold(Clause clause, List<QueryElement> elements) {
    return elements.size() == 1 ? elements.get(0) : new LogicalGroup(clause, elements);
  }
}
