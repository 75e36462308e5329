package io.intellixity.docsql.query;

/** Node of a compiled predicate tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
