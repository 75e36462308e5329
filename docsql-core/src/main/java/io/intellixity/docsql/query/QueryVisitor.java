package io.intellixity.docsql.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
  Q visit(RawElement raw);
}
