package io.intellixity.docsql.query;

import java.util.Objects;

/**
 * Single column predicate.
 *
 * <p>A {@code null} value on {@link Operator#EQ} / {@link Operator#NE} means IS NULL / IS NOT NULL.
 */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(property, operator, value, !not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return not == c.not && property.equals(c.property) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(property, operator, value, not);
  }

  @Override
  public String toString() {
    return (not ? "NOT " : "") + property + " " + operator + " " + value;
  }
}
