package io.intellixity.docsql.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Caller-supplied SQL condition, emitted verbatim.
 *
 * <p>Values belong in {@link #bindings()} and are referenced from the condition with positional {@code ?}
 * placeholders, in order.
 */
public final class RawElement implements QueryElement {
  private final String condition;
  private final List<Object> bindings;

  public RawElement(String condition, List<?> bindings) {
    this.condition = Objects.requireNonNull(condition, "condition");
    // bindings may legitimately contain nulls, so no List.copyOf here
    this.bindings = (bindings == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
  }

  public String condition() { return condition; }
  public List<Object> bindings() { return bindings; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RawElement r)) return false;
    return condition.equals(r.condition) && bindings.equals(r.bindings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(condition, bindings);
  }

  @Override
  public String toString() {
    return "RAW(" + condition + ", " + bindings + ")";
  }
}
