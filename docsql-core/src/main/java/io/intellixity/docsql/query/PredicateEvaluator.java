package io.intellixity.docsql.query;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Evaluates a predicate tree against an in-memory row with SQL three-valued logic: a visit returns
 * {@code TRUE}, {@code FALSE} or {@code null} for UNKNOWN (comparisons involving a NULL column).
 * A row matches only when the result is {@code TRUE}, as in a WHERE clause.
 *
 * <p>Raw SQL fragments cannot be evaluated and are rejected.
 */
public final class PredicateEvaluator implements QueryVisitor<Boolean> {
  private final Map<String, ?> row;

  private PredicateEvaluator(Map<String, ?> row) {
    this.row = Objects.requireNonNull(row, "row");
  }

  /** True when {@code element} holds for {@code row}; a {@code null} element matches everything. */
  public static boolean matches(QueryElement element, Map<String, ?> row) {
    if (element == null) return true;
    return Boolean.TRUE.equals(element.accept(new PredicateEvaluator(row)));
  }

  @Override
  public Boolean visit(Condition c) {
    Boolean r = test(c, row.get(c.property()));
    return c.not() ? not(r) : r;
  }

  @Override
  public Boolean visit(LogicalGroup group) {
    boolean unknown = false;
    boolean isAnd = group.clause() == Clause.AND;
    for (QueryElement e : group.elements()) {
      Boolean r = e.accept(this);
      if (r == null) unknown = true;
      else if (r != isAnd) return r;
    }
    return unknown ? null : isAnd;
  }

  @Override
  public Boolean visit(NotElement not) {
    return not(not.element().accept(this));
  }

  @Override
  public Boolean visit(RawElement raw) {
    throw new UnsupportedOperationException("Raw SQL cannot be evaluated in memory: " + raw.condition());
  }

  private static Boolean not(Boolean r) {
    return r == null ? null : !r;
  }

  private static Boolean test(Condition c, Object actual) {
    Object expected = c.value();
    switch (c.operator()) {
      case EQ:
        if (expected == null) return actual == null;
        return actual == null ? null : compare(actual, expected) == 0;
      case NE:
        if (expected == null) return actual != null;
        return actual == null ? null : compare(actual, expected) != 0;
      case GT: return actual == null ? null : compare(actual, expected) > 0;
      case GE: return actual == null ? null : compare(actual, expected) >= 0;
      case LT: return actual == null ? null : compare(actual, expected) < 0;
      case LE: return actual == null ? null : compare(actual, expected) <= 0;
      case IN:
      case NIN: {
        Collection<?> values = (expected instanceof Collection<?> col) ? col : List.of();
        boolean in = c.operator() == Operator.IN;
        if (values.isEmpty()) return !in;
        if (actual == null) return null;
        boolean sawNull = false;
        for (Object v : values) {
          if (v == null) sawNull = true;
          else if (compare(actual, v) == 0) return in;
        }
        // x IN (1, NULL) is UNKNOWN, not FALSE, when x is not 1
        return sawNull ? null : !in;
      }
      case LIKE: return actual == null ? null : like(String.valueOf(expected), false).matcher(String.valueOf(actual)).matches();
      case ILIKE: return actual == null ? null : like(String.valueOf(expected), true).matcher(String.valueOf(actual)).matches();
      default: throw new IllegalArgumentException("Unsupported operator: " + c.operator());
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
    }
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  /** SQL LIKE pattern ({@code %}, {@code _}) as a regex. */
  static Pattern like(String pattern, boolean ignoreCase) {
    StringBuilder re = new StringBuilder();
    for (char ch : pattern.toCharArray()) {
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append('.');
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    return ignoreCase
        ? Pattern.compile(re.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL)
        : Pattern.compile(re.toString(), Pattern.DOTALL);
  }
}
