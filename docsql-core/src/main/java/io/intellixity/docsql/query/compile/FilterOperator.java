package io.intellixity.docsql.query.compile;

import java.util.Collection;
import java.util.Map;

/**
 * Interpretation of one filter-spec entry.
 *
 * <p>Declaration order is dispatch priority: {@link #decode(String, Object)} returns the first constant whose
 * guard accepts the entry. Some entries satisfy several guards (an {@code $or} holding a map also looks like a
 * field scope), so the order must not change.
 */
public enum FilterOperator {
  IN {
    @Override boolean matches(String key, Object value) { return "$in".equals(key) && isSequence(value); }
  },
  NIN {
    @Override boolean matches(String key, Object value) { return "$nin".equals(key) && isSequence(value); }
  },
  GT {
    @Override boolean matches(String key, Object value) { return "$gt".equals(key); }
  },
  GTE {
    @Override boolean matches(String key, Object value) { return "$gte".equals(key); }
  },
  LT {
    @Override boolean matches(String key, Object value) { return "$lt".equals(key); }
  },
  LTE {
    @Override boolean matches(String key, Object value) { return "$lte".equals(key); }
  },
  EQ {
    @Override boolean matches(String key, Object value) { return "$eq".equals(key); }
  },
  NE {
    @Override boolean matches(String key, Object value) { return "$ne".equals(key); }
  },
  EXISTS {
    @Override boolean matches(String key, Object value) { return "$exists".equals(key) && Boolean.TRUE.equals(value); }
  },
  NOT_EXISTS {
    @Override boolean matches(String key, Object value) { return "$exists".equals(key) && Boolean.FALSE.equals(value); }
  },
  OR {
    @Override boolean matches(String key, Object value) { return "$or".equals(key) && isSequence(value); }
  },
  AND {
    @Override boolean matches(String key, Object value) { return "$and".equals(key) && isSequence(value); }
  },
  NOR {
    @Override boolean matches(String key, Object value) { return "$nor".equals(key) && isSequence(value); }
  },
  NOT {
    @Override boolean matches(String key, Object value) { return "$not".equals(key); }
  },
  RAW {
    @Override boolean matches(String key, Object value) { return "$raw".equals(key); }
  },
  /** A nested map under a plain key: the key becomes the scope field of the nested spec. */
  SCOPE {
    @Override boolean matches(String key, Object value) { return value instanceof Map<?, ?>; }
  },
  ILIKE {
    @Override boolean matches(String key, Object value) { return "$ilike".equals(key) && !isSequence(value); }
  },
  /** Fallback: equality on the literal key, not the scope field. */
  FIELD_EQUALS {
    @Override boolean matches(String key, Object value) { return true; }
  };

  private static final FilterOperator[] PRIORITY = values();

  abstract boolean matches(String key, Object value);

  public static FilterOperator decode(String key, Object value) {
    for (FilterOperator op : PRIORITY) {
      if (op.matches(key, value)) return op;
    }
    throw new IllegalStateException("unreachable: FIELD_EQUALS accepts every entry");
  }

  static boolean isSequence(Object value) {
    return value instanceof Collection<?> || (value != null && value.getClass().isArray());
  }
}
