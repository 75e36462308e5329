package io.intellixity.docsql.query.compile;

import io.intellixity.docsql.query.QueryElement;
import io.intellixity.docsql.query.QueryFilters;
import io.intellixity.docsql.query.RawElement;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Compiles a document-style filter spec ({@code {age: {$gt: 30}, $or: [...]}}) into predicate-builder calls.
 *
 * <p>Entries are visited in map iteration order and each is decoded once into a {@link FilterOperator}.
 * Everything produced at one level is AND-ed; {@code $or}, {@code $and} and {@code $nor} compile each of
 * their elements in an owned sub-builder and attach the resulting group.
 *
 * <p>A non-operator scalar key always compares the literal key, even below a scope field:
 * {@code {age: {foo: "bar"}}} yields {@code foo = 'bar'}.
 */
public final class FilterCompiler {
  private FilterCompiler() {}

  /** Compile a root-level spec and return the folded predicate, or {@code null} if it yields nothing. */
  public static QueryElement toElement(Object spec) {
    return compile(new PredicateBuilder(), spec, "").build();
  }

  public static PredicateBuilder compile(PredicateBuilder builder, Object spec) {
    return compile(builder, spec, "");
  }

  /**
   * Compile {@code spec} into {@code builder} against {@code scopeField}. Anything other than a map
   * (lists included) leaves the builder untouched.
   */
  public static PredicateBuilder compile(PredicateBuilder builder, Object spec, String scopeField) {
    if (!(spec instanceof Map<?, ?> map)) return builder;
    String scope = (scopeField == null) ? "" : scopeField;

    for (Map.Entry<?, ?> e : map.entrySet()) {
      String key = String.valueOf(e.getKey());
      Object value = e.getValue();

      switch (FilterOperator.decode(key, value)) {
        case IN -> builder.where(QueryFilters.in(scope, toList(value)));
        case NIN -> builder.where(QueryFilters.nin(scope, toList(value)));
        case GT -> builder.where(QueryFilters.gt(scope, value));
        case GTE -> builder.where(QueryFilters.ge(scope, value));
        case LT -> builder.where(QueryFilters.lt(scope, value));
        case LTE -> builder.where(QueryFilters.le(scope, value));
        case EQ -> builder.where(QueryFilters.eq(scope, value));
        case NE -> builder.where(QueryFilters.ne(scope, value));
        case EXISTS -> builder.where(QueryFilters.notNull(scope));
        case NOT_EXISTS -> builder.where(QueryFilters.isNull(scope));
        case OR -> builder.where(group(toList(value), scope, PredicateBuilder::where, PredicateBuilder::orWhere));
        case AND -> builder.where(group(toList(value), scope, PredicateBuilder::where, PredicateBuilder::where));
        case NOR -> builder.where(group(toList(value), scope, PredicateBuilder::whereNot, PredicateBuilder::whereNot));
        case NOT -> {
          if (value instanceof Map<?, ?>) {
            builder.whereNot(compile(new PredicateBuilder(), value, scope).build());
          } else {
            builder.where(QueryFilters.eq(scope, value).negate());
          }
        }
        case RAW -> builder.where(raw(value));
        case SCOPE -> builder.where(compile(new PredicateBuilder(), value, key).build());
        case ILIKE -> builder.where(QueryFilters.ilike(scope, value));
        case FIELD_EQUALS -> builder.where(QueryFilters.eq(key, value));
      }
    }
    return builder;
  }

  private static QueryElement group(List<Object> specs, String scope,
                                    BiConsumer<PredicateBuilder, QueryElement> first,
                                    BiConsumer<PredicateBuilder, QueryElement> rest) {
    PredicateBuilder group = new PredicateBuilder();
    for (int i = 0; i < specs.size(); i++) {
      QueryElement el = compile(new PredicateBuilder(), specs.get(i), scope).build();
      if (el == null) continue;
      (i == 0 ? first : rest).accept(group, el);
    }
    return group.build();
  }

  private static RawElement raw(Object value) {
    if (value instanceof String s) return new RawElement(s, List.of());
    if (value instanceof Map<?, ?> m) {
      Object condition = m.get("condition");
      if (condition == null) return null;
      Object bindings = m.get("bindings");
      List<Object> binds = FilterOperator.isSequence(bindings) ? toList(bindings)
          : (bindings == null) ? List.of() : List.of(bindings);
      return new RawElement(String.valueOf(condition), binds);
    }
    return null;
  }

  private static List<Object> toList(Object value) {
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    List<Object> out = new ArrayList<>();
    if (value != null && value.getClass().isArray()) {
      for (int i = 0; i < Array.getLength(value); i++) out.add(Array.get(value, i));
    }
    return out;
  }
}
