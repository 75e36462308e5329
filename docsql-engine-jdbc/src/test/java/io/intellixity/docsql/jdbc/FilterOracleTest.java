package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.query.PredicateEvaluator;
import io.intellixity.docsql.query.QueryParams;
import io.intellixity.docsql.query.compile.FilterCompiler;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.EntityDefinition;
import io.intellixity.docsql.schema.FieldDefinition;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random {@code $and / $or / $not / $nor} trees over integer comparisons, checked three ways: the rows H2 returns,
 * the compiled predicate evaluated in memory, and a direct evaluation of the filter document.
 */
final class FilterOracleTest {
  private static final String[] FIELDS = {"a", "b", "c"};
  private static final String[] COMPARISONS = {"$gt", "$gte", "$lt", "$lte", "$eq", "$ne", "$in", "$nin"};
  private static final String[] GROUPS = {"$and", "$or", "$nor"};

  private static JdbcTableAdapter adapter;
  private static List<Map<String, Object>> rows;

  @BeforeAll
  static void load() {
    EntityDefinition entity = EntityDefinition.builder("oracle_rows")
        .field(FieldDefinition.builder("id").columnType(ColumnType.INCREMENTS).primaryKey(true).build())
        .field(FieldDefinition.of("a", "integer"))
        .field(FieldDefinition.of("b", "integer"))
        .field(FieldDefinition.of("c", "integer"))
        .build();
    adapter = new JdbcTableAdapter(entity,
        AdapterConfig.builder().jdbcUrl("jdbc:h2:mem:oracle_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1").build());
    adapter.connect();
    adapter.createTable();

    Random rnd = new Random(7);
    List<Map<String, Object>> batch = new ArrayList<>();
    for (int i = 0; i < 60; i++) {
      Map<String, Object> r = new LinkedHashMap<>();
      for (String f : FIELDS) r.put(f, rnd.nextInt(6));
      batch.add(r);
    }
    adapter.insertMany(batch);
    rows = adapter.find(new QueryParams());
    assertEquals(60, rows.size());
  }

  @AfterAll
  static void close() {
    adapter.disconnect();
  }

  @Test
  void compiledFiltersAgreeWithTheFilterDocument() {
    Random rnd = new Random(20240601L);
    for (int i = 0; i < 300; i++) {
      Map<String, Object> spec = spec(rnd, 3);

      Set<Object> expected = new TreeSet<>();
      Set<Object> inMemory = new TreeSet<>();
      for (Map<String, Object> row : rows) {
        if (Boolean.TRUE.equals(eval(spec, row, null))) expected.add(row.get("id"));
        if (PredicateEvaluator.matches(FilterCompiler.toElement(spec), row)) inMemory.add(row.get("id"));
      }
      Set<Object> actual = new TreeSet<>();
      for (Map<String, Object> row : adapter.find(QueryParams.of(spec))) actual.add(row.get("id"));

      assertEquals(expected, actual, () -> "store disagrees for " + spec);
      assertEquals(expected, inMemory, () -> "evaluator disagrees for " + spec);
      assertEquals(expected.size(), adapter.count(QueryParams.of(spec)), () -> "count disagrees for " + spec);
    }
  }

  @Test
  void nullInAMembershipListNeverMatchesAMiss() {
    List<Object> withNull = Arrays.asList(99, null);
    List<Map<String, Object>> filters = List.of(
        Map.of("a", Map.of("$nin", withNull)),
        Map.of("$not", Map.of("a", Map.of("$in", withNull))),
        Map.of("a", Map.of("$in", withNull)));
    for (Map<String, Object> filter : filters) {
      assertTrue(adapter.find(QueryParams.of(filter)).isEmpty(), () -> "store matched " + filter);
      for (Map<String, Object> row : rows) {
        assertFalse(PredicateEvaluator.matches(FilterCompiler.toElement(filter), row), () -> "evaluator matched " + filter);
      }
    }
  }

  private static Map<String, Object> spec(Random rnd, int depth) {
    Map<String, Object> m = new LinkedHashMap<>();
    int entries = 1 + rnd.nextInt(2);
    for (int i = 0; i < entries; i++) {
      int pick = rnd.nextInt(depth > 0 ? 6 : 3);
      if (pick < 2) {
        Map<String, Object> cmp = new LinkedHashMap<>();
        cmp.put(COMPARISONS[rnd.nextInt(COMPARISONS.length)], operand(rnd));
        if (rnd.nextBoolean()) cmp.put(COMPARISONS[rnd.nextInt(COMPARISONS.length)], operand(rnd));
        m.put(FIELDS[rnd.nextInt(FIELDS.length)], fixOperands(cmp, rnd));
      } else if (pick == 2) {
        m.put(FIELDS[rnd.nextInt(FIELDS.length)], rnd.nextInt(6));
      } else if (pick == 3) {
        m.put("$not", spec(rnd, depth - 1));
      } else {
        List<Object> group = new ArrayList<>();
        int n = 1 + rnd.nextInt(3);
        for (int k = 0; k < n; k++) group.add(spec(rnd, depth - 1));
        m.put(GROUPS[rnd.nextInt(GROUPS.length)], group);
      }
    }
    return m;
  }

  private static Object operand(Random rnd) {
    return rnd.nextInt(6);
  }

  /** Membership operators take a non-empty list, sometimes holding a NULL. */
  private static Map<String, Object> fixOperands(Map<String, Object> cmp, Random rnd) {
    for (Map.Entry<String, Object> e : cmp.entrySet()) {
      if (e.getKey().equals("$in") || e.getKey().equals("$nin")) {
        List<Object> values = new ArrayList<>();
        int n = 1 + rnd.nextInt(3);
        for (int i = 0; i < n; i++) values.add(rnd.nextInt(6));
        if (rnd.nextInt(4) == 0) values.add(null);
        e.setValue(values);
      }
    }
    return cmp;
  }

  /** Direct reading of the filter document; {@code null} is UNKNOWN, as in SQL. */
  @SuppressWarnings("unchecked")
  private static Boolean eval(Map<String, Object> spec, Map<String, Object> row, String scope) {
    Boolean all = true;
    for (Map.Entry<String, Object> e : spec.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      Boolean r;
      switch (key) {
        case "$and": r = and(evalAll((List<Object>) value, row, scope)); break;
        case "$or": r = or(evalAll((List<Object>) value, row, scope)); break;
        case "$nor": r = not(or(evalAll((List<Object>) value, row, scope))); break;
        case "$not": r = not(eval((Map<String, Object>) value, row, scope)); break;
        case "$in": r = in((List<Object>) value, row.get(scope)); break;
        case "$nin": r = not(in((List<Object>) value, row.get(scope))); break;
        case "$gt": r = cmp(row, scope, value) > 0; break;
        case "$gte": r = cmp(row, scope, value) >= 0; break;
        case "$lt": r = cmp(row, scope, value) < 0; break;
        case "$lte": r = cmp(row, scope, value) <= 0; break;
        case "$eq": r = cmp(row, scope, value) == 0; break;
        case "$ne": r = cmp(row, scope, value) != 0; break;
        default:
          r = (value instanceof Map<?, ?>)
              ? eval((Map<String, Object>) value, row, key)
              : Boolean.valueOf(Objects.equals(row.get(key), value));
      }
      all = and(Arrays.asList(all, r));
    }
    return all;
  }

  @SuppressWarnings("unchecked")
  private static List<Boolean> evalAll(List<Object> specs, Map<String, Object> row, String scope) {
    List<Boolean> out = new ArrayList<>();
    for (Object s : specs) out.add(eval((Map<String, Object>) s, row, scope));
    return out;
  }

  private static Boolean in(List<Object> values, Object actual) {
    if (values.contains(actual)) return Boolean.TRUE;
    return values.contains(null) ? null : Boolean.FALSE;
  }

  private static Boolean and(List<Boolean> results) {
    boolean unknown = false;
    for (Boolean r : results) {
      if (r == null) unknown = true;
      else if (!r) return false;
    }
    return unknown ? null : Boolean.TRUE;
  }

  private static Boolean or(List<Boolean> results) {
    boolean unknown = false;
    for (Boolean r : results) {
      if (r == null) unknown = true;
      else if (r) return true;
    }
    return unknown ? null : Boolean.FALSE;
  }

  private static Boolean not(Boolean r) {
    return r == null ? null : !r;
  }

  private static int cmp(Map<String, Object> row, String field, Object value) {
    return Integer.compare((Integer) row.get(field), (Integer) value);
  }
}
