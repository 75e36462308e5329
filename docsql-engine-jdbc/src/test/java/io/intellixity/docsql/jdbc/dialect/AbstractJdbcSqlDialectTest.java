package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.SqlStatement;
import io.intellixity.docsql.jdbc.SqlStatement.ExecKind;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.query.QueryElement;
import io.intellixity.docsql.query.QueryValidationException;
import io.intellixity.docsql.query.SortField;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.docsql.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

/** Generic rendering, exercised through {@link H2Dialect} which adds no rendering overrides. */
final class AbstractJdbcSqlDialectTest {
  private static final TableRef USERS = TableRef.of("users");
  private final JdbcDialect d = new H2Dialect();

  private SqlStatement where(QueryElement filter) {
    return d.renderSelect(new SelectPlan(USERS, filter, List.of(), null, null, false));
  }

  @Test
  void rendersSelectWithFilterSortAndPaging() {
    SqlStatement ss = d.renderSelect(new SelectPlan(USERS,
        and(gt("age", 30), lt("age", 50)),
        List.of(SortField.desc("age"), SortField.raw("LENGTH(\"name\")")), 10, 20, false));
    assertEquals("SELECT * FROM \"users\" WHERE (\"age\" > :b1 AND \"age\" < :b2)"
        + " ORDER BY \"age\" DESC, LENGTH(\"name\") OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY", ss.sql());
    assertEquals(List.of(30, 50), ss.binds());
    assertEquals(ExecKind.QUERY, ss.execKind());
  }

  @Test
  void limitWithoutOffsetFetchesFirst() {
    SqlStatement ss = d.renderSelect(new SelectPlan(USERS, null, List.of(), 5, null, false));
    assertEquals("SELECT * FROM \"users\" FETCH FIRST 5 ROWS ONLY", ss.sql());
  }

  @Test
  void countIgnoresSortAndPaging() {
    SqlStatement ss = d.renderSelect(SelectPlan.count(new TableRef("app", "users"), eq("status", "active")));
    assertEquals("SELECT COUNT(*) AS \"count\" FROM \"app\".\"users\" WHERE \"status\" = :b1", ss.sql());
    assertThrows(IllegalArgumentException.class,
        () -> new SelectPlan(USERS, null, List.of(), 1, null, true));
  }

  @Test
  void orGroupsNestInsideAnd() {
    SqlStatement ss = where(and(eq("a", 1), or(eq("b", 2), eq("c", 3))));
    assertTrue(ss.sql().endsWith("WHERE (\"a\" = :b1 AND (\"b\" = :b2 OR \"c\" = :b3))"), ss.sql());
  }

  @Test
  void comparisonsUseTheOperatorSpelling() {
    assertTrue(where(ne("a", 1)).sql().endsWith("WHERE \"a\" <> :b1"));
    assertTrue(where(ge("a", 1)).sql().endsWith("WHERE \"a\" >= :b1"));
    assertTrue(where(le("a", 1)).sql().endsWith("WHERE \"a\" <= :b1"));
    assertTrue(where(like("a", "x%")).sql().endsWith("WHERE \"a\" LIKE :b1"));
    assertTrue(where(in("a", List.of(1))).sql().endsWith("WHERE \"a\" IN (:b1)"));
  }

  @Test
  void nullEqualityIsANullCheck() {
    assertTrue(where(isNull("email")).sql().endsWith("\"email\" IS NULL"));
    assertTrue(where(notNull("email")).sql().endsWith("\"email\" IS NOT NULL"));
    assertTrue(where(isNull("email").negate()).sql().endsWith("\"email\" IS NOT NULL"));
    assertTrue(where(not(notNull("email"))).sql().endsWith("\"email\" IS NULL"));
  }

  @Test
  void negatedGroupsArePushedDown() {
    SqlStatement ss = where(not(or(eq("a", 1), gt("b", 2))));
    assertTrue(ss.sql().endsWith("WHERE (NOT (\"a\" = :b1) AND NOT (\"b\" > :b2))"), ss.sql());
  }

  @Test
  void emptyMembershipListsAreConstants() {
    assertTrue(where(in("a", List.of())).sql().endsWith("WHERE 1 = 0"));
    assertTrue(where(nin("a", List.of())).sql().endsWith("WHERE 1 = 1"));
    assertTrue(where(not(in("a", List.of()))).sql().endsWith("WHERE 1 = 1"));
  }

  @Test
  void membershipBindsEachValue() {
    SqlStatement ss = where(nin("status", List.of("a", "b")));
    assertTrue(ss.sql().endsWith("\"status\" NOT IN (:b1, :b2)"));
    assertEquals(List.of("a", "b"), ss.binds());
  }

  @Test
  void ilikeFallsBackToLower() {
    assertTrue(where(ilike("name", "%bo%")).sql().endsWith("LOWER(\"name\") LIKE LOWER(:b1)"));
  }

  @Test
  void rawFragmentsKeepTheirPlaceholdersAndBindings() {
    SqlStatement ss = where(and(eq("a", 1), raw("price > ? AND qty < ?", 10, 5), eq("b", 2)));
    assertTrue(ss.sql().endsWith("(\"a\" = :b1 AND (price > ? AND qty < ?) AND \"b\" = :b2)"), ss.sql());
    assertEquals(List.of(1, 10, 5, 2), ss.binds());
    assertTrue(where(not(raw("x = 1"))).sql().endsWith("WHERE NOT (x = 1)"));
  }

  @Test
  void rejectsOperatorsAsFieldsAndListsOnScalarOperators() {
    assertThrows(QueryValidationException.class, () -> where(eq("$in", 5)));
    assertThrows(QueryValidationException.class, () -> where(eq("", 5)));
    assertThrows(QueryValidationException.class, () -> where(eq("tags", List.of("a"))));
    assertThrows(QueryValidationException.class, () -> where(gt("age", null)));
  }

  @Test
  void rendersDml() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("name", "Ann");
    values.put("age", null);
    SqlStatement ins = d.renderInsert(USERS, values, "id");
    assertEquals("INSERT INTO \"users\" (\"name\", \"age\") VALUES (:b1, :b2)", ins.sql());
    assertEquals(Arrays.asList("Ann", null), ins.binds());
    assertEquals(ExecKind.UPDATE_GENERATED_KEYS, ins.execKind());
    assertEquals("INSERT INTO \"users\" DEFAULT VALUES", d.renderInsert(USERS, Map.of(), "id").sql());

    SqlStatement upd = d.renderUpdate(USERS, Map.of("name", "Bo"), Map.of("visits", 1), eq("id", 7));
    assertEquals("UPDATE \"users\" SET \"name\" = :b1, \"visits\" = \"visits\" + :b2 WHERE \"id\" = :b3", upd.sql());
    assertEquals(List.of("Bo", 1, 7), upd.binds());
    assertThrows(IllegalArgumentException.class, () -> d.renderUpdate(USERS, Map.of(), Map.of(), null));

    assertEquals("DELETE FROM \"users\"", d.renderDelete(USERS, null).sql());
    assertEquals("TRUNCATE TABLE \"users\"", d.renderTruncate(USERS).sql());
  }

  @Test
  void rendersDdl() {
    FieldDefinition name = FieldDefinition.builder("name").columnType(ColumnType.STRING).max(80).build();
    assertEquals("\"name\" VARCHAR(80)", d.columnDefinition(name, ColumnType.STRING));
    FieldDefinition code = FieldDefinition.of("code", "string");
    assertEquals("\"code\" VARCHAR(255) PRIMARY KEY", d.typedPrimaryKey(code, ColumnType.STRING));
    assertEquals("\"id\" INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY", d.autoIncrementPrimaryKey("id"));

    assertEquals("CREATE TABLE \"users\" (\"id\" INTEGER, \"name\" VARCHAR(80))",
        d.renderCreateTable(USERS, List.of("\"id\" INTEGER", "\"name\" VARCHAR(80)")).sql());
    assertEquals("DROP TABLE IF EXISTS \"users\"", d.renderDropTable(USERS).sql());
  }

  @Test
  void indexNamesDefaultFromTableAndColumns() {
    IndexDefinition byEmail = IndexDefinition.unique("email");
    assertEquals("CREATE UNIQUE INDEX \"users_email_unique\" ON \"users\" (\"email\")",
        d.renderCreateIndex(USERS, byEmail).sql());
    assertEquals("DROP INDEX \"users_email_unique\"", d.renderDropIndex(USERS, byEmail).sql());
    assertEquals("my_table_a_b_index",
        AbstractJdbcSqlDialect.indexName(TableRef.of("My-Table"), IndexDefinition.on("a", "b")));
    assertEquals("by_name", AbstractJdbcSqlDialect.indexName(USERS, IndexDefinition.on("name").named("by_name")));
    // the access-method hint is not part of generic SQL
    assertEquals("CREATE INDEX \"users_name_index\" ON \"users\" (\"name\")",
        d.renderCreateIndex(USERS, IndexDefinition.on("name").withType("hash")).sql());
  }

  @Test
  void coercesCounts() {
    assertEquals(3L, d.coerceCount(3));
    assertEquals(4L, d.coerceCount("4"));
    assertEquals(0L, d.coerceCount(null));
  }
}
