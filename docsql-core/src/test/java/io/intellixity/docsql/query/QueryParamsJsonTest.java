package io.intellixity.docsql.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.docsql.query.compile.FilterCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.docsql.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryParamsJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesFullParams() throws Exception {
    String s = """
        {
          "query": { "status": "active", "age": { "$gte": 18, "$lt": 65 } },
          "search": "bob",
          "searchFields": ["name", "email"],
          "sort": ["-age", "name"],
          "limit": 10,
          "offset": 20
        }
        """;
    QueryParams p = JSON.readValue(s, QueryParams.class);
    assertEquals(List.of("status", "age"), List.copyOf(p.query().keySet()));
    assertEquals("bob", p.search());
    assertEquals(List.of("name", "email"), p.searchFields());
    assertTrue(p.hasSearch());
    assertEquals(List.of(SortField.desc("age"), SortField.asc("name")), p.sortFields());
    assertEquals(10, p.limit());
    assertEquals(20, p.offset());
  }

  @Test
  void operatorKeyOrderSurvivesParsing() throws Exception {
    String s = """
        { "query": { "b": 2, "$or": [ { "a": 1 }, { "c": { "$in": [1, 2] } } ], "a": 0 } }
        """;
    QueryParams p = JSON.readValue(s, QueryParams.class);
    QueryElement el = FilterCompiler.toElement(p.query());
    assertEquals(and(eq("b", 2), or(eq("a", 1), in("c", List.of(1, 2))), eq("a", 0)), el);
  }

  @Test
  void singleStringSortAndSearchFields() throws Exception {
    String s = """
        { "sort": "&length(name) desc", "searchFields": "name", "search": "x" }
        """;
    QueryParams p = JSON.readValue(s, QueryParams.class);
    assertEquals(List.of(SortField.raw("length(name) desc")), p.sortFields());
    assertEquals(List.of("name"), p.searchFields());
  }

  @Test
  void nonIntegralPagingIsIgnored() throws Exception {
    String s = """
        { "limit": "10", "offset": 2.5 }
        """;
    QueryParams p = JSON.readValue(s, QueryParams.class);
    assertNull(p.limit());
    assertNull(p.offset());
    assertTrue(p.query().isEmpty());
    assertFalse(p.hasSearch());
  }

  @Test
  void pagingBeyondIntRangeIsRejected() {
    assertThrows(QueryValidationException.class,
        () -> JSON.readValue("{ \"limit\": 4294967297 }", QueryParams.class));
    assertThrows(QueryValidationException.class,
        () -> JSON.readValue("{ \"offset\": 99999999999999999999 }", QueryParams.class));
  }

  @Test
  void rejectsNonObjectRoot() {
    assertThrows(QueryValidationException.class, () -> JSON.readValue("[1, 2]", QueryParams.class));
  }

  @Test
  void copiesAreIndependent() {
    QueryParams p = QueryParams.of(Map.of("a", 1)).withSort("-a").withLimit(5).withOffset(2);
    QueryParams c = p.copy().where("b", 2).withLimit(1);
    assertEquals(1, p.query().size());
    assertEquals(5, p.limit());
    assertEquals(List.of("-a"), c.sort());

    QueryParams f = p.filterOnly();
    assertTrue(f.sort().isEmpty());
    assertNull(f.limit());
    assertNull(f.offset());
  }
}
