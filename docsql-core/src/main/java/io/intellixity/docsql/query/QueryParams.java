package io.intellixity.docsql.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.*;

/**
 * Parameters of a find / count call: a document-style filter plus search, sort and paging.
 *
 * <p>{@code limit} and {@code offset} are applied only when greater than zero.
 */
@JsonDeserialize(using = QueryParamsJsonDeserializer.class)
public final class QueryParams {
  private Map<String, Object> query = new LinkedHashMap<>();
  private String search;
  private List<String> searchFields = new ArrayList<>();
  private List<String> sort = new ArrayList<>();
  private Integer limit;
  private Integer offset;

  public QueryParams() {}

  /** Filter spec; keys are field names or {@code $}-operators, iterated in insertion order. */
  public Map<String, Object> query() { return query; }
  public String search() { return search; }
  public List<String> searchFields() { return searchFields; }
  /** Sort tokens: {@code field}, {@code -field} or {@code &rawExpression}. */
  public List<String> sort() { return sort; }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }

  public QueryParams withQuery(Map<String, ?> query) { this.query = new LinkedHashMap<>(query == null ? Map.of() : query); return this; }
  public QueryParams where(String key, Object value) { this.query.put(key, value); return this; }
  public QueryParams withSearch(String search) { this.search = search; return this; }
  public QueryParams withSearch(String search, String... fields) { this.search = search; return withSearchFields(Arrays.asList(fields)); }
  public QueryParams withSearchFields(List<String> fields) { this.searchFields = new ArrayList<>(fields == null ? List.of() : fields); return this; }
  public QueryParams withSort(String... tokens) { return withSort(Arrays.asList(tokens)); }
  public QueryParams withSort(List<String> tokens) { this.sort = new ArrayList<>(tokens == null ? List.of() : tokens); return this; }
  public QueryParams withLimit(Integer limit) { this.limit = limit; return this; }
  public QueryParams withOffset(Integer offset) { this.offset = offset; return this; }

  public List<SortField> sortFields() {
    List<SortField> out = new ArrayList<>(sort.size());
    for (String token : sort) {
      if (token != null && !token.isBlank()) out.add(SortField.parse(token));
    }
    return out;
  }

  public boolean hasSearch() {
    return search != null && !search.isEmpty() && !searchFields.isEmpty();
  }

  public static QueryParams of(Map<String, ?> query) {
    return new QueryParams().withQuery(query);
  }

  public QueryParams copy() {
    return filterOnly().withSort(sort).withLimit(limit).withOffset(offset);
  }

  /** Copy carrying only the filter and search, as used for counting. */
  public QueryParams filterOnly() {
    return new QueryParams().withQuery(query).withSearch(search).withSearchFields(searchFields);
  }

  @Override
  public String toString() {
    return "QueryParams{query=" + query + ", search=" + search + ", searchFields=" + searchFields
        + ", sort=" + sort + ", limit=" + limit + ", offset=" + offset + "}";
  }
}
