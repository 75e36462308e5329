package io.intellixity.docsql.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * JSON form of {@link QueryParams}:
 * <pre>{ "query": {...}, "search": "txt", "searchFields": ["a","b"], "sort": "-age" | [...], "limit": 10, "offset": 20 }</pre>
 * {@code sort} and {@code searchFields} accept a single string or an array. {@code limit} / {@code offset} are
 * read only from integral numbers and must fit in an {@code int}.
 */
public final class QueryParamsJsonDeserializer extends JsonDeserializer<QueryParams> {
  @Override
  public QueryParams deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("QueryParams JSON must be an object");

    QueryParams q = new QueryParams();

    JsonNode query = root.get("query");
    if (query != null && query.isObject()) {
      // Jackson maps objects to LinkedHashMap, keeping the key order operator dispatch depends on
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(query, LinkedHashMap.class);
      q.withQuery(m);
    }

    JsonNode search = root.get("search");
    if (search != null && search.isValueNode() && !search.isNull()) q.withSearch(search.asText());

    q.withSearchFields(stringList(root.get("searchFields")));
    q.withSort(stringList(root.get("sort")));

    Integer limit = intField(root, "limit");
    if (limit != null) q.withLimit(limit);
    Integer offset = intField(root, "offset");
    if (offset != null) q.withOffset(offset);

    return q;
  }

  private static Integer intField(JsonNode root, String name) {
    JsonNode n = root.get(name);
    if (n == null || !n.isIntegralNumber()) return null;
    if (!n.canConvertToInt()) throw new QueryValidationException("'" + name + "' is out of range: " + n.asText());
    return n.intValue();
  }

  private static List<String> stringList(JsonNode n) {
    if (n == null || n.isNull()) return List.of();
    if (n.isTextual()) return List.of(n.asText());
    List<String> out = new ArrayList<>();
    if (n.isArray()) {
      for (JsonNode x : n) if (x.isTextual()) out.add(x.asText());
    }
    return out;
  }
}
