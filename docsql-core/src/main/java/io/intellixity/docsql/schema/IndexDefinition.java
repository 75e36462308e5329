package io.intellixity.docsql.schema;

import java.util.*;

/**
 * Index on one or more columns. {@code type} is an optional access-method hint (e.g. {@code "btree"},
 * {@code "hash"}), honored only by dialects that support one.
 */
public record IndexDefinition(List<String> fields, String name, boolean unique, String type) {
  public IndexDefinition {
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (fields.isEmpty()) throw new IllegalArgumentException("index needs at least one field");
  }

  public static IndexDefinition on(String... fields) {
    return new IndexDefinition(Arrays.asList(fields), null, false, null);
  }

  public static IndexDefinition unique(String... fields) {
    return new IndexDefinition(Arrays.asList(fields), null, true, null);
  }

  public IndexDefinition named(String name) {
    return new IndexDefinition(fields, name, unique, type);
  }

  public IndexDefinition withType(String type) {
    return new IndexDefinition(fields, name, unique, type);
  }

  /**
   * Build from a loosely typed field spec: a single name, a list of names, or a map whose keys are the names
   * (values such as sort direction are ignored).
   */
  public static IndexDefinition of(Object fields, String name, boolean unique, String type) {
    return new IndexDefinition(normalizeFields(fields), name, unique, type);
  }

  static List<String> normalizeFields(Object fields) {
    if (fields instanceof String s) return List.of(s);
    List<String> out = new ArrayList<>();
    if (fields instanceof Map<?, ?> m) {
      for (Object k : m.keySet()) out.add(String.valueOf(k));
    } else if (fields instanceof Collection<?> c) {
      for (Object k : c) out.add(String.valueOf(k));
    } else if (fields != null) {
      throw new IllegalArgumentException("Unsupported index fields: " + fields);
    }
    return out;
  }
}
