package io.intellixity.docsql.jdbc;

import java.util.Objects;

/** Table name with an optional schema qualifier. */
public record TableRef(String schema, String name) {
  public TableRef {
    Objects.requireNonNull(name, "name");
    schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public static TableRef of(String name) {
    return new TableRef(null, name);
  }

  @Override
  public String toString() {
    return schema == null ? name : schema + "." + name;
  }
}
