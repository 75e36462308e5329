package io.intellixity.docsql.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Portable column types accepted in {@link FieldDefinition#columnType()}. Each dialect maps them to its own DDL
 * spelling.
 */
public enum ColumnType {
  INCREMENTS("increments"),
  BIG_INCREMENTS("bigIncrements"),
  INTEGER("integer"),
  BIG_INTEGER("bigInteger"),
  TINYINT("tinyint"),
  SMALLINT("smallint"),
  STRING("string"),
  TEXT("text"),
  FLOAT("float"),
  DOUBLE("double"),
  DECIMAL("decimal"),
  BOOLEAN("boolean"),
  DATE("date"),
  DATETIME("datetime"),
  TIME("time"),
  TIMESTAMP("timestamp"),
  BINARY("binary"),
  JSON("json"),
  JSONB("jsonb"),
  UUID("uuid");

  private final String id;

  ColumnType(String id) {
    this.id = id;
  }

  /** Identifier used in field definitions, e.g. {@code "bigInteger"}. */
  public String id() {
    return id;
  }

  public boolean isAutoIncrement() {
    return this == INCREMENTS || this == BIG_INCREMENTS;
  }

  /** Exact id match first, then a case-insensitive one. */
  public static Optional<ColumnType> fromId(String id) {
    if (id == null) return Optional.empty();
    for (ColumnType t : values()) {
      if (t.id.equals(id)) return Optional.of(t);
    }
    String lower = id.toLowerCase(Locale.ROOT);
    for (ColumnType t : values()) {
      if (t.id.toLowerCase(Locale.ROOT).equals(lower)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
