package io.intellixity.docsql.schema;

import java.util.Objects;

/**
 * One field of an entity as the host describes it.
 *
 * <p>{@code columnType} stays a raw string here; it is resolved against {@link ColumnType} when DDL is
 * generated, so unknown types are reported by {@code createTable}, not at definition time.
 */
public record FieldDefinition(
    String name,
    String columnName,
    String columnType,
    boolean primaryKey,
    Generated generated,
    Integer columnLength,
    Integer max,
    Integer length,
    boolean virtual) {

  public FieldDefinition {
    Objects.requireNonNull(name, "name");
    columnName = (columnName == null || columnName.isBlank()) ? name : columnName;
  }

  /** Declared string length: {@code columnLength}, else {@code max}, else {@code length}; {@code null} if none. */
  public Integer stringLength() {
    if (columnLength != null) return columnLength;
    if (max != null) return max;
    return length;
  }

  public boolean userGenerated() {
    return generated == Generated.USER;
  }

  public static FieldDefinition of(String name, String columnType) {
    return builder(name).columnType(columnType).build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String columnName;
    private String columnType;
    private boolean primaryKey;
    private Generated generated;
    private Integer columnLength;
    private Integer max;
    private Integer length;
    private boolean virtual;

    private Builder(String name) { this.name = name; }

    public Builder columnName(String v) { this.columnName = v; return this; }
    public Builder columnType(String v) { this.columnType = v; return this; }
    public Builder columnType(ColumnType v) { this.columnType = v.id(); return this; }
    public Builder primaryKey(boolean v) { this.primaryKey = v; return this; }
    public Builder generated(Generated v) { this.generated = v; return this; }
    public Builder columnLength(Integer v) { this.columnLength = v; return this; }
    public Builder max(Integer v) { this.max = v; return this; }
    public Builder length(Integer v) { this.length = v; return this; }
    public Builder virtual(boolean v) { this.virtual = v; return this; }

    public FieldDefinition build() {
      return new FieldDefinition(name, columnName, columnType, primaryKey, generated, columnLength, max, length, virtual);
    }
  }
}
