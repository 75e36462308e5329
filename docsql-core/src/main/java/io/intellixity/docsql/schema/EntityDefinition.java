package io.intellixity.docsql.schema;

import io.intellixity.docsql.error.ConfigurationException;

import java.util.*;

/**
 * Host-side description of an entity: its fields, indexes and storage location.
 *
 * <p>The identity field is the single primary-key field; without one the identity column is {@code "id"}.
 */
public final class EntityDefinition {
  public static final String DEFAULT_ID_COLUMN = "id";

  private final String name;
  private final String tableName;
  private final String schema;
  private final List<FieldDefinition> fields;
  private final List<IndexDefinition> indexes;
  private final FieldDefinition primaryField;

  private EntityDefinition(Builder b) {
    this.name = Objects.requireNonNull(b.name, "name");
    this.tableName = b.tableName;
    this.schema = b.schema;
    this.fields = List.copyOf(b.fields);
    this.indexes = List.copyOf(b.indexes);

    FieldDefinition pk = null;
    for (FieldDefinition f : fields) {
      if (!f.primaryKey()) continue;
      if (pk != null) {
        throw new ConfigurationException("Entity '" + name + "' declares more than one primary key: '"
            + pk.name() + "' and '" + f.name() + "'");
      }
      pk = f;
    }
    this.primaryField = pk;
  }

  public String name() { return name; }
  /** Explicit table name, or the entity name. */
  public String tableName() { return (tableName == null || tableName.isBlank()) ? name : tableName; }
  public String schema() { return schema; }
  public List<FieldDefinition> fields() { return fields; }
  public List<IndexDefinition> indexes() { return indexes; }
  public Optional<FieldDefinition> primaryField() { return Optional.ofNullable(primaryField); }

  public String idColumn() {
    return primaryField == null ? DEFAULT_ID_COLUMN : primaryField.columnName();
  }

  public Optional<FieldDefinition> field(String name) {
    for (FieldDefinition f : fields) {
      if (f.name().equals(name) || f.columnName().equals(name)) return Optional.of(f);
    }
    return Optional.empty();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String tableName;
    private String schema;
    private final List<FieldDefinition> fields = new ArrayList<>();
    private final List<IndexDefinition> indexes = new ArrayList<>();

    private Builder(String name) { this.name = name; }

    public Builder tableName(String v) { this.tableName = v; return this; }
    public Builder schema(String v) { this.schema = v; return this; }
    public Builder field(FieldDefinition f) { this.fields.add(Objects.requireNonNull(f, "field")); return this; }
    public Builder fields(Collection<FieldDefinition> fs) { fs.forEach(this::field); return this; }
    public Builder index(IndexDefinition i) { this.indexes.add(Objects.requireNonNull(i, "index")); return this; }

    public EntityDefinition build() {
      return new EntityDefinition(this);
    }
  }
}
