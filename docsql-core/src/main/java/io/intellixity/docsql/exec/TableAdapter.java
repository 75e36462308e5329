package io.intellixity.docsql.exec;

import io.intellixity.docsql.query.QueryParams;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;

import java.util.*;
import java.util.stream.Stream;

/**
 * CRUD and schema operations on one table, driven by document-style filters.
 *
 * <p>Entities are column-name to value maps. Calls block until the store answers; see
 * {@link AsyncTableAdapter} for a future-based facade.
 */
public interface TableAdapter extends AutoCloseable {

  // ---- lifecycle ----

  void connect();

  /** Release the store client. No-op when never connected; safe to call twice. */
  void disconnect();

  @Override
  default void close() { disconnect(); }

  /** Whether dotted paths ({@code "address.city"}) address nested values. */
  boolean hasNestedFieldSupport();

  /** Column holding the entity identity. */
  String idColumn();

  // ---- reads ----

  List<Map<String, Object>> find(QueryParams params);

  /**
   * Lazily read rows matching {@code params}. The stream holds a connection open until it is closed, so use
   * try-with-resources.
   */
  Stream<Map<String, Object>> findStream(QueryParams params);

  Optional<Map<String, Object>> findOne(QueryParams params);

  Optional<Map<String, Object>> findById(Object id);

  /** Entities whose id is in {@code ids}, read with one query; missing ids are skipped. */
  List<Map<String, Object>> findByIds(Collection<?> ids);

  long count(QueryParams params);

  default long count() { return count(new QueryParams()); }

  // ---- writes ----

  /** Insert and return the stored entity, re-read by its resolved id. */
  Map<String, Object> insert(Map<String, ?> entity);

  /** Insert all in one transaction; ids come back in input order. */
  List<Object> insertMany(List<? extends Map<String, ?>> entities);

  /** Like {@link #insertMany(List)}, then fetch the stored entities with one {@link #findByIds} call. */
  List<Map<String, Object>> insertManyAndFetch(List<? extends Map<String, ?>> entities);

  /** Ids when {@code returnEntities} is false, stored entities otherwise. */
  default List<?> insertMany(List<? extends Map<String, ?>> entities, boolean returnEntities) {
    return returnEntities ? insertManyAndFetch(entities) : insertMany(entities);
  }

  /**
   * Update one entity. With {@code raw} set, {@code changes} holds {@code $set} and/or {@code $inc} sections;
   * otherwise every entry is assigned.
   */
  Optional<Map<String, Object>> updateById(Object id, Map<String, ?> changes, boolean raw);

  default Optional<Map<String, Object>> updateById(Object id, Map<String, ?> changes) {
    return updateById(id, changes, false);
  }

  /** Update every row matching the filter; returns the affected row count. */
  long updateMany(Map<String, ?> query, Map<String, ?> changes, boolean raw);

  /** Overwrite all columns except the identity column. */
  Optional<Map<String, Object>> replaceById(Object id, Map<String, ?> entity);

  /** Delete by id and return the id, whether or not a row was deleted. */
  Object removeById(Object id);

  long removeMany(Map<String, ?> query);

  /** Delete all rows and return how many there were. */
  long clear();

  // ---- schema ----

  void createTable(List<FieldDefinition> fields, boolean dropTableIfExists, boolean createIndexes);

  /** Create the table from the entity's own fields, dropping any existing one, indexes included. */
  void createTable();

  /** Drop this adapter's own table. */
  void dropTable();

  /** Drop {@code tableName} in this adapter's schema, if it exists. */
  void dropTable(String tableName);

  void createIndex(IndexDefinition def);

  void removeIndex(IndexDefinition def);
}
