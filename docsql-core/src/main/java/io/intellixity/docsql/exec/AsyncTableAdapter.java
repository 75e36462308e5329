package io.intellixity.docsql.exec;

import io.intellixity.docsql.query.QueryParams;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Future-returning view of a {@link TableAdapter}. Each call runs on {@code executor}; independent calls are not
 * ordered relative to each other.
 */
public final class AsyncTableAdapter {
  private final TableAdapter delegate;
  private final Executor executor;

  public AsyncTableAdapter(TableAdapter delegate, Executor executor) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public TableAdapter delegate() { return delegate; }

  public CompletableFuture<Void> connect() {
    return CompletableFuture.runAsync(delegate::connect, executor);
  }

  public CompletableFuture<Void> disconnect() {
    return CompletableFuture.runAsync(delegate::disconnect, executor);
  }

  public CompletableFuture<List<Map<String, Object>>> find(QueryParams params) {
    return CompletableFuture.supplyAsync(() -> delegate.find(params), executor);
  }

  /** The stream is opened on the executor; the caller closes it. */
  public CompletableFuture<Stream<Map<String, Object>>> findStream(QueryParams params) {
    return CompletableFuture.supplyAsync(() -> delegate.findStream(params), executor);
  }

  public CompletableFuture<Optional<Map<String, Object>>> findOne(QueryParams params) {
    return CompletableFuture.supplyAsync(() -> delegate.findOne(params), executor);
  }

  public CompletableFuture<Optional<Map<String, Object>>> findById(Object id) {
    return CompletableFuture.supplyAsync(() -> delegate.findById(id), executor);
  }

  public CompletableFuture<List<Map<String, Object>>> findByIds(Collection<?> ids) {
    return CompletableFuture.supplyAsync(() -> delegate.findByIds(ids), executor);
  }

  public CompletableFuture<Long> count(QueryParams params) {
    return CompletableFuture.supplyAsync(() -> delegate.count(params), executor);
  }

  public CompletableFuture<Map<String, Object>> insert(Map<String, ?> entity) {
    return CompletableFuture.supplyAsync(() -> delegate.insert(entity), executor);
  }

  public CompletableFuture<List<?>> insertMany(List<? extends Map<String, ?>> entities, boolean returnEntities) {
    return CompletableFuture.supplyAsync(() -> delegate.insertMany(entities, returnEntities), executor);
  }

  public CompletableFuture<Optional<Map<String, Object>>> updateById(Object id, Map<String, ?> changes, boolean raw) {
    return CompletableFuture.supplyAsync(() -> delegate.updateById(id, changes, raw), executor);
  }

  public CompletableFuture<Long> updateMany(Map<String, ?> query, Map<String, ?> changes, boolean raw) {
    return CompletableFuture.supplyAsync(() -> delegate.updateMany(query, changes, raw), executor);
  }

  public CompletableFuture<Optional<Map<String, Object>>> replaceById(Object id, Map<String, ?> entity) {
    return CompletableFuture.supplyAsync(() -> delegate.replaceById(id, entity), executor);
  }

  public CompletableFuture<Object> removeById(Object id) {
    return CompletableFuture.supplyAsync(() -> delegate.removeById(id), executor);
  }

  public CompletableFuture<Long> removeMany(Map<String, ?> query) {
    return CompletableFuture.supplyAsync(() -> delegate.removeMany(query), executor);
  }

  public CompletableFuture<Long> clear() {
    return CompletableFuture.supplyAsync(delegate::clear, executor);
  }

  public CompletableFuture<Void> createTable(List<FieldDefinition> fields, boolean dropTableIfExists, boolean createIndexes) {
    return CompletableFuture.runAsync(() -> delegate.createTable(fields, dropTableIfExists, createIndexes), executor);
  }

  public CompletableFuture<Void> createTable() {
    return CompletableFuture.runAsync(delegate::createTable, executor);
  }

  public CompletableFuture<Void> dropTable() {
    return CompletableFuture.runAsync(() -> delegate.dropTable(), executor);
  }

  public CompletableFuture<Void> dropTable(String tableName) {
    return CompletableFuture.runAsync(() -> delegate.dropTable(tableName), executor);
  }

  public CompletableFuture<Void> createIndex(IndexDefinition def) {
    return CompletableFuture.runAsync(() -> delegate.createIndex(def), executor);
  }

  public CompletableFuture<Void> removeIndex(IndexDefinition def) {
    return CompletableFuture.runAsync(() -> delegate.removeIndex(def), executor);
  }
}
