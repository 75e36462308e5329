package io.intellixity.docsql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.docsql.error.DataAccessException;
import io.intellixity.docsql.error.MissingDependencyException;
import io.intellixity.docsql.error.TransactionException;
import io.intellixity.docsql.exec.TableAdapter;
import io.intellixity.docsql.jdbc.dialect.JdbcDialect;
import io.intellixity.docsql.query.QueryFilters;
import io.intellixity.docsql.query.QueryParams;
import io.intellixity.docsql.query.QueryValidationException;
import io.intellixity.docsql.schema.EntityDefinition;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.*;
import java.util.stream.Stream;

/**
 * {@link TableAdapter} over JDBC.
 *
 * <p>Built from an {@link AdapterConfig}, the adapter owns a HikariCP pool created by {@link #connect()} and
 * closed by {@link #disconnect()}. Built from a {@link JdbcHandle}, it uses the host's DataSource and never
 * closes it.
 */
public final class JdbcTableAdapter implements TableAdapter {
  private static final Logger log = LoggerFactory.getLogger(JdbcTableAdapter.class);

  @FunctionalInterface
  private interface ConnectionWork<T> {
    T run(Connection c) throws SQLException;
  }

  private final EntityDefinition entity;
  private final AdapterConfig config;
  private final JdbcDialect dialect;
  private final TableRef table;
  private final String idColumn;

  private HikariDataSource pool;
  private JdbcHandle handle;
  private JdbcStatementExecutor executor;
  private QueryAssembler assembler;
  private JdbcSchemaManager schema;

  public JdbcTableAdapter(EntityDefinition entity, AdapterConfig config) {
    this.entity = Objects.requireNonNull(entity, "entity");
    this.config = Objects.requireNonNull(config, "config");
    this.dialect = config.backend().newDialect();
    this.table = new TableRef(config.schema() != null ? config.schema() : entity.schema(),
        config.tableName() != null ? config.tableName() : entity.tableName());
    this.idColumn = entity.idColumn();
  }

  /** Adapter over a host-managed DataSource; {@link #disconnect()} leaves it open. */
  public JdbcTableAdapter(EntityDefinition entity, JdbcHandle handle, JdbcDialect dialect) {
    this.entity = Objects.requireNonNull(entity, "entity");
    this.config = null;
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(handle, "handle");
    this.table = new TableRef(handle.schema() != null ? handle.schema() : entity.schema(), entity.tableName());
    this.idColumn = entity.idColumn();
    bind(handle);
  }

  // ---- lifecycle ----

  @Override
  public synchronized void connect() {
    if (handle != null) return;

    String driver = config.backend().driverClassName();
    try {
      Class.forName(driver);
    } catch (ClassNotFoundException e) {
      throw new MissingDependencyException(driver,
          "JDBC driver '" + driver + "' for backend " + config.backend() + " is not on the classpath", e);
    }

    log.debug("docsql connecting backend={} url={}", config.backend(), config.jdbcUrl());
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(config.jdbcUrl());
    hc.setUsername(config.username());
    hc.setPassword(config.password());
    hc.setDriverClassName(driver);
    hc.setMaximumPoolSize(config.maxPoolSize());
    hc.setPoolName("docsql-" + table.name());
    try {
      pool = new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new DataAccessException("Cannot open connection pool for " + config.jdbcUrl() + ": " + e.getMessage(), e);
    }
    bind(new JdbcHandle(hc.getPoolName(), pool, table.schema()));
    log.info("docsql connected backend={} table={} pool={}", config.backend(), table, hc.getPoolName());
  }

  private void bind(JdbcHandle h) {
    this.handle = h;
    this.executor = new JdbcStatementExecutor(h);
    this.assembler = new QueryAssembler(dialect, table, idColumn);
    this.schema = new JdbcSchemaManager(h, dialect, executor, table);
  }

  @Override
  public synchronized void disconnect() {
    if (pool == null) return;
    pool.close();
    log.info("docsql disconnected table={}", table);
    pool = null;
    handle = null;
    executor = null;
    assembler = null;
    schema = null;
  }

  @Override public boolean hasNestedFieldSupport() { return false; }
  @Override public String idColumn() { return idColumn; }

  public TableRef table() { return table; }
  public JdbcDialect dialect() { return dialect; }
  public EntityDefinition entity() { return entity; }

  // ---- reads ----

  @Override
  public List<Map<String, Object>> find(QueryParams params) {
    SqlStatement ss = assembler().select(params);
    return withConnection("find", c -> executor.query(c, "SELECT", ss));
  }

  @Override
  public Stream<Map<String, Object>> findStream(QueryParams params) {
    SqlStatement ss = assembler().select(params);
    Connection c;
    try {
      c = handle.client().getConnection();
    } catch (SQLException e) {
      throw new DataAccessException("findStream on '" + table + "' failed: " + e.getMessage(), e);
    }
    return executor.stream(c, ss);
  }

  @Override
  public Optional<Map<String, Object>> findOne(QueryParams params) {
    QueryParams p = (params == null) ? new QueryParams() : params.copy();
    List<Map<String, Object>> rows = find(p.withLimit(1));
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public Optional<Map<String, Object>> findById(Object id) {
    if (id == null) return Optional.empty();
    return findOne(new QueryParams().where(idColumn, id));
  }

  @Override
  public List<Map<String, Object>> findByIds(Collection<?> ids) {
    if (ids == null || ids.isEmpty()) return List.of();
    SqlStatement ss = dialect.renderSelect(
        new SelectPlan(table, QueryFilters.in(idColumn, new ArrayList<>(ids)), List.of(), null, null, false));
    return withConnection("findByIds", c -> executor.query(c, "SELECT", ss));
  }

  @Override
  public long count(QueryParams params) {
    SqlStatement ss = assembler().count(params);
    Object raw = withConnection("count", c -> executor.queryValue(c, "COUNT", ss));
    return dialect.coerceCount(raw);
  }

  // ---- writes ----

  @Override
  public Map<String, Object> insert(Map<String, ?> entity) {
    Objects.requireNonNull(entity, "entity");
    Object id = withConnection("insert", c -> insertRow(c, entity));
    if (id == null) return new LinkedHashMap<>(entity);
    return findById(id).orElseGet(() -> {
      Map<String, Object> copy = new LinkedHashMap<>(entity);
      copy.put(idColumn, id);
      return copy;
    });
  }

  /** Caller-supplied id wins; otherwise the key the store generated. */
  private Object insertRow(Connection c, Map<String, ?> entity) throws SQLException {
    Map<String, Object> values = new LinkedHashMap<>(entity);
    Object suppliedId = values.get(idColumn);
    if (suppliedId == null) values.remove(idColumn);
    Object generated = executor.insertForId(c, dialect.renderInsert(table, values, idColumn), idColumn);
    return suppliedId != null ? suppliedId : generated;
  }

  @Override
  public List<Object> insertMany(List<? extends Map<String, ?>> entities) {
    if (entities == null || entities.isEmpty()) return List.of();
    return inTransaction("insertMany", c -> {
      List<Object> ids = new ArrayList<>(entities.size());
      for (Map<String, ?> e : entities) ids.add(insertRow(c, e));
      return ids;
    });
  }

  @Override
  public List<Map<String, Object>> insertManyAndFetch(List<? extends Map<String, ?>> entities) {
    List<Object> ids = insertMany(entities);
    List<Map<String, Object>> rows = findByIds(ids);

    // restore input order; ids are matched by string form since drivers may widen key types
    Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) byId.put(String.valueOf(row.get(idColumn)), row);
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Object id : ids) {
      Map<String, Object> row = byId.remove(String.valueOf(id));
      if (row != null) out.add(row);
    }
    out.addAll(byId.values());
    return out;
  }

  @Override
  public Optional<Map<String, Object>> updateById(Object id, Map<String, ?> changes, boolean raw) {
    Changes ch = Changes.of(changes, raw);
    if (!ch.isEmpty()) {
      SqlStatement ss = dialect.renderUpdate(table, ch.sets(), ch.increments(), QueryFilters.eq(idColumn, id));
      withConnection("updateById", c -> executor.update(c, "UPDATE", ss));
    }
    return findById(id);
  }

  @Override
  public long updateMany(Map<String, ?> query, Map<String, ?> changes, boolean raw) {
    Changes ch = Changes.of(changes, raw);
    if (ch.isEmpty()) return 0L;
    SqlStatement ss = dialect.renderUpdate(table, ch.sets(), ch.increments(),
        assembler().filter(QueryParams.of(query)));
    return withConnection("updateMany", c -> executor.update(c, "UPDATE", ss));
  }

  @Override
  public Optional<Map<String, Object>> replaceById(Object id, Map<String, ?> entity) {
    Map<String, Object> values = new LinkedHashMap<>(entity);
    values.remove(idColumn);
    return updateById(id, values, false);
  }

  @Override
  public Object removeById(Object id) {
    SqlStatement ss = dialect.renderDelete(table, QueryFilters.eq(idColumn, id));
    withConnection("removeById", c -> executor.update(c, "DELETE", ss));
    return id;
  }

  @Override
  public long removeMany(Map<String, ?> query) {
    SqlStatement ss = dialect.renderDelete(table, assembler().filter(QueryParams.of(query)));
    return withConnection("removeMany", c -> executor.update(c, "DELETE", ss));
  }

  @Override
  public long clear() {
    long before = count();
    withConnection("clear", c -> executor.update(c, "TRUNCATE", dialect.renderTruncate(table)));
    return before;
  }

  // ---- schema ----

  @Override
  public void createTable(List<FieldDefinition> fields, boolean dropTableIfExists, boolean createIndexes) {
    schema().createTable(fields == null ? entity.fields() : fields, entity.indexes(), dropTableIfExists, createIndexes);
  }

  @Override
  public void createTable() {
    createTable(entity.fields(), true, true);
  }

  @Override
  public void dropTable() {
    dropTable(table.name());
  }

  @Override
  public void dropTable(String tableName) {
    schema().dropTable(tableName);
  }

  @Override
  public void createIndex(IndexDefinition def) {
    schema().createIndex(def);
  }

  @Override
  public void removeIndex(IndexDefinition def) {
    schema().removeIndex(def);
  }

  // ---- plumbing ----

  private QueryAssembler assembler() {
    requireConnected();
    return assembler;
  }

  private JdbcSchemaManager schema() {
    requireConnected();
    return schema;
  }

  private void requireConnected() {
    if (handle == null) throw new IllegalStateException("Adapter for '" + table + "' is not connected; call connect() first");
  }

  private <T> T withConnection(String op, ConnectionWork<T> work) {
    requireConnected();
    try (Connection c = handle.client().getConnection()) {
      return work.run(c);
    } catch (SQLException e) {
      throw new DataAccessException(op + " on '" + table + "' failed: " + e.getMessage(), e);
    }
  }

  private <T> T inTransaction(String op, ConnectionWork<T> work) {
    requireConnected();
    try (Connection c = handle.client().getConnection()) {
      boolean autoCommit = c.getAutoCommit();
      c.setAutoCommit(false);
      T out;
      try {
        out = work.run(c);
        c.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(c, e);
        TransactionException failure =
            new TransactionException(op + " on '" + table + "' rolled back: " + e.getMessage(), e);
        restoreAutoCommit(c, autoCommit, failure);
        throw failure;
      }
      restoreAutoCommit(c, autoCommit, null);
      return out;
    } catch (SQLException e) {
      throw new TransactionException(op + " on '" + table + "' failed: " + e.getMessage(), e);
    }
  }

  /** Reset auto-commit; a failure is attached to {@code primary} when there is one, else thrown. */
  private static void restoreAutoCommit(Connection c, boolean autoCommit, RuntimeException primary) throws SQLException {
    try {
      c.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      if (primary == null) throw e;
      primary.addSuppressed(e);
    }
  }

  private static void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /** Column assignments of an update: plain values and increments. */
  record Changes(Map<String, Object> sets, Map<String, Object> increments) {
    boolean isEmpty() { return sets.isEmpty() && increments.isEmpty(); }

    static Changes of(Map<String, ?> changes, boolean raw) {
      Map<String, Object> sets = new LinkedHashMap<>();
      Map<String, Object> incs = new LinkedHashMap<>();
      if (changes == null) return new Changes(sets, incs);
      if (!raw) {
        sets.putAll(changes);
        return new Changes(sets, incs);
      }
      copySection(changes.get("$set"), "$set", sets);
      copySection(changes.get("$inc"), "$inc", incs);
      return new Changes(sets, incs);
    }

    private static void copySection(Object section, String name, Map<String, Object> out) {
      if (section == null) return;
      if (!(section instanceof Map<?, ?> m)) {
        throw new QueryValidationException("Raw update section " + name + " must be a map, got " + section.getClass().getName());
      }
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), e.getValue());
    }
  }
}
