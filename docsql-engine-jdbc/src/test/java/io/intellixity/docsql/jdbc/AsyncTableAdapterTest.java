package io.intellixity.docsql.jdbc;

import io.intellixity.docsql.error.DataAccessException;
import io.intellixity.docsql.error.TransactionException;
import io.intellixity.docsql.exec.AsyncTableAdapter;
import io.intellixity.docsql.query.QueryParams;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.EntityDefinition;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class AsyncTableAdapterTest {
  private static final EntityDefinition TAGS = EntityDefinition.builder("tags")
      .field(FieldDefinition.builder("id").columnType(ColumnType.INCREMENTS).primaryKey(true).build())
      .field(FieldDefinition.of("label", "string"))
      .index(IndexDefinition.unique("label"))
      .build();

  private ExecutorService executor;
  private AsyncTableAdapter tags;

  @BeforeEach
  void setUp() throws Exception {
    executor = Executors.newFixedThreadPool(2);
    JdbcTableAdapter adapter = new JdbcTableAdapter(TAGS,
        AdapterConfig.builder().jdbcUrl("jdbc:h2:mem:tags_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1").build());
    tags = new AsyncTableAdapter(adapter, executor);
    tags.connect().get(5, TimeUnit.SECONDS);
    tags.createTable().get(5, TimeUnit.SECONDS);
  }

  @AfterEach
  void tearDown() throws Exception {
    tags.disconnect().get(5, TimeUnit.SECONDS);
    executor.shutdownNow();
  }

  @Test
  void runsOperationsOnTheExecutor() throws Exception {
    Map<String, Object> saved = tags.insert(Map.of("label", "java")).get(5, TimeUnit.SECONDS);
    Object id = saved.get("id");

    CompletableFuture<Long> count = tags.count(new QueryParams());
    CompletableFuture<List<Map<String, Object>>> found = tags.find(QueryParams.of(Map.of("label", "java")));
    assertEquals(1L, count.get(5, TimeUnit.SECONDS));
    assertEquals(id, found.get(5, TimeUnit.SECONDS).get(0).get("id"));

    assertEquals("sql", tags.updateById(id, Map.of("label", "sql"), false).get(5, TimeUnit.SECONDS)
        .orElseThrow().get("label"));
    assertEquals(id, tags.removeById(id).get(5, TimeUnit.SECONDS));
    assertTrue(tags.findById(id).get(5, TimeUnit.SECONDS).isEmpty());
  }

  @Test
  void failuresCompleteTheFutureExceptionally() {
    CompletableFuture<List<?>> batch = tags.insertMany(List.of(Map.of("label", "a"), Map.of("label", "a")), false);
    ExecutionException ex = assertThrows(ExecutionException.class, () -> batch.get(5, TimeUnit.SECONDS));
    assertTrue(ex.getCause() instanceof TransactionException);
    assertEquals(0L, tags.clear().join());
  }

  @Test
  void schemaAndStreamingRunThroughFutures() throws Exception {
    tags.insertMany(List.of(Map.of("label", "a"), Map.of("label", "b")), false).get(5, TimeUnit.SECONDS);
    try (Stream<Map<String, Object>> rows = tags.findStream(new QueryParams().withSort(List.of("label")))
        .get(5, TimeUnit.SECONDS)) {
      assertEquals(List.of("a", "b"), rows.map(r -> r.get("label")).collect(Collectors.toList()));
    }

    IndexDefinition unique = IndexDefinition.unique("label");
    tags.removeIndex(unique).get(5, TimeUnit.SECONDS);
    tags.insert(Map.of("label", "a")).get(5, TimeUnit.SECONDS);
    assertEquals(3L, tags.count(new QueryParams()).get(5, TimeUnit.SECONDS));

    tags.createTable(null, true, false).get(5, TimeUnit.SECONDS);
    assertEquals(0L, tags.count(new QueryParams()).get(5, TimeUnit.SECONDS));
    tags.dropTable("tags").get(5, TimeUnit.SECONDS);
    ExecutionException gone = assertThrows(ExecutionException.class,
        () -> tags.count(new QueryParams()).get(5, TimeUnit.SECONDS));
    assertTrue(gone.getCause() instanceof DataAccessException);
  }
}
