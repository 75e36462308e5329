package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDialectTest {
  private static final TableRef T = TableRef.of("notes");
  private final SqliteDialect d = new SqliteDialect();

  @Test
  void offsetWithoutLimit() {
    assertEquals("SELECT * FROM \"notes\" LIMIT -1 OFFSET 4",
        d.renderSelect(new SelectPlan(T, null, List.of(), null, 4, false)).sql());
  }

  @Test
  void truncateIsADelete() {
    assertEquals("DELETE FROM \"notes\"", d.renderTruncate(T).sql());
  }

  @Test
  void autoIncrementKey() {
    assertEquals("\"id\" INTEGER PRIMARY KEY AUTOINCREMENT", d.autoIncrementPrimaryKey("id"));
  }
}
