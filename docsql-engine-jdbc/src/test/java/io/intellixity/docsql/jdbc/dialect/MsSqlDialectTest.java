package io.intellixity.docsql.jdbc.dialect;

import io.intellixity.docsql.jdbc.SelectPlan;
import io.intellixity.docsql.jdbc.TableRef;
import io.intellixity.docsql.query.SortField;
import io.intellixity.docsql.schema.ColumnType;
import io.intellixity.docsql.schema.FieldDefinition;
import io.intellixity.docsql.schema.IndexDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.docsql.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class MsSqlDialectTest {
  private static final TableRef T = new TableRef("dbo", "people");
  private final MsSqlDialect d = new MsSqlDialect();

  @Test
  void bareLimitIsTop() {
    assertEquals("SELECT TOP (5) * FROM [dbo].[people] WHERE [name] = :b1",
        d.renderSelect(new SelectPlan(T, eq("name", "x"), List.of(), 5, null, false)).sql());
  }

  @Test
  void offsetUsesFetch() {
    assertEquals("SELECT * FROM [dbo].[people] ORDER BY [id] ASC OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY",
        d.renderSelect(new SelectPlan(T, null, List.of(SortField.asc("id")), 5, 10, false)).sql());
    assertTrue(d.requiresOrderByForOffset());
  }

  @Test
  void ddl() {
    assertEquals("[a]]b]", d.quoteIdent("a]b"));
    assertEquals("[id] INT IDENTITY(1,1) PRIMARY KEY", d.autoIncrementPrimaryKey("id"));
    assertEquals("[name] NVARCHAR(40)",
        d.columnDefinition(FieldDefinition.builder("name").length(40).build(), ColumnType.STRING));
    assertEquals("DROP INDEX [people_name_index] ON [dbo].[people]",
        d.renderDropIndex(T, IndexDefinition.on("name")).sql());
  }
}
