package io.intellixity.biodb.persistence.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TableSchemaTest {
  @Test
  void requiresExactlyOneAccessionPrimaryKey() {
    assertThrows(IllegalArgumentException.class, () -> TableSchema.of(ColumnSpec.of("id", "text", "PRIMARY KEY")));
    assertThrows(IllegalArgumentException.class, () -> TableSchema.of(ColumnSpec.of("accession", "text")));
    assertThrows(IllegalArgumentException.class, () -> TableSchema.of(
        ColumnSpec.of("accession", "text", "PRIMARY KEY"),
        ColumnSpec.of("accession", "text", "PRIMARY KEY")));
  }

  @Test
  void primaryKeyMatchIsCaseInsensitive() {
    TableSchema s = TableSchema.of(ColumnSpec.of("accession", "text", "primary key"), ColumnSpec.of("x", "integer"));
    assertEquals(2, s.columns().size());
  }

  @Test
  void dbTypeParsesAliases() {
    assertEquals(DbType.POSTGRES, DbType.fromId("PostgreSQL"));
    assertEquals(DbType.SQLITE, DbType.fromId(" sqlite "));
    assertThrows(IllegalArgumentException.class, () -> DbType.fromId("oracle"));
  }
}
