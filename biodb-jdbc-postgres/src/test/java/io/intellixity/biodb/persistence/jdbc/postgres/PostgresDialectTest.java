package io.intellixity.biodb.persistence.jdbc.postgres;

import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialects;
import io.intellixity.biodb.persistence.query.QueryOptions;
import io.intellixity.biodb.persistence.schema.DbType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  @Test
  void stagingTableDropsOnCommit() {
    assertEquals("CREATE TEMP TABLE biodb_stage_1 (accession text) ON COMMIT DROP", d.createStagingTableSql("biodb_stage_1"));
    assertTrue(d.dropStagingTableSql("biodb_stage_1").isEmpty());
  }

  @Test
  void pagingBindsOffsetBeforeLimit() {
    QueryOptions o = QueryOptions.none().withWhere("organism = ?", "human").withOffset(10).withLimit(5);

    SqlStatement direct = d.renderDirectLookup("proteins", List.of("P1", "P2"), o);
    assertEquals("SELECT * FROM proteins WHERE proteins.accession IN (?, ?) AND (organism = ?) OFFSET ? LIMIT ?", direct.sql());
    assertEquals(List.of("P1", "P2", "human", 10, 5), direct.params());

    SqlStatement staged = d.renderStagedLookup("proteins", "st", o);
    assertEquals("SELECT * FROM proteins INNER JOIN st ON proteins.accession = st.accession"
        + " WHERE organism = ? OFFSET ? LIMIT ?", staged.sql());
    assertEquals(List.of("human", 10, 5), staged.params());
  }

  @Test
  void escapesCopyTextSpecials() {
    assertEquals("P12345", PostgresDialect.escapeCopyText("P12345"));
    assertEquals("a\\\\b\\tc\\nd\\re", PostgresDialect.escapeCopyText("a\\b\tc\nd\re"));
  }

  @Test
  void spoolsOneAccessionPerLine() throws Exception {
    Path file = PostgresDialect.writeStagingFile(new LinkedHashSet<>(List.of("A1", "A2", "odd\tone")));
    try {
      assertEquals(List.of("A1", "A2", "odd\\tone"), Files.readAllLines(file, StandardCharsets.UTF_8));
    } finally {
      Files.deleteIfExists(file);
    }
  }

  @Test
  void discoveredThroughFactories() {
    assertInstanceOf(PostgresDialect.class, JdbcDialects.forType(DbType.POSTGRES));
    assertEquals("postgres", d.id());
  }
}
