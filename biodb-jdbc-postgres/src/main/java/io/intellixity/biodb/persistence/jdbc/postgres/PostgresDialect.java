package io.intellixity.biodb.persistence.jdbc.postgres;

import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.StagingException;
import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.jdbc.dialect.AbstractJdbcDialect;
import io.intellixity.biodb.persistence.schema.DbType;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;
import org.postgresql.copy.CopyManager;
import org.postgresql.jdbc.PgConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Postgres dialect.\n
 *
 * Staging tables are {@code ON COMMIT DROP} temp tables. They are loaded with
 * {@code COPY ... FROM STDIN} streamed from a spooled temp file (one accession per line, COPY
 * text format), so the load needs no server-side file access.\n
 */
public final class PostgresDialect extends AbstractJdbcDialect {
  private static final Logger log = LoggerFactory.getLogger(PostgresDialect.class);

  @Override
  public DbType dbType() {
    return DbType.POSTGRES;
  }

  @Override
  public String createStagingTableSql(String stagingTable) {
    SqlIdentifiers.requireTableName(stagingTable);
    return "CREATE TEMP TABLE " + stagingTable + " (accession text) ON COMMIT DROP";
  }

  @Override
  public void populateStagingTable(SqlSession session, String stagingTable, Collection<String> accessions) {
    SqlIdentifiers.requireTableName(stagingTable);
    Path file;
    try {
      file = writeStagingFile(accessions);
    } catch (IOException e) {
      throw new StagingException("Failed to spool accessions for " + stagingTable,
          OperationContext.of("stage", stagingTable, null), e);
    }
    try {
      long copied = session.withConnection(c -> {
        PgConnection pg = c.unwrap(PgConnection.class);
        CopyManager copy = new CopyManager(pg);
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
          return copy.copyIn("COPY " + stagingTable + " (accession) FROM STDIN", in);
        }
      });
      log.debug("biodb.postgres copied rows={} into={}", copied, stagingTable);
    } finally {
      deleteQuietly(file);
    }
  }

  /** Accessions in COPY text format, one per line, in iteration order. */
  static Path writeStagingFile(Collection<String> accessions) throws IOException {
    Path file = Files.createTempFile("biodb-stage-", ".tsv");
    try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      for (String a : accessions) {
        w.write(escapeCopyText(a));
        w.write('\n');
      }
    } catch (IOException e) {
      deleteQuietly(file);
      throw e;
    }
    return file;
  }

  static String escapeCopyText(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char ch = value.charAt(i);
      switch (ch) {
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(ch);
      }
    }
    return sb.toString();
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("biodb.postgres could not delete staging file {}", file, e);
    }
  }
}
