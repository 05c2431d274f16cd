package io.intellixity.biodb.persistence.jdbc.dialect;

import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.jdbc.bind.JdbcBinder;
import io.intellixity.biodb.persistence.query.QueryOptions;
import io.intellixity.biodb.persistence.schema.DbType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Backend specifics of accession lookups: SQL rendering, paging syntax and the staging-table
 * lifecycle.\n
 *
 * Rendered statements bind in the fixed order: accessions (direct lookups only), where params,
 * offset, limit.\n
 */
public interface JdbcDialect {
  DbType dbType();

  default String id() {
    return dbType().id();
  }

  /** {@code ... WHERE <table>.accession IN (?, ...)}, one placeholder per accession, duplicates kept. */
  SqlStatement renderDirectLookup(String table, List<String> accessions, QueryOptions options);

  /** {@code ... INNER JOIN <staging> ON <table>.accession = <staging>.accession}. */
  SqlStatement renderStagedLookup(String table, String stagingTable, QueryOptions options);

  String createStagingTableSql(String stagingTable);

  /** Loads already de-duplicated accessions into the staging table. Runs inside the lookup transaction. */
  void populateStagingTable(SqlSession session, String stagingTable, Collection<String> accessions);

  /** Explicit drop for backends whose temp tables outlive the transaction. */
  Optional<String> dropStagingTableSql(String stagingTable);

  /** Evaluated before the base JDBC binders. */
  default List<JdbcBinder> binders() {
    return List.of();
  }
}
