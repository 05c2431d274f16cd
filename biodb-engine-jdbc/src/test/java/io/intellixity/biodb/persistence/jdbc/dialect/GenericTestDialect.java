package io.intellixity.biodb.persistence.jdbc.dialect;

import io.intellixity.biodb.persistence.schema.DbType;

import java.util.Optional;

/** Base rendering plus an explicit drop, for engine tests without a backend module. */
public final class GenericTestDialect extends AbstractJdbcDialect {
  @Override
  public DbType dbType() {
    return DbType.SQLITE;
  }

  @Override
  public String createStagingTableSql(String stagingTable) {
    return "CREATE TEMP TABLE " + stagingTable + " (accession text)";
  }

  @Override
  public Optional<String> dropStagingTableSql(String stagingTable) {
    return Optional.of("DROP TABLE " + stagingTable);
  }
}
