package io.intellixity.biodb.persistence.jdbc.sqlite;

import io.intellixity.biodb.persistence.jdbc.dialect.AbstractJdbcDialect;
import io.intellixity.biodb.persistence.schema.DbType;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;

import java.util.List;
import java.util.Optional;

/**
 * SQLite dialect.\n
 *
 * Temp tables live as long as the connection, so the staging table is dropped explicitly before
 * the lookup commits. It is filled with the batched row insert of the base class.\n
 */
public final class SqliteDialect extends AbstractJdbcDialect {
  @Override
  public DbType dbType() {
    return DbType.SQLITE;
  }

  @Override
  public String createStagingTableSql(String stagingTable) {
    SqlIdentifiers.requireTableName(stagingTable);
    return "CREATE TEMP TABLE " + stagingTable + " (accession text)";
  }

  @Override
  public Optional<String> dropStagingTableSql(String stagingTable) {
    SqlIdentifiers.requireTableName(stagingTable);
    return Optional.of("DROP TABLE " + stagingTable);
  }

  /** {@code LIMIT offset, count} keeps offset bound before limit; a bare OFFSET needs {@code LIMIT -1}. */
  @Override
  protected void appendPaging(StringBuilder sql, List<Object> params, Integer offset, Integer limit) {
    if (offset != null && limit != null) {
      sql.append(" LIMIT ?, ?");
      params.add(offset);
      params.add(limit);
    } else if (offset != null) {
      sql.append(" LIMIT -1 OFFSET ?");
      params.add(offset);
    } else if (limit != null) {
      sql.append(" LIMIT ?");
      params.add(limit);
    }
  }
}
