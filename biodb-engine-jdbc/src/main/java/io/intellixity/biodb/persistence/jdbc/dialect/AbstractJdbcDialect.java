package io.intellixity.biodb.persistence.jdbc.dialect;

import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.query.QueryOptions;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic lookup rendering shared by the JDBC backends.\n
 *
 * Both lookup shapes go through the same pipeline: projection, join, accession condition,
 * where, order, paging. Backends override the paging clause and the staging hooks.\n
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {
  private static final String ACC = SequenceRecord.ACCESSION;

  @Override
  public final SqlStatement renderDirectLookup(String table, List<String> accessions, QueryOptions options) {
    SqlIdentifiers.requireTableName(table);
    if (accessions == null || accessions.isEmpty()) {
      throw new IllegalArgumentException("direct lookup needs at least one accession");
    }
    QueryOptions o = options == null ? QueryOptions.none() : options;
    List<Object> params = new ArrayList<>(accessions);

    StringBuilder sql = selectFrom(table, o);
    sql.append(" WHERE ").append(table).append('.').append(ACC).append(" IN (");
    for (int i = 0; i < accessions.size(); i++) {
      if (i > 0) sql.append(", ");
      sql.append('?');
    }
    sql.append(')');
    if (o.hasWhere()) {
      sql.append(" AND (").append(o.where()).append(')');
      params.addAll(o.whereParams());
    }
    appendTail(sql, params, o);
    return new SqlStatement(sql.toString(), params);
  }

  @Override
  public final SqlStatement renderStagedLookup(String table, String stagingTable, QueryOptions options) {
    SqlIdentifiers.requireTableName(table);
    SqlIdentifiers.requireTableName(stagingTable);
    QueryOptions o = options == null ? QueryOptions.none() : options;
    List<Object> params = new ArrayList<>();

    StringBuilder sql = selectFrom(table, o);
    sql.append(" INNER JOIN ").append(stagingTable)
        .append(" ON ").append(table).append('.').append(ACC)
        .append(" = ").append(stagingTable).append('.').append(ACC);
    if (o.hasWhere()) {
      sql.append(" WHERE ").append(o.where());
      params.addAll(o.whereParams());
    }
    appendTail(sql, params, o);
    return new SqlStatement(sql.toString(), params);
  }

  /** Batched row insert of the accessions. */
  @Override
  public void populateStagingTable(SqlSession session, String stagingTable, Collection<String> accessions) {
    List<Map<String, Object>> rows = new ArrayList<>(accessions.size());
    for (String a : accessions) rows.add(Map.of(ACC, a));
    session.insertMulti(stagingTable, rows);
  }

  @Override
  public Optional<String> dropStagingTableSql(String stagingTable) {
    return Optional.empty();
  }

  /**
   * Appends paging. Must add the offset parameter before the limit parameter.\n
   * Default: {@code OFFSET ? LIMIT ?}.
   */
  protected void appendPaging(StringBuilder sql, List<Object> params, Integer offset, Integer limit) {
    if (offset != null) {
      sql.append(" OFFSET ?");
      params.add(offset);
    }
    if (limit != null) {
      sql.append(" LIMIT ?");
      params.add(limit);
    }
  }

  protected String projection(QueryOptions o) {
    return o.select().isEmpty() ? "*" : String.join(", ", o.select());
  }

  private StringBuilder selectFrom(String table, QueryOptions o) {
    StringBuilder sql = new StringBuilder("SELECT ").append(projection(o)).append(" FROM ").append(table);
    if (o.join() != null) sql.append(' ').append(o.join());
    return sql;
  }

  private void appendTail(StringBuilder sql, List<Object> params, QueryOptions o) {
    if (o.order() != null) sql.append(" ORDER BY ").append(o.order());
    appendPaging(sql, params, o.offset(), o.limit());
  }
}
