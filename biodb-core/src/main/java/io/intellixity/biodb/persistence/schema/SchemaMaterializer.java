package io.intellixity.biodb.persistence.schema;

import io.intellixity.biodb.persistence.util.SqlIdentifiers;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Turns an abstract {@link TableSchema} into backend DDL. Stateless. */
public final class SchemaMaterializer {
  private SchemaMaterializer() {}

  public static List<ColumnSpec> materialize(TableSchema schema, DbType dbType) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(dbType, "dbType");
    return schema.columns().stream()
        .map(c -> c.isBinary() ? c.withType(dbType.binaryType()) : c)
        .toList();
  }

  public static String columnListDdl(TableSchema schema, DbType dbType) {
    return materialize(schema, dbType).stream()
        .map(ColumnSpec::toDdl)
        .collect(Collectors.joining(", "));
  }

  public static String createTableDdl(String table, TableSchema schema, DbType dbType) {
    SqlIdentifiers.requireTableName(table);
    return "CREATE TABLE " + table + " (" + columnListDdl(schema, dbType) + ")";
  }
}
