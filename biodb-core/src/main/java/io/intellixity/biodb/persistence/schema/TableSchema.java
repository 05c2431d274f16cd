package io.intellixity.biodb.persistence.schema;

import io.intellixity.biodb.persistence.record.SequenceRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered column list of a record collection table.\n
 *
 * Exactly one column is named {@code accession} and it is the primary key.\n
 */
public record TableSchema(List<ColumnSpec> columns) {
  public TableSchema {
    if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("schema has no columns");
    columns = List.copyOf(columns);

    int accession = 0;
    List<String> seen = new ArrayList<>();
    for (ColumnSpec c : columns) {
      if (seen.contains(c.name())) throw new IllegalArgumentException("Duplicate column '" + c.name() + "'");
      seen.add(c.name());
      if (SequenceRecord.ACCESSION.equals(c.name())) {
        accession++;
        if (!c.isPrimaryKey()) throw new IllegalArgumentException("Column 'accession' must be declared PRIMARY KEY");
      }
    }
    if (accession != 1) throw new IllegalArgumentException("Schema must contain exactly one 'accession' column");
  }

  public static TableSchema of(ColumnSpec... columns) {
    return new TableSchema(List.of(columns));
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnSpec::name).toList();
  }
}
