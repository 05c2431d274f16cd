package io.intellixity.biodb.persistence.util;

import java.util.regex.Pattern;

/**
 * Validation of identifiers spliced into generated SQL.\n
 *
 * Covers the table and column names the layer renders itself. Raw join/where/order text is
 * passed through unchecked.\n
 */
public final class SqlIdentifiers {
  // optional schema qualifier
  private static final Pattern TABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
  private static final Pattern COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private SqlIdentifiers() {}

  public static String requireColumnName(String column) {
    if (column == null || !COLUMN.matcher(column).matches()) {
      throw new IllegalArgumentException("Invalid column name: " + column);
    }
    return column;
  }

  public static String requireTableName(String table) {
    if (table == null || !TABLE.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + table);
    }
    return table;
  }
}
