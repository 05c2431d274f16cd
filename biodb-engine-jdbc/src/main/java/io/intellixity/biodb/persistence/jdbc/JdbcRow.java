package io.intellixity.biodb.persistence.jdbc;

import io.intellixity.biodb.persistence.error.QueryException;
import io.intellixity.biodb.persistence.mapping.Row;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link Row} view over the current position of a {@link ResultSet}.\n
 *
 * One instance serves the whole cursor. When a label occurs twice (the staging join under
 * {@code SELECT *}) the first column wins. Labels match exactly first, then ignoring case.\n
 */
final class JdbcRow implements Row {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;
  private Map<String, Integer> foldedIndex;

  JdbcRow(ResultSet rs) {
    this.rs = rs;
  }

  @Override
  public Object raw(String column) {
    Integer idx = lookup(column);
    if (idx == null) throw new IllegalArgumentException("Unknown column label: " + column);
    try {
      return rs.getObject(idx);
    } catch (SQLException e) {
      throw new QueryException("Failed to read column '" + column + "'", null, e);
    }
  }

  @Override
  public boolean has(String column) {
    return lookup(column) != null;
  }

  private Integer lookup(String column) {
    Integer idx = index().get(column);
    return idx != null ? idx : foldedIndex.get(column);
  }

  @Override
  public Set<String> columns() {
    return Collections.unmodifiableSet(index().keySet());
  }

  private Map<String, Integer> index() {
    if (colIndex == null) {
      Map<String, Integer> m = new LinkedHashMap<>();
      Map<String, Integer> folded = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      try {
        ResultSetMetaData md = rs.getMetaData();
        for (int i = 1; i <= md.getColumnCount(); i++) {
          String label = md.getColumnLabel(i);
          m.putIfAbsent(label, i);
          folded.putIfAbsent(label, i);
        }
      } catch (SQLException e) {
        throw new QueryException("Failed to read result metadata", null, e);
      }
      foldedIndex = folded;
      colIndex = m;
    }
    return colIndex;
  }
}
