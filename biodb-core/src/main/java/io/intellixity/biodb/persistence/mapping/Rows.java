package io.intellixity.biodb.persistence.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class Rows {
  private Rows() {}

  public static Row of(Map<String, ?> values) {
    return new MapRow(values);
  }

  static final class MapRow implements Row {
    private final Map<String, Object> values;

    MapRow(Map<String, ?> values) {
      Objects.requireNonNull(values, "values");
      this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public Object raw(String column) {
      if (!values.containsKey(column)) throw new IllegalArgumentException("Unknown column label: " + column);
      return values.get(column);
    }

    @Override public boolean has(String column) { return values.containsKey(column); }
    @Override public Set<String> columns() { return values.keySet(); }
    @Override public String toString() { return "Row" + values; }
  }
}
