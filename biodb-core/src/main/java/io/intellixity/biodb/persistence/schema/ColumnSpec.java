package io.intellixity.biodb.persistence.schema;

import java.util.Objects;

/**
 * One column of a codec's table schema.\n
 *
 * {@code type} is backend SQL text or the {@link #BINARY} placeholder, which the
 * {@link SchemaMaterializer} swaps for the backend's binary type.\n
 */
public record ColumnSpec(String name, String type, String constraints) {
  public static final String BINARY = "binary";

  public ColumnSpec {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("column name is required");
    if (type == null || type.isBlank()) throw new IllegalArgumentException("column type is required for '" + name + "'");
    constraints = constraints == null ? "" : constraints.trim();
  }

  public static ColumnSpec of(String name, String type) {
    return new ColumnSpec(name, type, "");
  }

  public static ColumnSpec of(String name, String type, String constraints) {
    return new ColumnSpec(name, type, constraints);
  }

  public boolean isBinary() {
    return BINARY.equalsIgnoreCase(type);
  }

  public boolean isPrimaryKey() {
    return constraints.toUpperCase(java.util.Locale.ROOT).contains("PRIMARY KEY");
  }

  public ColumnSpec withType(String newType) {
    return Objects.equals(type, newType) ? this : new ColumnSpec(name, newType, constraints);
  }

  /** {@code name type [constraints]} */
  public String toDdl() {
    return constraints.isEmpty() ? name + " " + type : name + " " + type + " " + constraints;
  }
}
