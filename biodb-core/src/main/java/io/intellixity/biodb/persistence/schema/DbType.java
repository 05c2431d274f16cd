package io.intellixity.biodb.persistence.schema;

import java.util.Locale;

/** Supported relational backends. */
public enum DbType {
  POSTGRES("postgres", "bytea"),
  SQLITE("sqlite", "blob");

  private final String id;
  private final String binaryType;

  DbType(String id, String binaryType) {
    this.id = id;
    this.binaryType = binaryType;
  }

  public String id() { return id; }

  /** Native column type substituted for {@link ColumnSpec#BINARY}. */
  public String binaryType() { return binaryType; }

  /** Accepts {@code postgres}, {@code postgresql} and {@code sqlite}, case-insensitive. */
  public static DbType fromId(String id) {
    if (id == null) throw new IllegalArgumentException("dbtype is required");
    String v = id.trim().toLowerCase(Locale.ROOT);
    if (v.equals("postgresql")) return POSTGRES;
    for (DbType t : values()) {
      if (t.id.equals(v)) return t;
    }
    throw new IllegalArgumentException("Unsupported dbtype: " + id);
  }
}
