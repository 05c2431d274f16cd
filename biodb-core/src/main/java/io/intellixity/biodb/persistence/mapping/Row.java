package io.intellixity.biodb.persistence.mapping;

import java.util.Set;

/**
 * Read view over one stored row (column label to scalar or binary value).\n
 *
 * Backed either by an open JDBC cursor or by a plain map; decoders must not retain it.\n
 */
public interface Row {
  /** Raw column value. Throws {@link IllegalArgumentException} for unknown labels. */
  Object raw(String column);

  boolean has(String column);

  Set<String> columns();

  default boolean isNull(String column) {
    return raw(column) == null;
  }

  default String string(String column) {
    Object v = raw(column);
    if (v == null) return null;
    if (v instanceof String s) return s;
    return String.valueOf(v);
  }

  default byte[] bytes(String column) {
    Object v = raw(column);
    if (v == null) return null;
    if (v instanceof byte[] b) return b;
    throw new IllegalArgumentException("Not a binary column '" + column + "': " + v.getClass().getName());
  }
}
