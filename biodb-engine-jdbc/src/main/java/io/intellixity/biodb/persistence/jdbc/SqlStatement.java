package io.intellixity.biodb.persistence.jdbc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** JDBC SQL text with positional {@code ?} parameters. Parameters may be null. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(String sql, Object... params) {
    return new SqlStatement(sql, params == null ? List.of() : Arrays.asList(params));
  }
}
