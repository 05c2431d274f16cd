package io.intellixity.biodb.persistence.jdbc;

import io.intellixity.biodb.persistence.mapping.Row;

@FunctionalInterface
public interface RowMapper<T> {
  T map(Row row);
}
