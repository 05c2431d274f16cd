package io.intellixity.biodb.persistence.jdbc.sqlite;

import io.intellixity.biodb.persistence.jdbc.dialect.DialectProvider;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialect;

public final class SqliteDialectProvider implements DialectProvider {
  @Override
  public JdbcDialect dialect() {
    return new SqliteDialect();
  }
}
