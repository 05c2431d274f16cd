package io.intellixity.biodb.persistence.jdbc.postgres;

import io.intellixity.biodb.persistence.jdbc.dialect.DialectProvider;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialect;

public final class PostgresDialectProvider implements DialectProvider {
  @Override
  public JdbcDialect dialect() {
    return new PostgresDialect();
  }
}
