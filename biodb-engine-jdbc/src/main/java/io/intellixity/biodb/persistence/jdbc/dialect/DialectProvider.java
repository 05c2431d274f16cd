package io.intellixity.biodb.persistence.jdbc.dialect;

/** Contributes a dialect, discovered via {@code META-INF/biodb.factories}. */
public interface DialectProvider {
  JdbcDialect dialect();
}
