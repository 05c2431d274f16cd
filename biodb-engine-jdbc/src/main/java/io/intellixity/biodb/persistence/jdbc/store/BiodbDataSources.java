package io.intellixity.biodb.persistence.jdbc.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.biodb.persistence.config.DbSpec;
import io.intellixity.biodb.persistence.error.ConfigException;
import io.intellixity.biodb.persistence.error.OperationContext;

import java.util.Objects;

/** Pooled {@link javax.sql.DataSource}s built from a {@link DbSpec}. */
public final class BiodbDataSources {
  public static final int DEFAULT_POOL_SIZE = 10;

  private BiodbDataSources() {}

  public static String jdbcUrl(DbSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return switch (spec.dbType()) {
      case POSTGRES -> "jdbc:postgresql://" + spec.domain() + ":" + spec.port() + "/" + spec.dbname();
      case SQLITE -> "jdbc:sqlite:" + spec.dbname();
    };
  }

  public static HikariDataSource create(DbSpec spec) {
    return create(spec, DEFAULT_POOL_SIZE);
  }

  public static HikariDataSource create(DbSpec spec, int maxPoolSize) {
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbcUrl(spec));
    if (spec.user() != null) hc.setUsername(spec.user());
    if (spec.password() != null) hc.setPassword(spec.password());
    hc.setMaximumPoolSize(maxPoolSize);
    hc.setPoolName("biodb-" + spec.dbType().id());
    try {
      return new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to open pool for " + spec, OperationContext.of("open", null, null), e);
    }
  }
}
