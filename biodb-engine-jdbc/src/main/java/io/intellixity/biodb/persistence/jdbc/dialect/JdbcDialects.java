package io.intellixity.biodb.persistence.jdbc.dialect;

import io.intellixity.biodb.persistence.error.ConfigException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.schema.DbType;
import io.intellixity.biodb.persistence.util.BiodbFactoriesLoader;

import java.util.List;

public final class JdbcDialects {
  private JdbcDialects() {}

  /** First discovered dialect for {@code dbType}. */
  public static JdbcDialect forType(DbType dbType) {
    return forType(dbType, Thread.currentThread().getContextClassLoader());
  }

  public static JdbcDialect forType(DbType dbType, ClassLoader cl) {
    List<DialectProvider> providers = BiodbFactoriesLoader.load(DialectProvider.class, cl);
    for (DialectProvider p : providers) {
      JdbcDialect d = p.dialect();
      if (d.dbType() == dbType) return d;
    }
    throw new ConfigException("No dialect on the classpath for " + dbType + "; add the biodb-jdbc-" + dbType.id() + " module",
        OperationContext.of("dialect-lookup", null, null));
  }
}
