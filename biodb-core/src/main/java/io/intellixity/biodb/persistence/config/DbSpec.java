package io.intellixity.biodb.persistence.config;

import io.intellixity.biodb.persistence.error.ConfigException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.schema.DbType;

import java.util.Properties;

/**
 * Connection parameters of one database.\n
 *
 * {@code dbname} is the database name for Postgres and the file path for SQLite. Postgres also
 * needs {@code user} and {@code password}. {@code port} defaults to {@value #DEFAULT_PORT} and
 * {@code domain} to {@value #DEFAULT_DOMAIN}; both are ignored for SQLite.\n
 */
public record DbSpec(String dbname, DbType dbType, String user, String password, String port, String domain) {
  public static final String DEFAULT_PORT = "5432";
  public static final String DEFAULT_DOMAIN = "127.0.0.1";
  public static final String PREFIX = "biodb.";

  public DbSpec {
    OperationContext ctx = OperationContext.of("db-spec", null, null);
    if (dbType == null) throw new ConfigException("dbtype is required", ctx);
    if (dbname == null || dbname.isBlank()) throw new ConfigException("dbname is required", ctx);
    if (dbType == DbType.POSTGRES && (user == null || password == null)) {
      throw new ConfigException("postgres requires both user and password", ctx);
    }
    port = (port == null || port.isBlank()) ? DEFAULT_PORT : port.trim();
    domain = (domain == null || domain.isBlank()) ? DEFAULT_DOMAIN : domain.trim();
  }

  public static DbSpec sqlite(String file) {
    return new DbSpec(file, DbType.SQLITE, null, null, null, null);
  }

  public static DbSpec postgres(String dbname, String user, String password) {
    return new DbSpec(dbname, DbType.POSTGRES, user, password, null, null);
  }

  public DbSpec withPort(String p) {
    return new DbSpec(dbname, dbType, user, password, p, domain);
  }

  public DbSpec withDomain(String d) {
    return new DbSpec(dbname, dbType, user, password, port, d);
  }

  /** Reads {@code biodb.dbname}, {@code biodb.dbtype}, {@code biodb.user}, {@code biodb.password}, {@code biodb.port}, {@code biodb.domain}. */
  public static DbSpec fromProperties(Properties p) {
    if (p == null) throw new ConfigException("properties are required");
    String type = p.getProperty(PREFIX + "dbtype");
    DbType dbType;
    try {
      dbType = DbType.fromId(type);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(e.getMessage(), OperationContext.of("db-spec", null, null), e);
    }
    return new DbSpec(
        p.getProperty(PREFIX + "dbname"),
        dbType,
        p.getProperty(PREFIX + "user"),
        p.getProperty(PREFIX + "password"),
        p.getProperty(PREFIX + "port"),
        p.getProperty(PREFIX + "domain"));
  }

  @Override
  public String toString() {
    return "DbSpec{dbname=" + dbname + ", dbType=" + dbType + ", user=" + user
        + ", password=" + (password == null ? "null" : "****") + ", port=" + port + ", domain=" + domain + "}";
  }
}
