package io.intellixity.biodb.persistence.jdbc.store;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.biodb.persistence.codec.CodecRegistry;
import io.intellixity.biodb.persistence.config.DbSpec;
import io.intellixity.biodb.persistence.jdbc.JdbcSession;
import io.intellixity.biodb.persistence.jdbc.bind.JdbcBinders;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialects;
import io.intellixity.biodb.persistence.jdbc.lookup.LookupPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires a pooled {@link SequenceStore} from connection parameters.\n
 *
 * The dialect and codecs are discovered from {@code META-INF/biodb.factories}. Closing the store
 * closes the pool.\n
 */
public final class BiodbStores {
  private static final Logger log = LoggerFactory.getLogger(BiodbStores.class);

  private BiodbStores() {}

  public static SequenceStore open(DbSpec spec) {
    return open(spec, CodecRegistry.discovered(), new LookupPlanner());
  }

  public static SequenceStore open(DbSpec spec, CodecRegistry codecs, LookupPlanner planner) {
    Objects.requireNonNull(spec, "spec");
    JdbcDialect dialect = JdbcDialects.forType(spec.dbType());
    HikariDataSource ds = BiodbDataSources.create(spec);
    JdbcSession session = new JdbcSession(ds, JdbcBinders.withDialectBinders(dialect.binders()),
        JdbcSession.DEFAULT_FETCH_SIZE, JdbcSession.DEFAULT_BATCH_SIZE);
    log.info("biodb.store opened dbtype={} dbname={} codecs={}", spec.dbType().id(), spec.dbname(), codecs.tags());
    return new SequenceStore(session, dialect, codecs, planner, ds);
  }
}
