package io.intellixity.biodb.persistence.jdbc.store;

import io.intellixity.biodb.persistence.codec.CodecRegistry;
import io.intellixity.biodb.persistence.codec.SequenceCodec;
import io.intellixity.biodb.persistence.error.BiodbException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.QueryException;
import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.biodb.persistence.jdbc.lookup.AccessionLookup;
import io.intellixity.biodb.persistence.jdbc.lookup.LookupPlanner;
import io.intellixity.biodb.persistence.jdbc.write.BulkWriter;
import io.intellixity.biodb.persistence.query.QueryOptions;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.SchemaMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Entry point for storing and retrieving sequence records.\n
 *
 * Every operation names the target table and the record type tag; the tag selects the codec
 * that shapes rows. Calls made inside {@link #inTransaction(Supplier)} share its transaction.\n
 */
public final class SequenceStore implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SequenceStore.class);

  private final SqlSession session;
  private final JdbcDialect dialect;
  private final CodecRegistry codecs;
  private final BulkWriter writer;
  private final AccessionLookup lookup;
  private final AutoCloseable owned;

  public SequenceStore(SqlSession session, JdbcDialect dialect, CodecRegistry codecs) {
    this(session, dialect, codecs, new LookupPlanner(), null);
  }

  /** @param owned closed by {@link #close()}, typically the connection pool; may be null */
  public SequenceStore(SqlSession session, JdbcDialect dialect, CodecRegistry codecs,
                       LookupPlanner planner, AutoCloseable owned) {
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.codecs = Objects.requireNonNull(codecs, "codecs");
    this.writer = new BulkWriter(session);
    this.lookup = new AccessionLookup(session, dialect, Objects.requireNonNull(planner, "planner"));
    this.owned = owned;
  }

  public SqlSession session() { return session; }
  public JdbcDialect dialect() { return dialect; }
  public CodecRegistry codecs() { return codecs; }

  /** Creates {@code table} with the materialized schema of {@code tag}'s codec. */
  public void createTable(String table, String tag) {
    SequenceCodec codec = codecs.get(tag);
    String ddl = SchemaMaterializer.createTableDdl(table, codec.schema(), dialect.dbType());
    try {
      session.executeDdl(ddl);
    } catch (QueryException e) {
      throw new QueryException("create table failed", OperationContext.of("create-table", table, tag), e);
    }
    log.debug("biodb.store created table={} tag={}", table, tag);
  }

  /** @return rows inserted */
  public long insertSequences(String table, String tag, Collection<SequenceRecord> records) {
    return writer.insertAll(table, codecs.get(tag), records);
  }

  /** Same as {@link #insertSequences} but returns the rows as written. */
  public List<Map<String, Object>> insertSequencesReturning(String table, String tag, Collection<SequenceRecord> records) {
    return writer.insertAllReturning(table, codecs.get(tag), records);
  }

  public List<SequenceRecord> getSequences(String table, String tag, Collection<String> accessions) {
    return getSequences(table, tag, accessions, QueryOptions.none());
  }

  public List<SequenceRecord> getSequences(String table, String tag, Collection<String> accessions, QueryOptions options) {
    return lookup.fetch(table, codecs.get(tag), accessions, options);
  }

  /**
   * Streams the matching records into {@code reducer} without materializing them.\n
   * The stream is only valid inside the reducer.
   */
  public <R> R getSequences(String table, String tag, Collection<String> accessions, QueryOptions options,
                            Function<Stream<SequenceRecord>, R> reducer) {
    return lookup.fold(table, codecs.get(tag), accessions, options, reducer);
  }

  /** Runs a caller-written query verbatim and decodes its rows with {@code tag}'s codec. */
  public List<SequenceRecord> querySequences(SqlStatement query, String tag) {
    return lookup.query(query, codecs.get(tag));
  }

  public <R> R querySequences(SqlStatement query, String tag, Function<Stream<SequenceRecord>, R> reducer) {
    return lookup.query(query, codecs.get(tag), reducer);
  }

  /** Arbitrary non-query command; returns the affected row count. */
  public long execute(SqlStatement command) {
    Objects.requireNonNull(command, "command");
    try {
      return session.executeDml(command);
    } catch (QueryException e) {
      throw new QueryException("command failed", OperationContext.of("command", null, null), e);
    }
  }

  public <T> T inTransaction(Supplier<T> work) {
    return session.inTransaction(work);
  }

  @Override
  public void close() {
    if (owned == null) return;
    try {
      owned.close();
    } catch (Exception e) {
      throw new BiodbException("Failed to close store", OperationContext.of("close", null, null), e);
    }
  }
}
