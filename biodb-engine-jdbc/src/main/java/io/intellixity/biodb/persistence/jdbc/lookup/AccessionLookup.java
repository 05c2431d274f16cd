package io.intellixity.biodb.persistence.jdbc.lookup;

import io.intellixity.biodb.persistence.codec.SequenceCodec;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.QueryException;
import io.intellixity.biodb.persistence.error.StagingException;
import io.intellixity.biodb.persistence.jdbc.RowMapper;
import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.biodb.persistence.query.QueryOptions;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Runs accession lookups and raw queries and decodes the rows through a codec.\n
 *
 * Direct lookups bind the input as given, duplicates included. Staged lookups de-duplicate, then
 * create, fill, join and (where needed) drop the staging table in one transaction; any failure
 * rolls the whole transaction back, so no staging state survives the call.\n
 */
public final class AccessionLookup {
  private static final Logger log = LoggerFactory.getLogger(AccessionLookup.class);

  private final SqlSession session;
  private final JdbcDialect dialect;
  private final LookupPlanner planner;
  private final Supplier<String> stagingNames;

  public AccessionLookup(SqlSession session, JdbcDialect dialect, LookupPlanner planner) {
    this(session, dialect, planner, StagingTableNames::next);
  }

  public AccessionLookup(SqlSession session, JdbcDialect dialect, LookupPlanner planner, Supplier<String> stagingNames) {
    this.session = Objects.requireNonNull(session, "session");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.stagingNames = Objects.requireNonNull(stagingNames, "stagingNames");
  }

  /** Every matching record, decoded eagerly. */
  public List<SequenceRecord> fetch(String table, SequenceCodec codec, Collection<String> accessions, QueryOptions options) {
    return execute(table, codec, accessions, options, (ss, mapper) -> session.query(ss, mapper), () -> List.of());
  }

  /** Folds matching records through {@code reducer} over an open cursor. */
  public <R> R fold(String table, SequenceCodec codec, Collection<String> accessions, QueryOptions options,
                    Function<Stream<SequenceRecord>, R> reducer) {
    Objects.requireNonNull(reducer, "reducer");
    return execute(table, codec, accessions, options,
        (ss, mapper) -> session.query(ss, mapper, reducer),
        () -> reducer.apply(Stream.empty()));
  }

  public List<SequenceRecord> query(SqlStatement rawQuery, SequenceCodec codec) {
    Objects.requireNonNull(rawQuery, "rawQuery");
    OperationContext ctx = OperationContext.of("query", null, codec.tag());
    return translate(ctx, () -> session.query(rawQuery, codec::decode));
  }

  public <R> R query(SqlStatement rawQuery, SequenceCodec codec, Function<Stream<SequenceRecord>, R> reducer) {
    Objects.requireNonNull(rawQuery, "rawQuery");
    Objects.requireNonNull(reducer, "reducer");
    OperationContext ctx = OperationContext.of("query", null, codec.tag());
    return translate(ctx, () -> session.query(rawQuery, codec::decode, reducer));
  }

  private <R> R execute(String table, SequenceCodec codec, Collection<String> accessions, QueryOptions options,
                        Executor<R> exec, Supplier<R> empty) {
    SqlIdentifiers.requireTableName(table);
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(accessions, "accessions");
    QueryOptions o = options == null ? QueryOptions.none() : options;

    List<String> input = new ArrayList<>(accessions.size());
    for (String a : accessions) {
      if (a == null) throw new IllegalArgumentException("accessions must not contain null");
      input.add(a);
    }
    if (input.isEmpty()) return empty.get();

    OperationContext ctx = OperationContext.of("lookup", table, codec.tag());
    RowMapper<SequenceRecord> mapper = codec::decode;
    LookupPlanner.Strategy strategy = planner.choose(input.size());
    log.debug("biodb.lookup strategy={} table={} tag={} accessions={}", strategy, table, codec.tag(), input.size());

    if (strategy == LookupPlanner.Strategy.DIRECT) {
      SqlStatement ss = dialect.renderDirectLookup(table, input, o);
      return translate(ctx, () -> exec.run(ss, mapper));
    }

    return session.inTransaction(() -> {
      String staging = stagingNames.get();
      Set<String> distinct = new LinkedHashSet<>(input);
      stage(staging, distinct, ctx);
      SqlStatement ss = dialect.renderStagedLookup(table, staging, o);
      R result = translate(ctx, () -> exec.run(ss, mapper));
      dialect.dropStagingTableSql(staging).ifPresent(sql -> {
        try {
          session.executeDdl(sql);
        } catch (QueryException e) {
          throw new StagingException("Failed to drop staging table " + staging, ctx, e);
        }
      });
      return result;
    });
  }

  private void stage(String staging, Set<String> distinct, OperationContext ctx) {
    try {
      session.executeDdl(dialect.createStagingTableSql(staging));
      dialect.populateStagingTable(session, staging, distinct);
      log.debug("biodb.lookup staged table={} rows={}", staging, distinct.size());
    } catch (StagingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StagingException("Failed to stage " + distinct.size() + " accessions into " + staging, ctx, e);
    }
  }

  private static <R> R translate(OperationContext ctx, Supplier<R> work) {
    try {
      return work.get();
    } catch (QueryException e) {
      Throwable root = e.getCause() == null ? e : e.getCause();
      throw new QueryException(ctx.operation() + " failed: " + root.getMessage(), ctx, e);
    }
  }

  @FunctionalInterface
  private interface Executor<R> {
    R run(SqlStatement ss, RowMapper<SequenceRecord> mapper);
  }
}
