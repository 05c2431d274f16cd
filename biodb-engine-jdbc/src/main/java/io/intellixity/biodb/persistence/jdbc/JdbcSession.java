package io.intellixity.biodb.persistence.jdbc;

import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.QueryException;
import io.intellixity.biodb.persistence.jdbc.bind.JdbcBinders;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link SqlSession} over a {@link DataSource}.\n
 *
 * The open transaction is bound to the calling thread per session instance. Statements outside
 * a transaction borrow a connection for the single statement and return it right away.\n
 */
public final class JdbcSession implements SqlSession {
  private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

  public static final int DEFAULT_FETCH_SIZE = 500;
  public static final int DEFAULT_BATCH_SIZE = 1000;

  private final DataSource ds;
  private final JdbcBinders binders;
  private final int fetchSize;
  private final int batchSize;
  private final ThreadLocal<Connection> tx = new ThreadLocal<>();

  public JdbcSession(DataSource ds) {
    this(ds, JdbcBinders.defaults(), DEFAULT_FETCH_SIZE, DEFAULT_BATCH_SIZE);
  }

  public JdbcSession(DataSource ds, JdbcBinders binders, int fetchSize, int batchSize) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binders = Objects.requireNonNull(binders, "binders");
    if (fetchSize <= 0) throw new IllegalArgumentException("fetchSize must be > 0");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    this.fetchSize = fetchSize;
    this.batchSize = batchSize;
  }

  public DataSource dataSource() {
    return ds;
  }

  public boolean inTransaction() {
    return tx.get() != null;
  }

  @Override
  public void executeDdl(String sql) {
    SqlStatement ss = SqlStatement.of(sql);
    run("DDL", c -> {
      long start = System.nanoTime();
      debugSql("DDL", ss);
      try (Statement st = c.createStatement()) {
        st.execute(sql);
      }
      debugDone("DDL", ss, 0, System.nanoTime() - start);
      return null;
    });
  }

  @Override
  public long executeDml(SqlStatement ss) {
    return run("DML", c -> {
      long start = System.nanoTime();
      debugSql("DML", ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        binders.bindAll(ps, ss.params());
        long n = ps.executeUpdate();
        debugDone("DML", ss, n, System.nanoTime() - start);
        return n;
      }
    });
  }

  @Override
  public <T> List<T> query(SqlStatement ss, RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return run("SELECT", c -> {
      long start = System.nanoTime();
      debugSql("SELECT", ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        binders.bindAll(ps, ss.params());
        try (ResultSet rs = ps.executeQuery()) {
          List<T> out = new ArrayList<>();
          JdbcRow row = new JdbcRow(rs);
          while (rs.next()) out.add(mapper.map(row));
          debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    });
  }

  @Override
  public <T, R> R query(SqlStatement ss, RowMapper<T> mapper, Function<Stream<T>, R> reducer) {
    Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(reducer, "reducer");
    // Postgres only honours the fetch size with auto-commit off.
    return inTransaction(() -> run("STREAM", c -> {
      long start = System.nanoTime();
      debugSql("STREAM", ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql(), ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
        ps.setFetchSize(fetchSize);
        binders.bindAll(ps, ss.params());
        try (ResultSet rs = ps.executeQuery()) {
          CursorSpliterator<T> cursor = new CursorSpliterator<>(rs, mapper);
          R result;
          try (Stream<T> stream = StreamSupport.stream(cursor, false)) {
            result = reducer.apply(stream);
          }
          debugDone("STREAM", ss, cursor.pulled, System.nanoTime() - start);
          return result;
        }
      }
    }));
  }

  @Override
  public long insertMulti(String table, List<Map<String, Object>> rows) {
    SqlIdentifiers.requireTableName(table);
    Objects.requireNonNull(rows, "rows");
    if (rows.isEmpty()) return 0;

    Map<List<String>, List<Map<String, Object>>> byColumns = new LinkedHashMap<>();
    for (Map<String, Object> r : rows) {
      if (r == null || r.isEmpty()) throw new IllegalArgumentException("insert row must have columns");
      byColumns.computeIfAbsent(List.copyOf(r.keySet()), k -> new ArrayList<>()).add(r);
    }
    return inTransaction(() -> {
      long total = 0;
      for (Map.Entry<List<String>, List<Map<String, Object>>> e : byColumns.entrySet()) {
        total += insertBatch(table, e.getKey(), e.getValue());
      }
      return total;
    });
  }

  private long insertBatch(String table, List<String> columns, List<Map<String, Object>> rows) {
    columns.forEach(SqlIdentifiers::requireColumnName);
    String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    SqlStatement ss = SqlStatement.of(sql);
    return run("INSERT", c -> {
      long start = System.nanoTime();
      debugSql("INSERT", ss);
      long inserted = 0;
      try (PreparedStatement ps = c.prepareStatement(sql)) {
        int pending = 0;
        for (Map<String, Object> r : rows) {
          for (int i = 0; i < columns.size(); i++) {
            binders.bind(ps, i + 1, r.get(columns.get(i)));
          }
          ps.addBatch();
          if (++pending == batchSize) {
            inserted += sum(ps.executeBatch());
            pending = 0;
          }
        }
        if (pending > 0) inserted += sum(ps.executeBatch());
      }
      debugDone("INSERT", ss, inserted, System.nanoTime() - start);
      return inserted;
    });
  }

  private static long sum(int[] counts) {
    long n = 0;
    for (int c : counts) n += (c == Statement.SUCCESS_NO_INFO) ? 1 : Math.max(c, 0);
    return n;
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    if (tx.get() != null) return work.get();

    Connection c = begin();
    tx.set(c);
    try {
      T result = work.get();
      c.commit();
      return result;
    } catch (SQLException e) {
      QueryException failure = new QueryException("Commit failed", OperationContext.of("commit", null, null), e);
      rollback(c, failure);
      throw failure;
    } catch (RuntimeException | Error e) {
      rollback(c, e);
      throw e;
    } finally {
      tx.remove();
      release(c);
    }
  }

  @Override
  public <T> T withConnection(ConnectionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    return run("CONNECTION", callback);
  }

  private <T> T run(String op, ConnectionCallback<T> callback) {
    Connection current = tx.get();
    try {
      if (current != null) return callback.doInConnection(current);
      try (Connection c = ds.getConnection()) {
        return callback.doInConnection(c);
      }
    } catch (SQLException e) {
      throw new QueryException(op + " failed: " + e.getMessage(), OperationContext.of(op, null, null), e);
    } catch (IOException e) {
      throw new QueryException(op + " I/O failed: " + e.getMessage(), OperationContext.of(op, null, null), e);
    }
  }

  private Connection begin() {
    try {
      Connection c = ds.getConnection();
      c.setAutoCommit(false);
      log.debug("biodb.jdbc tx begin");
      return c;
    } catch (SQLException e) {
      throw new QueryException("Failed to begin transaction", OperationContext.of("begin", null, null), e);
    }
  }

  private static void rollback(Connection c, Throwable primary) {
    try {
      c.rollback();
      log.debug("biodb.jdbc tx rollback cause={}", primary.toString());
    } catch (SQLException e) {
      primary.addSuppressed(e);
      log.warn("biodb.jdbc rollback failed", e);
    }
  }

  private static void release(Connection c) {
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("biodb.jdbc failed to release connection", e);
    }
  }

  private static void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("biodb.jdbc op={} sql={} paramCount={}", op, ss.sql(), ss.params().size());
    if (log.isTraceEnabled()) {
      List<String> types = ss.params().stream()
          .map(p -> p == null ? "null" : p.getClass().getSimpleName())
          .toList();
      log.trace("biodb.jdbc op={} paramTypes={}", op, types);
    }
  }

  private static void debugDone(String op, SqlStatement ss, long rows, long nanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("biodb.jdbc op={} done rows={} tookMs={} sql={}", op, rows, nanos / 1_000_000, ss.sql());
  }

  /** Forward-only cursor as a spliterator; maps a row only when the consumer pulls it. */
  static final class CursorSpliterator<T> extends Spliterators.AbstractSpliterator<T> {
    private final ResultSet rs;
    private final JdbcRow row;
    private final RowMapper<T> mapper;
    private long pulled;

    CursorSpliterator(ResultSet rs, RowMapper<T> mapper) {
      super(Long.MAX_VALUE, Spliterator.ORDERED);
      this.rs = rs;
      this.row = new JdbcRow(rs);
      this.mapper = mapper;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
      boolean more;
      try {
        more = rs.next();
      } catch (SQLException e) {
        throw new QueryException("Cursor read failed: " + e.getMessage(), OperationContext.of("STREAM", null, null), e);
      }
      if (!more) return false;
      pulled++;
      action.accept(mapper.map(row));
      return true;
    }
  }
}
