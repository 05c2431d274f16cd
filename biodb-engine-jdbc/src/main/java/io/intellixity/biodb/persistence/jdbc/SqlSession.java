package io.intellixity.biodb.persistence.jdbc;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Parameterized statement executor the persistence layer runs on.\n
 *
 * Statements run on the transaction bound to the calling thread when there is one, otherwise
 * on a fresh auto-commit connection. Failures surface as
 * {@link io.intellixity.biodb.persistence.error.QueryException}.\n
 */
public interface SqlSession {
  void executeDdl(String sql);

  /** @return affected row count */
  long executeDml(SqlStatement statement);

  /** Materializes every mapped row. */
  <T> List<T> query(SqlStatement statement, RowMapper<T> mapper);

  /**
   * Streams mapped rows from a forward-only cursor into {@code reducer} and returns its result.\n
   *
   * The stream is lazy and valid only inside the reducer; the cursor is closed when the
   * reducer returns or throws. Rows the reducer never pulls are never mapped.
   */
  <T, R> R query(SqlStatement statement, RowMapper<T> mapper, Function<Stream<T>, R> reducer);

  /**
   * Multi-row insert as JDBC batches in one transaction.\n
   * Rows may differ in their column sets; each distinct set becomes its own batch.
   *
   * @return rows inserted
   */
  long insertMulti(String table, List<Map<String, Object>> rows);

  /** Runs {@code work} in a transaction, joining the calling thread's open one if present. */
  <T> T inTransaction(Supplier<T> work);

  default void inTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }

  <T> T withConnection(ConnectionCallback<T> callback);
}
