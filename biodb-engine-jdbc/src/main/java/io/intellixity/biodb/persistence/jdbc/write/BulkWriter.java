package io.intellixity.biodb.persistence.jdbc.write;

import io.intellixity.biodb.persistence.codec.SequenceCodec;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.error.QueryException;
import io.intellixity.biodb.persistence.error.WriteException;
import io.intellixity.biodb.persistence.jdbc.SqlSession;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.util.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes records through their codec and inserts them as one transactional batch.\n
 *
 * Every record is encoded before any SQL runs, so an encoding failure writes nothing.\n
 */
public final class BulkWriter {
  private static final Logger log = LoggerFactory.getLogger(BulkWriter.class);

  private final SqlSession session;

  public BulkWriter(SqlSession session) {
    this.session = Objects.requireNonNull(session, "session");
  }

  /** @return rows inserted */
  public long insertAll(String table, SequenceCodec codec, Collection<SequenceRecord> records) {
    List<Map<String, Object>> rows = encode(table, codec, records);
    return rows.isEmpty() ? 0 : write(table, codec, rows);
  }

  /** @return the encoded rows as written */
  public List<Map<String, Object>> insertAllReturning(String table, SequenceCodec codec, Collection<SequenceRecord> records) {
    List<Map<String, Object>> rows = encode(table, codec, records);
    if (!rows.isEmpty()) write(table, codec, rows);
    return rows;
  }

  private List<Map<String, Object>> encode(String table, SequenceCodec codec, Collection<SequenceRecord> records) {
    SqlIdentifiers.requireTableName(table);
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(records, "records");
    if (records.isEmpty()) return List.of();
    List<Map<String, Object>> encoded = codec.encodeAll(records);
    if (encoded == null) {
      throw new EncodeException("Codec returned no rows", OperationContext.of("insert", table, codec.tag()));
    }
    List<Map<String, Object>> rows = new ArrayList<>(encoded.size());
    for (Map<String, Object> row : encoded) {
      if (row == null) {
        throw new EncodeException("Codec returned a null row at index " + rows.size(),
            OperationContext.of("insert", table, codec.tag()));
      }
      rows.add(row);
    }
    return List.copyOf(rows);
  }

  private long write(String table, SequenceCodec codec, List<Map<String, Object>> rows) {
    OperationContext ctx = OperationContext.of("insert", table, codec.tag());
    long start = System.nanoTime();
    try {
      long n = session.inTransaction(() -> session.insertMulti(table, rows));
      log.debug("biodb.write table={} tag={} rows={} tookMs={}", table, codec.tag(), n, (System.nanoTime() - start) / 1_000_000);
      return n;
    } catch (QueryException e) {
      Throwable root = e.getCause() == null ? e : e.getCause();
      throw new WriteException("Bulk insert of " + rows.size() + " rows failed: " + root.getMessage(), ctx, e);
    }
  }
}
