package io.intellixity.biodb.persistence.codec;

import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.TableSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Per record type mapping between {@link SequenceRecord}s and table rows.\n
 *
 * Implementations must be stateless and thread-safe: one instance serves every call for its tag.\n
 */
public interface SequenceCodec {
  String tag();

  TableSchema schema();

  /**
   * Encodes one record into a column map whose keys are schema column names.\n
   * Throws {@link io.intellixity.biodb.persistence.error.EncodeException} when the record cannot be stored.
   */
  Map<String, Object> encode(SequenceRecord record);

  /** Batch form used by bulk writes. Output order follows the input. */
  default List<Map<String, Object>> encodeAll(Collection<SequenceRecord> records) {
    List<Map<String, Object>> out = new ArrayList<>(records.size());
    for (SequenceRecord r : records) out.add(encode(r));
    return out;
  }

  /**
   * Rebuilds a record from a stored row.\n
   * Throws {@link io.intellixity.biodb.persistence.error.DecodeException} when required columns are
   * absent or malformed.
   */
  SequenceRecord decode(Row row);
}
