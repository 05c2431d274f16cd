package io.intellixity.biodb.persistence.codec;

import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.FieldValues;
import io.intellixity.biodb.persistence.record.SequenceRecord;

/** Shared checks for codec implementations. */
public final class CodecSupport {
  private CodecSupport() {}

  public static String requireAccession(SequenceRecord record, String tag) {
    if (record == null) throw new EncodeException("Record is null", OperationContext.of("encode", null, tag));
    String acc = record.accession();
    if (acc == null || acc.isBlank()) {
      throw new EncodeException("Record has no accession", OperationContext.of("encode", null, tag));
    }
    return acc;
  }

  /** For codecs that store the record as JSON: every value must come back unchanged from JSON text. */
  public static void requireJsonValues(SequenceRecord record, String tag) {
    String bad = FieldValues.firstNonJsonValue(record.fields());
    if (bad != null) {
      throw new EncodeException("Record " + record.accession() + " has a value JSON cannot round-trip: " + bad,
          OperationContext.of("encode", null, tag));
    }
  }

  public static String requireString(Row row, String column, String tag) {
    Object v = requireColumn(row, column, tag);
    return v instanceof String s ? s : String.valueOf(v);
  }

  public static byte[] requireBytes(Row row, String column, String tag) {
    Object v = requireColumn(row, column, tag);
    if (v instanceof byte[] b) return b;
    throw new DecodeException("Column '" + column + "' is not binary: " + v.getClass().getName(),
        OperationContext.of("decode", null, tag));
  }

  public static String optionalString(Row row, String column) {
    return row.has(column) ? row.string(column) : null;
  }

  private static Object requireColumn(Row row, String column, String tag) {
    if (!row.has(column)) {
      throw new DecodeException("Missing column '" + column + "'", OperationContext.of("decode", null, tag));
    }
    Object v = row.raw(column);
    if (v == null) {
      throw new DecodeException("Column '" + column + "' is null", OperationContext.of("decode", null, tag));
    }
    return v;
  }
}
