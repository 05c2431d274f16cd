package io.intellixity.biodb.persistence.codecs;

import io.intellixity.biodb.persistence.codec.CodecSupport;
import io.intellixity.biodb.persistence.codec.SequenceCodec;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.ColumnSpec;
import io.intellixity.biodb.persistence.schema.TableSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FASTA entries as plain columns, so {@code description} and {@code sequence} can be filtered in SQL.\n
 *
 * Record fields: {@code accession}, {@code description} (optional), {@code sequence}.\n
 */
public final class FastaCodec implements SequenceCodec {
  public static final String TAG = "fasta";
  public static final String DESCRIPTION = "description";
  public static final String SEQUENCE = "sequence";

  private static final TableSchema SCHEMA = TableSchema.of(
      ColumnSpec.of(SequenceRecord.ACCESSION, "text", "PRIMARY KEY"),
      ColumnSpec.of(DESCRIPTION, "text"),
      ColumnSpec.of(SEQUENCE, "text", "NOT NULL")
  );

  @Override public String tag() { return TAG; }
  @Override public TableSchema schema() { return SCHEMA; }

  @Override
  public Map<String, Object> encode(SequenceRecord record) {
    String accession = CodecSupport.requireAccession(record, TAG);
    String sequence = record.getString(SEQUENCE);
    if (sequence == null) {
      throw new EncodeException("Record " + accession + " has no sequence", OperationContext.of("encode", null, TAG));
    }
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(SequenceRecord.ACCESSION, accession);
    row.put(DESCRIPTION, record.getString(DESCRIPTION));
    row.put(SEQUENCE, sequence);
    return row;
  }

  @Override
  public SequenceRecord decode(Row row) {
    SequenceRecord.Builder b = SequenceRecord.builder(CodecSupport.requireString(row, SequenceRecord.ACCESSION, TAG));
    String description = CodecSupport.optionalString(row, DESCRIPTION);
    if (description != null) b.with(DESCRIPTION, description);
    return b.with(SEQUENCE, CodecSupport.requireString(row, SEQUENCE, TAG)).build();
  }
}
