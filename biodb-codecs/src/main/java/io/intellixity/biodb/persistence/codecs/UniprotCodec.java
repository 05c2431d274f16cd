package io.intellixity.biodb.persistence.codecs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.biodb.persistence.codec.CodecSupport;
import io.intellixity.biodb.persistence.codec.SequenceCodec;
import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.ColumnSpec;
import io.intellixity.biodb.persistence.schema.TableSchema;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * UniProt entries stored as GZIP-compressed JSON in a binary {@code src} column.\n
 *
 * {@code organism} is copied into its own column for filtering; the compressed source stays
 * authoritative on decode.\n
 */
public final class UniprotCodec implements SequenceCodec {
  public static final String TAG = "uniprot";
  public static final String ORGANISM = "organism";
  public static final String SRC = "src";

  private static final TableSchema SCHEMA = TableSchema.of(
      ColumnSpec.of(SequenceRecord.ACCESSION, "text", "PRIMARY KEY"),
      ColumnSpec.of(ORGANISM, "text"),
      ColumnSpec.of(SRC, ColumnSpec.BINARY, "NOT NULL")
  );
  private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

  private final ObjectMapper mapper = new ObjectMapper();

  @Override public String tag() { return TAG; }
  @Override public TableSchema schema() { return SCHEMA; }

  @Override
  public Map<String, Object> encode(SequenceRecord record) {
    String accession = CodecSupport.requireAccession(record, TAG);
    CodecSupport.requireJsonValues(record, TAG);
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(SequenceRecord.ACCESSION, accession);
    row.put(ORGANISM, record.getString(ORGANISM));
    try {
      row.put(SRC, gzip(mapper.writeValueAsBytes(record.fields())));
    } catch (IOException e) {
      throw new EncodeException("Failed to serialize record " + accession, OperationContext.of("encode", null, TAG), e);
    }
    return row;
  }

  @Override
  public SequenceRecord decode(Row row) {
    byte[] src = CodecSupport.requireBytes(row, SRC, TAG);
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(src))) {
      LinkedHashMap<String, Object> fields = mapper.readValue(in, FIELDS);
      if (fields == null) throw new DecodeException("src is JSON null", OperationContext.of("decode", null, TAG));
      return new SequenceRecord(fields);
    } catch (IOException e) {
      throw new DecodeException("Malformed src", OperationContext.of("decode", null, TAG), e);
    }
  }

  private static byte[] gzip(byte[] raw) throws IOException {
    ByteArrayOutputStream bos = new ByteArrayOutputStream(raw.length / 2 + 16);
    try (OutputStream out = new GZIPOutputStream(bos)) {
      out.write(raw);
    }
    return bos.toByteArray();
  }
}
