package io.intellixity.biodb.persistence.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.OperationContext;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.ColumnSpec;
import io.intellixity.biodb.persistence.schema.TableSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback codec: the whole record is stored as JSON text in {@code src}.\n
 *
 * Field values must be JSON-native (text, booleans, numbers, lists, string-keyed maps, null);
 * anything else, binary included, fails encoding instead of coming back as a different type.\n
 */
public final class JsonSourceCodec implements SequenceCodec {
  public static final String TAG = CodecRegistry.DEFAULT_TAG;
  public static final String SRC = "src";

  private static final TableSchema SCHEMA = TableSchema.of(
      ColumnSpec.of(SequenceRecord.ACCESSION, "text", "PRIMARY KEY"),
      ColumnSpec.of(SRC, "text", "NOT NULL")
  );
  private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JsonSourceCodec() {
    this(new ObjectMapper());
  }

  public JsonSourceCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override public String tag() { return TAG; }
  @Override public TableSchema schema() { return SCHEMA; }

  @Override
  public Map<String, Object> encode(SequenceRecord record) {
    String accession = CodecSupport.requireAccession(record, TAG);
    CodecSupport.requireJsonValues(record, TAG);
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(SequenceRecord.ACCESSION, accession);
    try {
      row.put(SRC, mapper.writeValueAsString(record.fields()));
    } catch (JsonProcessingException e) {
      throw new EncodeException("Failed to serialize record " + accession, OperationContext.of("encode", null, TAG), e);
    }
    return row;
  }

  @Override
  public SequenceRecord decode(Row row) {
    String src = CodecSupport.requireString(row, SRC, TAG);
    try {
      LinkedHashMap<String, Object> fields = mapper.readValue(src, FIELDS);
      if (fields == null) throw new DecodeException("src is JSON null", OperationContext.of("decode", null, TAG));
      return new SequenceRecord(fields);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Malformed src JSON", OperationContext.of("decode", null, TAG), e);
    }
  }
}
