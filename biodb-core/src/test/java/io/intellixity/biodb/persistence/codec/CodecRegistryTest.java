package io.intellixity.biodb.persistence.codec;

import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.error.UnknownTypeException;
import io.intellixity.biodb.persistence.mapping.Row;
import io.intellixity.biodb.persistence.mapping.Rows;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.ColumnSpec;
import io.intellixity.biodb.persistence.schema.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CodecRegistryTest {
  static SequenceCodec noteCodec() {
    CodecRegistry r = CodecRegistry.builder()
        .register("note",
            () -> TableSchema.of(ColumnSpec.of("accession", "text", "PRIMARY KEY"), ColumnSpec.of("note", "text")),
            recs -> recs.stream()
                .map(rec -> Map.<String, Object>of("accession", rec.accession(), "note", rec.getString("note")))
                .toList(),
            row -> SequenceRecord.builder(row.string("accession")).with("note", row.string("note")).build())
        .build();
    return r.get("note");
  }

  @Test
  void defaultCodecIsAlwaysPresent() {
    CodecRegistry r = CodecRegistry.defaults();
    assertTrue(r.contains(CodecRegistry.DEFAULT_TAG));
    assertInstanceOf(JsonSourceCodec.class, r.get("default"));
  }

  @Test
  void unknownTagIsRejected() {
    UnknownTypeException ex = assertThrows(UnknownTypeException.class, () -> CodecRegistry.defaults().get("genbank"));
    assertTrue(ex.getMessage().contains("genbank"));
    assertEquals("genbank", ex.context().tag());
  }

  @Test
  void nullTagIsRejected() {
    assertThrows(UnknownTypeException.class, () -> CodecRegistry.defaults().get(null));
  }

  @Test
  void functionCodecRoundTrips() {
    SequenceCodec c = noteCodec();
    SequenceRecord rec = SequenceRecord.builder("N1").with("note", "hello").build();

    Map<String, Object> row = c.encode(rec);
    assertEquals(Map.of("accession", "N1", "note", "hello"), row);
    assertEquals(rec, c.decode(Rows.of(row)));
    assertEquals(List.of("accession", "note"), c.schema().columnNames());
  }

  @Test
  void functionCodecWrapsDecoderFailures() {
    SequenceCodec c = noteCodec();
    Row missing = Rows.of(Map.of("accession", "N1"));
    DecodeException ex = assertThrows(DecodeException.class, () -> c.decode(missing));
    assertEquals("note", ex.context().tag());
  }

  @Test
  void functionCodecWrapsEncoderFailures() {
    CodecRegistry r = CodecRegistry.builder()
        .register("broken",
            () -> TableSchema.of(ColumnSpec.of("accession", "text", "PRIMARY KEY")),
            recs -> { throw new IllegalStateException("boom"); },
            row -> null)
        .build();
    SequenceCodec c = r.get("broken");
    EncodeException ex = assertThrows(EncodeException.class, () -> c.encode(SequenceRecord.builder("X").build()));
    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertThrows(DecodeException.class, () -> c.decode(Rows.of(Map.of("accession", "X"))));
  }

  @Test
  void duplicateTagsFail() {
    CodecRegistry.Builder b = CodecRegistry.builder().register(noteCodec());
    assertThrows(IllegalArgumentException.class, () -> b.register(noteCodec()));
  }

  @Test
  void defaultMayBeReplacedOnce() {
    JsonSourceCodec replacement = new JsonSourceCodec();
    CodecRegistry r = CodecRegistry.builder().register(replacement).build();
    assertSame(replacement, r.get("default"));
    assertThrows(IllegalArgumentException.class,
        () -> CodecRegistry.builder().register(new JsonSourceCodec()).register(new JsonSourceCodec()));
  }

  @Test
  void discoversProvidersFromFactoriesFile() {
    CodecRegistry r = CodecRegistry.discovered();
    assertEquals(List.of("default", "note"), List.copyOf(r.tags()));
  }

  @Test
  void tagsAreImmutable() {
    CodecRegistry r = CodecRegistry.defaults();
    assertThrows(UnsupportedOperationException.class, () -> r.tags().add("x"));
  }
}
