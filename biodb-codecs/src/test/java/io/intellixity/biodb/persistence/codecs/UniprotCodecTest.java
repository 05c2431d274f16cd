package io.intellixity.biodb.persistence.codecs;

import io.intellixity.biodb.persistence.codec.CodecRegistry;
import io.intellixity.biodb.persistence.error.DecodeException;
import io.intellixity.biodb.persistence.error.EncodeException;
import io.intellixity.biodb.persistence.mapping.Rows;
import io.intellixity.biodb.persistence.record.SequenceRecord;
import io.intellixity.biodb.persistence.schema.DbType;
import io.intellixity.biodb.persistence.schema.SchemaMaterializer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UniprotCodecTest {
  private final UniprotCodec codec = new UniprotCodec();

  @Test
  void compressesSourceAndCopiesOrganism() {
    SequenceRecord r = SequenceRecord.builder("P69905")
        .with("organism", "Homo sapiens")
        .with("sequence", "MVLSPADKTNVKAAWGKVGAHAGEYGAEALERMFLSFPTTKTYFPHF")
        .with("keywords", List.of("Heme", "Oxygen transport"))
        .build();
    Map<String, Object> row = codec.encode(r);

    assertEquals("Homo sapiens", row.get("organism"));
    byte[] src = (byte[]) row.get("src");
    assertEquals((byte) 0x1f, src[0]);
    assertEquals((byte) 0x8b, src[1]);
    assertEquals(r, codec.decode(Rows.of(row)));
  }

  @Test
  void numericFieldsRoundTripAndBinaryFieldsAreRejected() {
    SequenceRecord r = SequenceRecord.builder("P69905").with("organism", "Homo sapiens").with("length", 142L).build();
    assertEquals(r, codec.decode(Rows.of(codec.encode(r))));

    EncodeException ex = assertThrows(EncodeException.class,
        () -> codec.encode(r.with("raw", new byte[]{1, 2})));
    assertTrue(ex.getMessage().contains("tag=uniprot"));
  }

  @Test
  void rejectsNonBinaryOrCorruptSource() {
    assertThrows(DecodeException.class, () -> codec.decode(Rows.of(Map.of("accession", "P1", "src", "text"))));
    assertThrows(DecodeException.class, () -> codec.decode(Rows.of(Map.of("accession", "P1", "src", new byte[]{1, 2, 3}))));
  }

  @Test
  void binaryColumnMaterializesPerBackend() {
    assertTrue(SchemaMaterializer.columnListDdl(codec.schema(), DbType.POSTGRES).contains("src bytea NOT NULL"));
    assertTrue(SchemaMaterializer.columnListDdl(codec.schema(), DbType.SQLITE).contains("src blob NOT NULL"));
  }

  @Test
  void bundledCodecsAreDiscovered() {
    CodecRegistry r = CodecRegistry.discovered();
    assertEquals(List.of("default", "fasta", "uniprot"), List.copyOf(r.tags()));
  }
}
