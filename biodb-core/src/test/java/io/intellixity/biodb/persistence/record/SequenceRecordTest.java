package io.intellixity.biodb.persistence.record;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SequenceRecordTest {

  @Test
  void numbersAndCollectionsAreHeldInCanonicalForm() {
    SequenceRecord r = SequenceRecord.builder("A1")
        .with("length", 142)
        .with("short", (short) 7)
        .with("mass", 1.5f)
        .with("small", BigInteger.TEN)
        .with("huge", BigInteger.TWO.pow(70))
        .with("name", new StringBuilder("hb"))
        .with("tags", new LinkedHashSet<>(List.of("b", "a")))
        .build();

    assertEquals(142L, r.get("length"));
    assertEquals(7L, r.get("short"));
    assertEquals(1.5d, r.get("mass"));
    assertEquals(10L, r.get("small"));
    assertEquals(BigInteger.TWO.pow(70), r.get("huge"));
    assertEquals("hb", r.get("name"));
    assertEquals(List.of("b", "a"), r.get("tags"));
  }

  @Test
  void equalAcrossIntegralWidths() {
    assertEquals(SequenceRecord.builder("A1").with("n", 3).build(), SequenceRecord.builder("A1").with("n", 3L).build());
  }

  @Test
  void nestedValuesAreUnmodifiable() {
    SequenceRecord r = SequenceRecord.builder("A1").with("xref", Map.of("pdb", List.of(1))).build();
    @SuppressWarnings("unchecked")
    Map<String, Object> xref = (Map<String, Object>) r.get("xref");
    assertEquals(List.of(1L), xref.get("pdb"));
    assertThrows(UnsupportedOperationException.class, () -> xref.put("x", 1));
  }

  @Test
  void jsonCheckReportsFirstOpaqueValue() {
    assertNull(FieldValues.firstNonJsonValue(SequenceRecord.builder("A1").with("n", 1).with("s", Set.of("x")).build().fields()));
    assertEquals("xref.ids[1] ([B)", FieldValues.firstNonJsonValue(
        SequenceRecord.builder("A1").with("xref", Map.of("ids", List.of("a", new byte[0]))).build().fields()));
  }
}
