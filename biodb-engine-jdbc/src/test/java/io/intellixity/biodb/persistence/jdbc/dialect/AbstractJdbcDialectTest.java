package io.intellixity.biodb.persistence.jdbc.dialect;

import io.intellixity.biodb.persistence.jdbc.RecordingSession;
import io.intellixity.biodb.persistence.jdbc.SqlStatement;
import io.intellixity.biodb.persistence.query.QueryOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcDialectTest {
  private final GenericTestDialect d = new GenericTestDialect();

  @Test
  void directLookupKeepsDuplicatesAndOrder() {
    SqlStatement ss = d.renderDirectLookup("seqs", List.of("B", "A", "B"), QueryOptions.none());
    assertEquals("SELECT * FROM seqs WHERE seqs.accession IN (?, ?, ?)", ss.sql());
    assertEquals(List.of("B", "A", "B"), ss.params());
  }

  @Test
  void directLookupBindsAccessionsThenWhereThenOffsetThenLimit() {
    QueryOptions o = QueryOptions.none()
        .withWhere("length > ? AND organism = ?", 10, "human")
        .withOrder("seqs.accession DESC")
        .withOffset(5)
        .withLimit(20);
    SqlStatement ss = d.renderDirectLookup("seqs", List.of("A1", "A2"), o);

    assertEquals("SELECT * FROM seqs WHERE seqs.accession IN (?, ?) AND (length > ? AND organism = ?)"
        + " ORDER BY seqs.accession DESC OFFSET ? LIMIT ?", ss.sql());
    assertEquals(List.of("A1", "A2", 10, "human", 5, 20), ss.params());
  }

  @Test
  void stagedLookupBindsWhereThenOffsetThenLimit() {
    QueryOptions o = QueryOptions.none().withWhere("length > ?", 10).withOffset(5).withLimit(20);
    SqlStatement ss = d.renderStagedLookup("seqs", "biodb_stage_x", o);

    assertEquals("SELECT * FROM seqs INNER JOIN biodb_stage_x ON seqs.accession = biodb_stage_x.accession"
        + " WHERE length > ? OFFSET ? LIMIT ?", ss.sql());
    assertEquals(List.of(10, 5, 20), ss.params());
  }

  @Test
  void projectionAndJoinComeBeforeGeneratedClauses() {
    QueryOptions o = QueryOptions.none()
        .withSelect("seqs.accession", "ann.note")
        .withJoin("LEFT JOIN ann ON ann.accession = seqs.accession");

    assertEquals("SELECT seqs.accession, ann.note FROM seqs LEFT JOIN ann ON ann.accession = seqs.accession"
            + " WHERE seqs.accession IN (?)",
        d.renderDirectLookup("seqs", List.of("A"), o).sql());
    assertEquals("SELECT seqs.accession, ann.note FROM seqs LEFT JOIN ann ON ann.accession = seqs.accession"
            + " INNER JOIN st ON seqs.accession = st.accession",
        d.renderStagedLookup("seqs", "st", o).sql());
  }

  @Test
  void limitWithoutOffset() {
    SqlStatement ss = d.renderDirectLookup("seqs", List.of("A"), QueryOptions.none().withLimit(3));
    assertTrue(ss.sql().endsWith(" LIMIT ?"));
    assertFalse(ss.sql().contains("OFFSET"));
    assertEquals(List.of("A", 3), ss.params());
  }

  @Test
  void rejectsBadInput() {
    assertThrows(IllegalArgumentException.class, () -> d.renderDirectLookup("seqs", List.of(), QueryOptions.none()));
    assertThrows(IllegalArgumentException.class, () -> d.renderDirectLookup("seqs x", List.of("A"), QueryOptions.none()));
    assertThrows(IllegalArgumentException.class, () -> d.renderStagedLookup("seqs", "st;drop", QueryOptions.none()));
  }

  @Test
  void defaultStagingLoadIsOneMultiRowInsert() {
    RecordingSession s = new RecordingSession();
    d.populateStagingTable(s, "st", List.of("A", "B"));

    assertEquals(List.of("INSERT st"), s.events);
    assertEquals(List.of(Map.of("accession", "A"), Map.of("accession", "B")), s.inserts.get(0));
  }
}
