package io.intellixity.biodb.persistence.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryOptionsTest {
  @Test
  void noneHasNoEffect() {
    QueryOptions o = QueryOptions.none();
    assertTrue(o.select().isEmpty());
    assertFalse(o.hasWhere());
    assertFalse(o.hasOffset());
    assertFalse(o.hasLimit());
    assertNull(o.join());
    assertNull(o.order());
  }

  @Test
  void withersCopy() {
    QueryOptions base = QueryOptions.none().withLimit(5);
    QueryOptions other = base.withOffset(2).withWhere("length > ?", 10);
    assertFalse(base.hasOffset());
    assertEquals(5, other.limit());
    assertEquals(2, other.offset());
    assertEquals(List.of(10), other.whereParams());
  }

  @Test
  void whereParamsMayContainNull() {
    QueryOptions o = QueryOptions.none().withWhere("a = ? OR b IS ?", "x", null);
    assertEquals(Arrays.asList("x", null), o.whereParams());
  }

  @Test
  void blankFragmentsMeanAbsent() {
    QueryOptions o = QueryOptions.none().withWhere("  ").withJoin("").withOrder(null);
    assertFalse(o.hasWhere());
    assertNull(o.join());
    assertNull(o.order());
  }

  @Test
  void paramsWithoutPredicateAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> QueryOptions.none().withWhere("  ", 1));
    assertThrows(IllegalArgumentException.class, () -> QueryOptions.none().withWhere(null, "x"));
    assertFalse(QueryOptions.none().withWhere(" ").hasWhere());
  }

  @Test
  void rejectsNegativePaging() {
    assertThrows(IllegalArgumentException.class, () -> QueryOptions.none().withOffset(-1));
    assertThrows(IllegalArgumentException.class, () -> QueryOptions.none().withLimit(-1));
    assertThrows(IllegalArgumentException.class, () -> QueryOptions.none().withSelect("accession", " "));
  }
}
