package io.intellixity.biodb.persistence.jdbc.lookup;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static io.intellixity.biodb.persistence.jdbc.lookup.LookupPlanner.Strategy.DIRECT;
import static io.intellixity.biodb.persistence.jdbc.lookup.LookupPlanner.Strategy.STAGED;
import static org.junit.jupiter.api.Assertions.*;

final class LookupPlannerTest {
  @Test
  void thresholdIsInclusiveForDirect() {
    LookupPlanner p = new LookupPlanner();
    assertEquals(100, p.threshold());
    assertEquals(DIRECT, p.choose(1));
    assertEquals(DIRECT, p.choose(100));
    assertEquals(STAGED, p.choose(101));
  }

  @Test
  void customThreshold() {
    LookupPlanner p = new LookupPlanner(2);
    assertEquals(DIRECT, p.choose(2));
    assertEquals(STAGED, p.choose(3));
    assertThrows(IllegalArgumentException.class, () -> new LookupPlanner(0));
    assertThrows(IllegalArgumentException.class, () -> p.choose(-1));
  }

  @Test
  void stagingNamesAreUniqueIdentifiers() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      String n = StagingTableNames.next();
      assertTrue(n.matches("biodb_stage_[0-9a-f]{32}"), n);
      assertTrue(seen.add(n));
    }
  }
}
