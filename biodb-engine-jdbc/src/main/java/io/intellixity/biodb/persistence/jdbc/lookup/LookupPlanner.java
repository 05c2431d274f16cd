package io.intellixity.biodb.persistence.jdbc.lookup;

/**
 * Picks the execution strategy of an accession lookup from the input size.\n
 *
 * Up to {@link #threshold()} accessions go into a parameterized {@code IN} list; larger inputs
 * are staged into a temporary table and joined. Both strategies return the same rows.\n
 */
public final class LookupPlanner {
  public static final int DEFAULT_THRESHOLD = 100;

  public enum Strategy { DIRECT, STAGED }

  private final int threshold;

  public LookupPlanner() {
    this(DEFAULT_THRESHOLD);
  }

  public LookupPlanner(int threshold) {
    if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
    this.threshold = threshold;
  }

  public int threshold() {
    return threshold;
  }

  public Strategy choose(int accessionCount) {
    if (accessionCount < 0) throw new IllegalArgumentException("accessionCount must be >= 0");
    return accessionCount <= threshold ? Strategy.DIRECT : Strategy.STAGED;
  }
}
