package io.intellixity.biodb.persistence.jdbc.lookup;

import java.util.UUID;

/** Staging table names with a random 128-bit suffix. */
public final class StagingTableNames {
  public static final String PREFIX = "biodb_stage_";

  private StagingTableNames() {}

  public static String next() {
    return PREFIX + UUID.randomUUID().toString().replace("-", "");
  }
}
