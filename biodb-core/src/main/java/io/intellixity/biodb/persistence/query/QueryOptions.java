package io.intellixity.biodb.persistence.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Optional modifiers for accession lookups.\n
 *
 * {@code where}, {@code join} and {@code order} are raw SQL fragments spliced into the rendered
 * statement as given. They are not sanitized; only pass trusted text and bind values through
 * {@code whereParams}.\n
 *
 * Instances are immutable; every {@code withX} returns a copy.\n
 */
public final class QueryOptions {
  private static final QueryOptions NONE = new QueryOptions(List.of(), null, List.of(), null, null, null, null);

  private final List<String> select;
  private final String where;
  private final List<Object> whereParams;
  private final String join;
  private final String order;
  private final Integer offset;
  private final Integer limit;

  private QueryOptions(List<String> select, String where, List<Object> whereParams,
                       String join, String order, Integer offset, Integer limit) {
    this.select = select;
    this.where = where;
    this.whereParams = whereParams;
    this.join = join;
    this.order = order;
    this.offset = offset;
    this.limit = limit;
  }

  public static QueryOptions none() {
    return NONE;
  }

  /** Projection; empty means {@code *}. */
  public QueryOptions withSelect(String... columns) {
    return withSelect(Arrays.asList(columns));
  }

  public QueryOptions withSelect(List<String> columns) {
    List<String> cols = columns == null ? List.of() : List.copyOf(columns);
    for (String c : cols) {
      if (c.isBlank()) throw new IllegalArgumentException("select column must not be blank");
    }
    return new QueryOptions(cols, where, whereParams, join, order, offset, limit);
  }

  /** Predicate with positional {@code ?} parameters. Params may contain nulls. */
  public QueryOptions withWhere(String predicate, Object... params) {
    List<Object> p = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(params)));
    String where = blankToNull(predicate);
    if (where == null && !p.isEmpty()) {
      throw new IllegalArgumentException("where parameters given without a predicate");
    }
    return new QueryOptions(select, where, p, join, order, offset, limit);
  }

  public QueryOptions withJoin(String joinClause) {
    return new QueryOptions(select, where, whereParams, blankToNull(joinClause), order, offset, limit);
  }

  /** Order-by body without the keywords, e.g. {@code "t.accession DESC"}. */
  public QueryOptions withOrder(String orderBy) {
    return new QueryOptions(select, where, whereParams, join, blankToNull(orderBy), offset, limit);
  }

  public QueryOptions withOffset(int offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    return new QueryOptions(select, where, whereParams, join, order, offset, limit);
  }

  public QueryOptions withLimit(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    return new QueryOptions(select, where, whereParams, join, order, offset, limit);
  }

  public List<String> select() { return select; }
  public String where() { return where; }
  public List<Object> whereParams() { return whereParams; }
  public String join() { return join; }
  public String order() { return order; }
  public Integer offset() { return offset; }
  public Integer limit() { return limit; }

  public boolean hasWhere() { return where != null; }
  public boolean hasOffset() { return offset != null; }
  public boolean hasLimit() { return limit != null; }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }

  @Override
  public String toString() {
    return "QueryOptions{select=" + select + ", where=" + where + ", whereParams=" + whereParams.size()
        + ", join=" + join + ", order=" + order + ", offset=" + offset + ", limit=" + limit + "}";
  }
}
