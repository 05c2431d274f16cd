package io.intellixity.biodb.persistence.error;

/** Where a failure happened. Any component may be null. */
public record OperationContext(String operation, String table, String tag) {
  public static final OperationContext NONE = new OperationContext(null, null, null);

  public static OperationContext of(String operation, String table, String tag) {
    return new OperationContext(operation, table, tag);
  }

  public boolean isEmpty() {
    return operation == null && table == null && tag == null;
  }

  String render() {
    StringBuilder sb = new StringBuilder("[");
    append(sb, "op", operation);
    append(sb, "table", table);
    append(sb, "tag", tag);
    return sb.append(']').toString();
  }

  private static void append(StringBuilder sb, String key, String value) {
    if (value == null) return;
    if (sb.length() > 1) sb.append(' ');
    sb.append(key).append('=').append(value);
  }
}
