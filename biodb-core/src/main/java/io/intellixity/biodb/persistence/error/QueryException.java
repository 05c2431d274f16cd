package io.intellixity.biodb.persistence.error;

public class QueryException extends BiodbException {
  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, OperationContext context) {
    super(message, context);
  }

  public QueryException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
