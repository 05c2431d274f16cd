package io.intellixity.biodb.persistence.error;

/** A bulk insert failed; the whole batch was rolled back. */
public class WriteException extends BiodbException {
  public WriteException(String message) {
    super(message);
  }

  public WriteException(String message, OperationContext context) {
    super(message, context);
  }

  public WriteException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
