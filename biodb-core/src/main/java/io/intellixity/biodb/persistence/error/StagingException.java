package io.intellixity.biodb.persistence.error;

/** The staging table for a large lookup could not be created or populated; the transaction was rolled back. */
public class StagingException extends BiodbException {
  public StagingException(String message) {
    super(message);
  }

  public StagingException(String message, OperationContext context) {
    super(message, context);
  }

  public StagingException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
