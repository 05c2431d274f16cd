package io.intellixity.biodb.persistence.error;

/** A record could not be turned into a row. */
public class EncodeException extends BiodbException {
  public EncodeException(String message) {
    super(message);
  }

  public EncodeException(String message, OperationContext context) {
    super(message, context);
  }

  public EncodeException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
