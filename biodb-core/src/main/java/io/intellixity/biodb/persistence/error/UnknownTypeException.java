package io.intellixity.biodb.persistence.error;

/** No codec is registered for a record type tag. */
public class UnknownTypeException extends BiodbException {
  public UnknownTypeException(String message) {
    super(message);
  }

  public UnknownTypeException(String message, OperationContext context) {
    super(message, context);
  }

  public UnknownTypeException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
