package io.intellixity.biodb.persistence.error;

/** A stored row could not be turned back into a record. */
public class DecodeException extends BiodbException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, OperationContext context) {
    super(message, context);
  }

  public DecodeException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
