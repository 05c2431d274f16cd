package io.intellixity.biodb.persistence.error;

/**
 * Base of every failure raised by the persistence layer.\n
 *
 * Unchecked, never retried internally. The {@link OperationContext} is appended to the message.\n
 */
public class BiodbException extends RuntimeException {
  private final OperationContext context;

  public BiodbException(String message) {
    this(message, OperationContext.NONE, null);
  }

  public BiodbException(String message, OperationContext context) {
    this(message, context, null);
  }

  public BiodbException(String message, OperationContext context, Throwable cause) {
    super(render(message, context), cause);
    this.context = context == null ? OperationContext.NONE : context;
  }

  public OperationContext context() {
    return context;
  }

  private static String render(String message, OperationContext context) {
    if (context == null || context.isEmpty()) return message;
    return message + " " + context.render();
  }
}
