package io.intellixity.biodb.persistence.error;

/** Bad or missing connection parameters. */
public class ConfigException extends BiodbException {
  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, OperationContext context) {
    super(message, context);
  }

  public ConfigException(String message, OperationContext context, Throwable cause) {
    super(message, context, cause);
  }
}
