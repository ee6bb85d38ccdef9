package streamlease.exceptions;

/**
 * The lease store is missing or does not have the expected shape. Retrying will not help.
 */
public class LeaseStoreSchemaException extends StreamLeaseException {
  public LeaseStoreSchemaException(String message) {
    super(message);
  }

  public LeaseStoreSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
