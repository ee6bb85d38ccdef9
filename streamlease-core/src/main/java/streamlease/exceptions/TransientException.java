package streamlease.exceptions;

/**
 * A failure that may succeed if retried: network errors, service unavailability.
 */
public class TransientException extends StreamLeaseException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
