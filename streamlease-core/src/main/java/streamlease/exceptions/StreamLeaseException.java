package streamlease.exceptions;

/**
 * Root of the unchecked failures raised by stream and lease-store backends.
 */
public class StreamLeaseException extends RuntimeException {
  public StreamLeaseException(String message) {
    super(message);
  }

  public StreamLeaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
