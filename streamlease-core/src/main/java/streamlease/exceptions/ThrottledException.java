package streamlease.exceptions;

/**
 * The backend rejected the call because a rate or throughput limit was exceeded.
 */
public class ThrottledException extends TransientException {
  public ThrottledException(String message) {
    super(message);
  }

  public ThrottledException(String message, Throwable cause) {
    super(message, cause);
  }
}
