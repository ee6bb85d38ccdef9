package streamlease.exceptions;

public class StreamNotFoundException extends StreamLeaseException {
  public StreamNotFoundException(String message) {
    super(message);
  }

  public StreamNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
