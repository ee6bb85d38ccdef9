package streamlease.exceptions;

/**
 * A record payload could not be decoded. Decoding is deterministic, so the record is rejected rather than retried.
 */
public class RecordDecodeException extends Exception {
  public RecordDecodeException(String message) {
    super(message);
  }

  public RecordDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
