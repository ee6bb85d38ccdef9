package streamlease.exceptions;

public class StreamDeletingException extends StreamLeaseException {
  public StreamDeletingException(String streamName) {
    super("Stream " + streamName + " is being deleted");
  }
}
