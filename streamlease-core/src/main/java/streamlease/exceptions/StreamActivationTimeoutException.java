package streamlease.exceptions;

import java.time.Duration;

public class StreamActivationTimeoutException extends StreamLeaseException {
  public StreamActivationTimeoutException(String streamName, Duration timeout) {
    super("Stream " + streamName + " never became active (waited " + timeout + ")");
  }
}
