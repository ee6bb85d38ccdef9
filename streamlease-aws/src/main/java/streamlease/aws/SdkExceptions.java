package streamlease.aws;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import streamlease.exceptions.StreamLeaseException;
import streamlease.exceptions.ThrottledException;
import streamlease.exceptions.TransientException;

/**
 * Classification shared by the Kinesis and DynamoDB adapters for failures that are not specific to either service.
 */
public final class SdkExceptions {
  private SdkExceptions() {
  }

  public static StreamLeaseException translateGeneric(String description, SdkException e) {
    String message = description + " failed: " + e.getMessage();
    if (e instanceof AwsServiceException serviceException) {
      if (serviceException.isThrottlingException()) return new ThrottledException(message, e);
      if (serviceException.statusCode() >= 500) return new TransientException(message, e);
    } else if (e instanceof SdkClientException || e.retryable()) {
      return new TransientException(message, e);
    }
    return new StreamLeaseException(message, e);
  }
}
