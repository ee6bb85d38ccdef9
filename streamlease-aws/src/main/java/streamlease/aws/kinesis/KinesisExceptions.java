package streamlease.aws.kinesis;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.model.KmsThrottlingException;
import software.amazon.awssdk.services.kinesis.model.LimitExceededException;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import streamlease.aws.SdkExceptions;
import streamlease.exceptions.StreamLeaseException;
import streamlease.exceptions.StreamNotFoundException;
import streamlease.exceptions.ThrottledException;

import java.util.function.Supplier;

final class KinesisExceptions {
  private KinesisExceptions() {
  }

  static <T> T call(String description, Supplier<T> call) {
    try {
      return call.get();
    } catch (SdkException e) {
      throw translate(description, e);
    }
  }

  static StreamLeaseException translate(String description, SdkException e) {
    if (e instanceof ProvisionedThroughputExceededException
            || e instanceof LimitExceededException
            || e instanceof KmsThrottlingException) {
      return new ThrottledException(description + " was throttled: " + e.getMessage(), e);
    }
    if (e instanceof ResourceNotFoundException) {
      return new StreamNotFoundException(description + " failed: " + e.getMessage(), e);
    }
    return SdkExceptions.translateGeneric(description, e);
  }
}
