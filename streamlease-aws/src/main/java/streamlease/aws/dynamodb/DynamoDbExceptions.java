package streamlease.aws.dynamodb;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import streamlease.aws.SdkExceptions;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.exceptions.StreamLeaseException;
import streamlease.exceptions.ThrottledException;

final class DynamoDbExceptions {
  private static final String VALIDATION_ERROR_CODE = "ValidationException";

  private DynamoDbExceptions() {
  }

  static StreamLeaseException translate(String description, SdkException e) {
    if (e instanceof ProvisionedThroughputExceededException || e instanceof RequestLimitExceededException) {
      return new ThrottledException(description + " was throttled: " + e.getMessage(), e);
    }
    if (e instanceof ResourceNotFoundException) {
      return new LeaseStoreSchemaException(description + " failed, lease table does not exist: " + e.getMessage(), e);
    }
    if (e instanceof AwsServiceException serviceException
            && serviceException.awsErrorDetails() != null
            && VALIDATION_ERROR_CODE.equals(serviceException.awsErrorDetails().errorCode())) {
      return new LeaseStoreSchemaException(description + " was rejected by the lease table: " + e.getMessage(), e);
    }
    return SdkExceptions.translateGeneric(description, e);
  }
}
