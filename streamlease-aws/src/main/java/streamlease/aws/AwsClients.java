package streamlease.aws;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.kinesis.KinesisClient;

public final class AwsClients {
  private AwsClients() {
  }

  public static KinesisClient kinesis(AwsConfig config) {
    return config.configure(KinesisClient.builder()).build();
  }

  public static DynamoDbClient dynamoDb(AwsConfig config) {
    return config.configure(DynamoDbClient.builder()).build();
  }
}
