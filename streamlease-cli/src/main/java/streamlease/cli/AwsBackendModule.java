package streamlease.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import streamlease.aws.AwsClients;
import streamlease.aws.AwsConfig;
import streamlease.aws.dynamodb.DynamoDbLeaseStore;
import streamlease.aws.dynamodb.DynamoDbLeaseTableAdmin;
import streamlease.aws.kinesis.KinesisStreamAdmin;
import streamlease.aws.kinesis.KinesisStreamProducer;
import streamlease.aws.kinesis.KinesisStreamSource;
import streamlease.config.ConsumerConfig;
import streamlease.config.StreamConfig;
import streamlease.spi.LeaseStore;
import streamlease.spi.LeaseTableAdmin;
import streamlease.spi.StreamAdmin;
import streamlease.spi.StreamProducer;
import streamlease.spi.StreamSource;

import javax.inject.Singleton;
import java.time.Clock;

/**
 * Kinesis for the stream, DynamoDB for leases. The lease table is named after the consumer application.
 */
public class AwsBackendModule extends AbstractModule {
  private final Config config;

  public AwsBackendModule(Config config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(StreamSource.class).to(KinesisStreamSource.class);
    bind(StreamAdmin.class).to(KinesisStreamAdmin.class);
  }

  @Provides
  @Singleton
  AwsConfig awsConfig() {
    return AwsConfig.fromConfig(config);
  }

  @Provides
  @Singleton
  KinesisClient kinesisClient(AwsConfig awsConfig) {
    return AwsClients.kinesis(awsConfig);
  }

  @Provides
  @Singleton
  DynamoDbClient dynamoDbClient(AwsConfig awsConfig) {
    return AwsClients.dynamoDb(awsConfig);
  }

  @Provides
  @Singleton
  StreamProducer streamProducer(KinesisClient client, StreamConfig streamConfig) {
    return new KinesisStreamProducer(client, streamConfig.name());
  }

  @Provides
  @Singleton
  LeaseStore leaseStore(DynamoDbClient client, ConsumerConfig consumerConfig, Clock clock) {
    return new DynamoDbLeaseStore(client, consumerConfig.applicationName(), consumerConfig.leaseTtl(), clock);
  }

  @Provides
  @Singleton
  LeaseTableAdmin leaseTableAdmin(DynamoDbClient client, AwsConfig awsConfig) {
    return new DynamoDbLeaseTableAdmin(client, awsConfig);
  }
}
