package streamlease.aws.dynamodb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import streamlease.aws.AwsConfig;
import streamlease.spi.LeaseTableAdmin;

/**
 * Creates and deletes the DynamoDB lease table, keyed on {@code leaseKey}. Billed per request unless both
 * capacities are configured.
 */
public class DynamoDbLeaseTableAdmin implements LeaseTableAdmin {
  private static final Logger LOG = LoggerFactory.getLogger(DynamoDbLeaseTableAdmin.class);

  private final DynamoDbClient client;
  private final AwsConfig awsConfig;

  public DynamoDbLeaseTableAdmin(DynamoDbClient client, AwsConfig awsConfig) {
    this.client = client;
    this.awsConfig = awsConfig;
  }

  @Override
  public void createTableIfNotExists(String tableName) {
    CreateTableRequest.Builder request = CreateTableRequest.builder()
            .tableName(tableName)
            .attributeDefinitions(AttributeDefinition.builder()
                    .attributeName(LeaseItems.LEASE_KEY)
                    .attributeType(ScalarAttributeType.S)
                    .build())
            .keySchema(KeySchemaElement.builder()
                    .attributeName(LeaseItems.LEASE_KEY)
                    .keyType(KeyType.HASH)
                    .build());
    if (awsConfig.leaseTableReadCapacity().isPresent()) {
      request.billingMode(BillingMode.PROVISIONED)
              .provisionedThroughput(ProvisionedThroughput.builder()
                      .readCapacityUnits(awsConfig.leaseTableReadCapacity().get())
                      .writeCapacityUnits(awsConfig.leaseTableWriteCapacity().orElseThrow())
                      .build());
    } else {
      request.billingMode(BillingMode.PAY_PER_REQUEST);
    }

    try {
      client.createTable(request.build());
      LOG.info("Creating lease table {}", tableName);
    } catch (ResourceInUseException e) {
      LOG.debug("Lease table {} already exists", tableName);
    } catch (SdkException e) {
      throw DynamoDbExceptions.translate("CreateTable " + tableName, e);
    }

    try {
      client.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
    } catch (SdkException e) {
      throw DynamoDbExceptions.translate("DescribeTable " + tableName, e);
    }
    LOG.info("Lease table {} is active", tableName);
  }

  @Override
  public boolean deleteTableIfExists(String tableName) {
    try {
      client.deleteTable(DeleteTableRequest.builder().tableName(tableName).build());
      LOG.info("Deleted lease table {}", tableName);
      return true;
    } catch (ResourceNotFoundException e) {
      LOG.info("Lease table {} does not exist", tableName);
      return false;
    } catch (SdkException e) {
      throw DynamoDbExceptions.translate("DeleteTable " + tableName, e);
    }
  }
}
