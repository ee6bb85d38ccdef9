package streamlease.aws.dynamodb;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import streamlease.exceptions.LeaseConflictException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;
import streamlease.spi.LeaseStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static streamlease.aws.dynamodb.LeaseItems.n;
import static streamlease.aws.dynamodb.LeaseItems.s;

/**
 * A {@link LeaseStore} backed by a DynamoDB table keyed on {@code leaseKey} (the shard id). Ownership changes are
 * conditional updates on {@code leaseCounter}. Expiry is {@code leaseExpiresAt}, in epoch millis on this store's
 * clock, so workers sharing a table are assumed to have roughly synchronized clocks.
 */
public class DynamoDbLeaseStore implements LeaseStore {
  private static final Logger LOG = LoggerFactory.getLogger(DynamoDbLeaseStore.class);

  private final DynamoDbClient client;
  private final String tableName;
  private final Duration leaseTtl;
  private final Clock clock;

  public DynamoDbLeaseStore(DynamoDbClient client, String tableName, Duration leaseTtl, Clock clock) {
    this.client = client;
    this.tableName = tableName;
    this.leaseTtl = leaseTtl;
    this.clock = clock;
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public Optional<Lease> readLease(ShardId shardId) {
    GetItemRequest request = GetItemRequest.builder()
            .tableName(tableName)
            .key(LeaseItems.key(shardId))
            .consistentRead(true)
            .build();
    GetItemResponse response = call("GetItem " + shardId, () -> client.getItem(request));
    return response.hasItem() && !response.item().isEmpty()
            ? Optional.of(LeaseItems.fromItem(response.item()))
            : Optional.empty();
  }

  @Override
  public List<Lease> listLeases() {
    ScanRequest request = ScanRequest.builder().tableName(tableName).consistentRead(true).build();
    return call("Scan " + tableName, () -> client.scanPaginator(request).items().stream()
            .map(LeaseItems::fromItem)
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public void createLeaseIfAbsent(ShardId shardId, Set<ShardId> parentShardIds) {
    PutItemRequest request = PutItemRequest.builder()
            .tableName(tableName)
            .item(LeaseItems.toItem(Lease.unassigned(shardId, parentShardIds)))
            .conditionExpression("attribute_not_exists(#key)")
            .expressionAttributeNames(LeaseItems.names("#key"))
            .build();
    try {
      call("PutItem " + shardId, () -> client.putItem(request));
      LOG.info("Created lease for shard {}", shardId);
    } catch (ConditionalCheckFailedException e) {
      LOG.debug("Lease for shard {} already exists", shardId);
    }
  }

  @Override
  public Lease acquireOrRenew(ShardId shardId, WorkerId workerId, long expectedCounter) {
    Instant now = clock.instant();
    UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(LeaseItems.key(shardId))
            .updateExpression("SET #owner = :owner, #counter = :next, #expiresAt = :expiresAt")
            .conditionExpression("attribute_exists(#key) AND #counter = :expected"
                    + " AND (attribute_not_exists(#owner) OR #owner = :owner OR #expiresAt <= :now)")
            .expressionAttributeNames(LeaseItems.names("#key", "#owner", "#counter", "#expiresAt"))
            .expressionAttributeValues(Map.of(
                    ":owner", s(workerId.id()),
                    ":next", n(expectedCounter + 1),
                    ":expected", n(expectedCounter),
                    ":expiresAt", n(now.plus(leaseTtl).toEpochMilli()),
                    ":now", n(now.toEpochMilli())
            ))
            .returnValues(ReturnValue.ALL_NEW)
            .build();
    try {
      UpdateItemResponse response = call("UpdateItem " + shardId, () -> client.updateItem(request));
      return LeaseItems.fromItem(response.attributes());
    } catch (ConditionalCheckFailedException e) {
      throw new LeaseConflictException(shardId, "counter is no longer " + expectedCounter + " or lease is held by a live owner", e);
    }
  }

  /**
   * DynamoDB cannot compare the stored checkpoint numerically in a condition expression, so the stored value is read
   * first and a lower checkpoint is dropped here. Only the current lease holder can pass the counter condition, so
   * the stored checkpoint cannot move between the read and the write without the write failing.
   */
  @Override
  public void writeCheckpoint(ShardId shardId, long leaseCounter, Checkpoint checkpoint) {
    Lease current = readLease(shardId).orElseThrow(() -> new LeaseConflictException(shardId, "no such lease"));
    if (current.counter() != leaseCounter) {
      throw new LeaseConflictException(shardId, "expected counter " + leaseCounter + " but was " + current.counter());
    }
    if (current.checkpoint().filter(checkpoint::isBefore).isPresent()) {
      LOG.debug("Ignoring checkpoint {} for shard {}, already at {}", checkpoint, shardId, current.checkpoint().get());
      return;
    }

    UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(LeaseItems.key(shardId))
            .updateExpression("SET #checkpoint = :checkpoint")
            .conditionExpression("attribute_exists(#key) AND #counter = :counter")
            .expressionAttributeNames(LeaseItems.names("#key", "#counter", "#checkpoint"))
            .expressionAttributeValues(Map.of(
                    ":checkpoint", s(checkpoint.toString()),
                    ":counter", n(leaseCounter)
            ))
            .build();
    try {
      call("UpdateItem " + shardId, () -> client.updateItem(request));
    } catch (ConditionalCheckFailedException e) {
      throw new LeaseConflictException(shardId, "counter is no longer " + leaseCounter, e);
    }
  }

  @Override
  public void releaseLease(ShardId shardId, WorkerId workerId, long leaseCounter) {
    UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(LeaseItems.key(shardId))
            .updateExpression("REMOVE #owner SET #counter = :next, #expiresAt = :epoch")
            .conditionExpression("#counter = :counter AND #owner = :owner")
            .expressionAttributeNames(LeaseItems.names("#owner", "#counter", "#expiresAt"))
            .expressionAttributeValues(Map.of(
                    ":owner", s(workerId.id()),
                    ":counter", n(leaseCounter),
                    ":next", n(leaseCounter + 1),
                    ":epoch", n(0)
            ))
            .build();
    try {
      call("UpdateItem " + shardId, () -> client.updateItem(request));
    } catch (ConditionalCheckFailedException e) {
      throw new LeaseConflictException(shardId, "not held by " + workerId + " at counter " + leaseCounter, e);
    }
  }

  private static <T> T call(String description, Supplier<T> call) {
    try {
      return call.get();
    } catch (ConditionalCheckFailedException e) {
      throw e;
    } catch (SdkException e) {
      throw DynamoDbExceptions.translate(description, e);
    }
  }
}
