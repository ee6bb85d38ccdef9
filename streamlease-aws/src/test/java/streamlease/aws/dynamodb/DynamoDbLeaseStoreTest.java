package streamlease.aws.dynamodb;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;
import software.amazon.awssdk.services.dynamodb.paginators.ScanIterable;
import streamlease.exceptions.LeaseConflictException;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.exceptions.ThrottledException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DynamoDbLeaseStoreTest {
  private static final String TABLE = "SampleKinesisApplication";
  private static final ShardId SHARD = ShardId.of("shardId-000000000000");
  private static final WorkerId WORKER = WorkerId.of("host:worker");
  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration TTL = Duration.ofSeconds(10);

  private final DynamoDbClient client = mock(DynamoDbClient.class);
  private final DynamoDbLeaseStore store = new DynamoDbLeaseStore(client, TABLE, TTL, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void createIsConditionalOnAbsence() {
    when(client.putItem(any(PutItemRequest.class))).thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

    store.createLeaseIfAbsent(SHARD, Set.of(ShardId.of("shardId-parent")));

    ArgumentCaptor<PutItemRequest> request = ArgumentCaptor.forClass(PutItemRequest.class);
    verify(client).putItem(request.capture());
    assertThat(request.getValue().conditionExpression()).isEqualTo("attribute_not_exists(#key)");
    assertThat(request.getValue().expressionAttributeNames()).containsExactly("#key", LeaseItems.LEASE_KEY);
    assertThat(request.getValue().item().get(LeaseItems.PARENT_SHARD_IDS).ss()).containsExactly("shardId-parent");
  }

  @Test
  void acquireReturnsStoredLease() {
    Lease acquired = Lease.unassigned(SHARD, Set.of()).withOwner(WORKER, NOW.plus(TTL));
    when(client.updateItem(any(UpdateItemRequest.class)))
            .thenReturn(UpdateItemResponse.builder().attributes(LeaseItems.toItem(acquired)).build());

    Lease lease = store.acquireOrRenew(SHARD, WORKER, 0);

    assertThat(lease).isEqualTo(acquired);
    ArgumentCaptor<UpdateItemRequest> request = ArgumentCaptor.forClass(UpdateItemRequest.class);
    verify(client).updateItem(request.capture());
    Map<String, AttributeValue> values = request.getValue().expressionAttributeValues();
    assertThat(values.get(":expected").n()).isEqualTo("0");
    assertThat(values.get(":next").n()).isEqualTo("1");
    assertThat(values.get(":expiresAt").n()).isEqualTo(Long.toString(NOW.plus(TTL).toEpochMilli()));
    assertThat(values.get(":now").n()).isEqualTo(Long.toString(NOW.toEpochMilli()));
  }

  @Test
  void failedConditionIsALeaseConflict() {
    when(client.updateItem(any(UpdateItemRequest.class)))
            .thenThrow(ConditionalCheckFailedException.builder().message("nope").build());

    LeaseConflictException e = assertThrows(LeaseConflictException.class, () -> store.acquireOrRenew(SHARD, WORKER, 3));
    assertThat(e.shardId()).isEqualTo(SHARD);
  }

  @Test
  void lowerCheckpointIsIgnored() {
    givenStored(leaseAt(5, Checkpoint.at(SequenceNumber.of(100))));

    store.writeCheckpoint(SHARD, 5, Checkpoint.at(SequenceNumber.of(42)));

    verify(client, never()).updateItem(any(UpdateItemRequest.class));
  }

  @Test
  void checkpointIsConditionalOnCounter() {
    givenStored(leaseAt(5, Checkpoint.at(SequenceNumber.of(100))));
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

    store.writeCheckpoint(SHARD, 5, Checkpoint.SHARD_END);

    ArgumentCaptor<UpdateItemRequest> request = ArgumentCaptor.forClass(UpdateItemRequest.class);
    verify(client).updateItem(request.capture());
    assertThat(request.getValue().expressionAttributeValues().get(":checkpoint").s()).isEqualTo("SHARD_END");
    assertThat(request.getValue().expressionAttributeValues().get(":counter").n()).isEqualTo("5");
  }

  @Test
  void checkpointWithStaleCounterIsAConflict() {
    givenStored(leaseAt(6, Checkpoint.at(SequenceNumber.of(100))));

    assertThrows(LeaseConflictException.class, () -> store.writeCheckpoint(SHARD, 5, Checkpoint.at(SequenceNumber.of(200))));
    verify(client, never()).updateItem(any(UpdateItemRequest.class));
  }

  @Test
  void throttlingIsTransient() {
    when(client.getItem(any(GetItemRequest.class)))
            .thenThrow(ProvisionedThroughputExceededException.builder().message("slow down").build());

    assertThrows(ThrottledException.class, () -> store.readLease(SHARD));
  }

  @Test
  void missingTableIsASchemaFailure() {
    when(client.getItem(any(GetItemRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("no table").build());

    assertThrows(LeaseStoreSchemaException.class, () -> store.readLease(SHARD));
  }

  @Test
  void absentItemIsEmpty() {
    when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

    assertThat(store.readLease(SHARD)).isEmpty();
  }

  @Test
  void listScansAllPages() {
    Lease first = Lease.unassigned(SHARD, Set.of());
    Lease second = Lease.unassigned(ShardId.of("shardId-000000000001"), Set.of(SHARD));
    ScanRequest firstRequest = ScanRequest.builder().tableName(TABLE).consistentRead(true).build();
    when(client.scanPaginator(any(ScanRequest.class))).thenReturn(new ScanIterable(client, firstRequest));
    when(client.scan(any(ScanRequest.class)))
            .thenReturn(ScanResponse.builder()
                    .items(LeaseItems.toItem(first))
                    .lastEvaluatedKey(LeaseItems.key(SHARD))
                    .build())
            .thenReturn(ScanResponse.builder().items(LeaseItems.toItem(second)).build());

    assertThat(store.listLeases()).containsExactly(first, second).inOrder();
  }

  @Test
  void releaseRemovesOwner() {
    when(client.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

    store.releaseLease(SHARD, WORKER, 7);

    ArgumentCaptor<UpdateItemRequest> request = ArgumentCaptor.forClass(UpdateItemRequest.class);
    verify(client).updateItem(request.capture());
    assertThat(request.getValue().updateExpression()).startsWith("REMOVE #owner");
    assertThat(request.getValue().expressionAttributeValues().get(":owner").s()).isEqualTo(WORKER.id());
    assertThat(request.getValue().expressionAttributeValues().get(":next").n()).isEqualTo("8");
  }

  private void givenStored(Lease lease) {
    when(client.getItem(any(GetItemRequest.class)))
            .thenReturn(GetItemResponse.builder().item(LeaseItems.toItem(lease)).build());
  }

  private static Lease leaseAt(long counter, Checkpoint checkpoint) {
    return Lease.builder()
            .shardId(SHARD)
            .owner(WORKER)
            .counter(counter)
            .expiresAt(NOW.plus(TTL))
            .checkpoint(checkpoint)
            .build();
  }
}
