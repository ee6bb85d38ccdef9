package streamlease.aws.kinesis;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.ExpiredIteratorException;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorResponse;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.Record;
import software.amazon.awssdk.services.kinesis.model.SequenceNumberRange;
import software.amazon.awssdk.services.kinesis.model.Shard;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;
import streamlease.exceptions.ThrottledException;
import streamlease.model.InitialPosition;
import streamlease.model.RecordBatch;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardDescriptor;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KinesisStreamSourceTest {
  private static final String STREAM = "myFirstStream";
  private static final ShardId SHARD = ShardId.of("shardId-000000000000");

  private final KinesisClient client = mock(KinesisClient.class);
  private final KinesisStreamSource source = new KinesisStreamSource(client);

  @Test
  void listShardsFollowsNextToken() {
    when(client.listShards(any(ListShardsRequest.class)))
            .thenReturn(ListShardsResponse.builder().shards(shard("shardId-000000000000", null, "100")).nextToken("page2").build())
            .thenReturn(ListShardsResponse.builder().shards(shard("shardId-000000000001", "shardId-000000000000", null)).build());

    List<ShardDescriptor> shards = source.listShards(STREAM);

    assertThat(shards).hasSize(2);
    assertThat(shards.get(0).closed()).isTrue();
    assertThat(shards.get(1).closed()).isFalse();
    assertThat(shards.get(1).parentShardIds()).containsExactly(SHARD);

    ArgumentCaptor<ListShardsRequest> requests = ArgumentCaptor.forClass(ListShardsRequest.class);
    verify(client, times(2)).listShards(requests.capture());
    assertThat(requests.getAllValues().get(0).streamName()).isEqualTo(STREAM);
    assertThat(requests.getAllValues().get(1).streamName()).isNull();
    assertThat(requests.getAllValues().get(1).nextToken()).isEqualTo("page2");
  }

  @Test
  void mergedShardHasBothParents() {
    Shard merged = Shard.builder()
            .shardId("shardId-000000000002")
            .parentShardId("shardId-000000000000")
            .adjacentParentShardId("shardId-000000000001")
            .sequenceNumberRange(SequenceNumberRange.builder().startingSequenceNumber("1").build())
            .build();

    assertThat(KinesisStreamSource.toDescriptor(merged).parentShardIds())
            .containsExactly(SHARD, ShardId.of("shardId-000000000001"));
  }

  @Test
  void firstReadRequestsIteratorFromInitialPosition() {
    givenIterator("iterator-1");
    when(client.getRecords(any(GetRecordsRequest.class)))
            .thenReturn(GetRecordsResponse.builder()
                    .records(record("5"), record("9"))
                    .nextShardIterator("iterator-2")
                    .millisBehindLatest(0L)
                    .build());

    RecordBatch batch = source.getRecords(STREAM, SHARD, ShardPosition.initial(InitialPosition.TRIM_HORIZON), 25000);

    assertThat(batch.records()).hasSize(2);
    assertThat(batch.shardExhausted()).isFalse();
    assertThat(batch.nextPosition().afterSequence()).hasValue(SequenceNumber.of(9));
    assertThat(batch.nextPosition().continuationToken()).hasValue("iterator-2");

    ArgumentCaptor<GetShardIteratorRequest> iteratorRequest = ArgumentCaptor.forClass(GetShardIteratorRequest.class);
    verify(client).getShardIterator(iteratorRequest.capture());
    assertThat(iteratorRequest.getValue().shardIteratorType()).isEqualTo(ShardIteratorType.TRIM_HORIZON);

    ArgumentCaptor<GetRecordsRequest> recordsRequest = ArgumentCaptor.forClass(GetRecordsRequest.class);
    verify(client).getRecords(recordsRequest.capture());
    assertThat(recordsRequest.getValue().limit()).isEqualTo(KinesisStreamSource.MAX_GET_RECORDS_LIMIT);
  }

  @Test
  void expiredIteratorIsReplacedFromPosition() {
    givenIterator("fresh");
    when(client.getRecords(any(GetRecordsRequest.class)))
            .thenThrow(ExpiredIteratorException.builder().message("expired").build())
            .thenReturn(GetRecordsResponse.builder().nextShardIterator("next").build());

    ShardPosition position = ShardPosition.afterSequence(SequenceNumber.of(7)).withContinuationToken("stale");
    RecordBatch batch = source.getRecords(STREAM, SHARD, position, 10);

    ArgumentCaptor<GetShardIteratorRequest> iteratorRequest = ArgumentCaptor.forClass(GetShardIteratorRequest.class);
    verify(client).getShardIterator(iteratorRequest.capture());
    assertThat(iteratorRequest.getValue().shardIteratorType()).isEqualTo(ShardIteratorType.AFTER_SEQUENCE_NUMBER);
    assertThat(iteratorRequest.getValue().startingSequenceNumber()).isEqualTo("7");
    assertThat(batch.records()).isEmpty();
    assertThat(batch.nextPosition().afterSequence()).hasValue(SequenceNumber.of(7));
    assertThat(batch.nextPosition().continuationToken()).hasValue("next");
  }

  @Test
  void missingNextIteratorMeansShardIsExhausted() {
    when(client.getRecords(any(GetRecordsRequest.class)))
            .thenReturn(GetRecordsResponse.builder().records(record("3")).build());

    RecordBatch batch = source.getRecords(STREAM, SHARD,
            ShardPosition.afterSequence(SequenceNumber.of(1)).withContinuationToken("iterator"), 10);

    assertThat(batch.shardExhausted()).isTrue();
    assertThat(batch.nextPosition().continuationToken()).isEmpty();
  }

  @Test
  void throttledReadIsTranslated() {
    when(client.getRecords(any(GetRecordsRequest.class)))
            .thenThrow(ProvisionedThroughputExceededException.builder().message("slow down").build());

    assertThrows(ThrottledException.class, () -> source.getRecords(STREAM, SHARD,
            ShardPosition.initial(InitialPosition.LATEST).withContinuationToken("iterator"), 10));
  }

  private void givenIterator(String iterator) {
    when(client.getShardIterator(any(GetShardIteratorRequest.class)))
            .thenReturn(GetShardIteratorResponse.builder().shardIterator(iterator).build());
  }

  private static Record record(String sequenceNumber) {
    return Record.builder()
            .sequenceNumber(sequenceNumber)
            .partitionKey("partitionKey-" + sequenceNumber)
            .data(SdkBytes.fromUtf8String("testData-" + sequenceNumber))
            .build();
  }

  private static Shard shard(String shardId, String parent, String endingSequenceNumber) {
    return Shard.builder()
            .shardId(shardId)
            .parentShardId(parent)
            .sequenceNumberRange(SequenceNumberRange.builder()
                    .startingSequenceNumber("0")
                    .endingSequenceNumber(endingSequenceNumber)
                    .build())
            .build();
  }
}
