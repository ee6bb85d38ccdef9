package streamlease.aws.kinesis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.ExpiredIteratorException;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.Shard;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;
import streamlease.model.InitialPosition;
import streamlease.model.RecordBatch;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardDescriptor;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;
import streamlease.model.StreamRecord;
import streamlease.spi.StreamSource;

import javax.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads Kinesis shards with {@code GetRecords}. The shard iterator returned with each batch travels as the
 * position's continuation token; when it has expired a fresh iterator is requested from the position itself.
 */
public class KinesisStreamSource implements StreamSource {
  private static final Logger LOG = LoggerFactory.getLogger(KinesisStreamSource.class);
  static final int MAX_GET_RECORDS_LIMIT = 10000;

  private final KinesisClient client;

  @Inject
  public KinesisStreamSource(KinesisClient client) {
    this.client = client;
  }

  @Override
  public List<ShardDescriptor> listShards(String streamName) {
    ImmutableList.Builder<ShardDescriptor> shards = ImmutableList.builder();
    String nextToken = null;
    do {
      // a paginated request must name the token and not the stream
      ListShardsRequest request = nextToken == null
              ? ListShardsRequest.builder().streamName(streamName).build()
              : ListShardsRequest.builder().nextToken(nextToken).build();
      ListShardsResponse response = KinesisExceptions.call("ListShards for " + streamName, () -> client.listShards(request));
      response.shards().stream().map(KinesisStreamSource::toDescriptor).forEach(shards::add);
      nextToken = response.nextToken();
    } while (nextToken != null);
    return shards.build();
  }

  @Override
  public RecordBatch getRecords(String streamName, ShardId shardId, ShardPosition position, int maxRecords) {
    String iterator = position.continuationToken().orElseGet(() -> shardIterator(streamName, shardId, position));
    int limit = Math.min(maxRecords, MAX_GET_RECORDS_LIMIT);

    GetRecordsResponse response;
    try {
      response = client.getRecords(getRecordsRequest(iterator, limit));
    } catch (ExpiredIteratorException e) {
      LOG.info("Shard iterator for {} expired, requesting a new one from {}", shardId, position);
      String freshIterator = shardIterator(streamName, shardId, position);
      response = KinesisExceptions.call("GetRecords for " + shardId, () -> client.getRecords(getRecordsRequest(freshIterator, limit)));
    } catch (SdkException e) {
      throw KinesisExceptions.translate("GetRecords for " + shardId, e);
    }

    List<StreamRecord> records = response.records().stream()
            .map(record -> StreamRecord.builder()
                    .shardId(shardId)
                    .partitionKey(record.partitionKey())
                    .sequenceNumber(SequenceNumber.of(record.sequenceNumber()))
                    .data(record.data().asByteArray())
                    .approximateArrivalTimestamp(Optional.ofNullable(record.approximateArrivalTimestamp()))
                    .build())
            .collect(ImmutableList.toImmutableList());

    ShardPosition next = records.isEmpty()
            ? position.withoutContinuationToken()
            : ShardPosition.afterSequence(records.get(records.size() - 1).sequenceNumber());
    String nextIterator = response.nextShardIterator();
    return RecordBatch.builder()
            .records(records)
            .nextPosition(nextIterator == null ? next : next.withContinuationToken(nextIterator))
            .shardExhausted(nextIterator == null)
            .millisBehindLatest(Optional.ofNullable(response.millisBehindLatest()))
            .build();
  }

  private String shardIterator(String streamName, ShardId shardId, ShardPosition position) {
    GetShardIteratorRequest.Builder request = GetShardIteratorRequest.builder()
            .streamName(streamName)
            .shardId(shardId.id());
    position.afterSequence().ifPresentOrElse(
            seq -> request.shardIteratorType(ShardIteratorType.AFTER_SEQUENCE_NUMBER).startingSequenceNumber(seq.toString()),
            () -> request.shardIteratorType(position.initialPosition().orElseThrow() == InitialPosition.TRIM_HORIZON
                    ? ShardIteratorType.TRIM_HORIZON
                    : ShardIteratorType.LATEST)
    );
    return KinesisExceptions.call("GetShardIterator for " + shardId, () -> client.getShardIterator(request.build())).shardIterator();
  }

  private static GetRecordsRequest getRecordsRequest(String iterator, int limit) {
    return GetRecordsRequest.builder().shardIterator(iterator).limit(limit).build();
  }

  static ShardDescriptor toDescriptor(Shard shard) {
    return ShardDescriptor.builder()
            .shardId(ShardId.of(shard.shardId()))
            .parentShardIds(Stream.of(shard.parentShardId(), shard.adjacentParentShardId())
                    .filter(Objects::nonNull)
                    .map(ShardId::of)
                    .collect(ImmutableSet.toImmutableSet()))
            .closed(shard.sequenceNumberRange() != null && shard.sequenceNumberRange().endingSequenceNumber() != null)
            .build();
  }
}
