package streamlease.memory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;
import streamlease.exceptions.StreamNotFoundException;
import streamlease.model.InitialPosition;
import streamlease.model.PutResult;
import streamlease.model.RecordBatch;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardDescriptor;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;
import streamlease.model.StreamRecord;
import streamlease.model.StreamStatus;
import streamlease.spi.StreamAdmin;
import streamlease.spi.StreamProducer;
import streamlease.spi.StreamSource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Process-local streams with Kinesis-like shard semantics: records are routed to an open shard by partition key,
 * sequence numbers increase within each stream, and splitting or merging closes the affected shards and opens
 * children that name them as parents. Closed shards keep their records, so readers can drain them.
 *
 * <p>Read positions carry the index of the next record as their continuation token.
 */
public class InMemoryStream implements StreamSource, StreamAdmin {
  private final Clock clock;
  private final Map<String, StreamState> streams = new TreeMap<>();
  private final Deque<RuntimeException> injectedReadFailures = new ArrayDeque<>();

  public InMemoryStream(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized StreamStatus describeStream(String streamName) {
    return requireStream(streamName).status;
  }

  @Override
  public synchronized void createStream(String streamName, int shardCount) {
    checkArgument(shardCount > 0, "shardCount must be positive: %s", shardCount);
    checkState(!streams.containsKey(streamName), "Stream %s already exists", streamName);
    StreamState stream = new StreamState();
    for (int i = 0; i < shardCount; i++) {
      stream.openShard(Set.of());
    }
    streams.put(streamName, stream);
  }

  @Override
  public synchronized boolean deleteStream(String streamName) {
    return streams.remove(streamName) != null;
  }

  @Override
  public synchronized List<String> listStreamNames() {
    return ImmutableList.copyOf(streams.keySet());
  }

  @Override
  public synchronized List<ShardDescriptor> listShards(String streamName) {
    return requireStream(streamName).shards.values().stream()
            .map(ShardLog::descriptor)
            .collect(ImmutableList.toImmutableList());
  }

  @Override
  public synchronized RecordBatch getRecords(String streamName, ShardId shardId, ShardPosition position, int maxRecords) {
    RuntimeException injected = injectedReadFailures.poll();
    if (injected != null) throw injected;

    ShardLog shard = requireStream(streamName).requireShard(shardId);
    int start = position.continuationToken().map(Integer::parseInt).orElseGet(() -> shard.startIndex(position));
    int end = Math.min(shard.records.size(), start + maxRecords);
    List<StreamRecord> records = ImmutableList.copyOf(shard.records.subList(start, end));

    ShardPosition next = records.isEmpty()
            ? position
            : ShardPosition.afterSequence(records.get(records.size() - 1).sequenceNumber());
    return RecordBatch.builder()
            .records(records)
            .nextPosition(next.withContinuationToken(Integer.toString(end)))
            .shardExhausted(shard.closed && end == shard.records.size())
            .millisBehindLatest(0L)
            .build();
  }

  public StreamProducer producer(String streamName) {
    return (partitionKey, data) -> put(streamName, partitionKey, data);
  }

  public synchronized PutResult put(String streamName, String partitionKey, byte[] data) {
    StreamState stream = requireStream(streamName);
    List<ShardLog> openShards = stream.shards.values().stream().filter(s -> !s.closed).collect(Collectors.toList());
    int hash = Hashing.murmur3_32_fixed().hashString(partitionKey, StandardCharsets.UTF_8).asInt();
    ShardLog shard = openShards.get(Math.floorMod(hash, openShards.size()));

    SequenceNumber sequenceNumber = SequenceNumber.of(++stream.lastSequenceNumber);
    shard.records.add(StreamRecord.builder()
            .shardId(shard.shardId)
            .partitionKey(partitionKey)
            .sequenceNumber(sequenceNumber)
            .data(data)
            .approximateArrivalTimestamp(clock.instant())
            .build());
    return PutResult.of(shard.shardId, sequenceNumber);
  }

  /**
   * Closes the shard and opens two children in its place.
   */
  public synchronized List<ShardId> splitShard(String streamName, ShardId shardId) {
    StreamState stream = requireStream(streamName);
    stream.requireOpenShard(shardId).closed = true;
    return ImmutableList.of(stream.openShard(Set.of(shardId)), stream.openShard(Set.of(shardId)));
  }

  /**
   * Closes both shards and opens a single child of the two.
   */
  public synchronized ShardId mergeShards(String streamName, ShardId first, ShardId second) {
    checkArgument(!first.equals(second), "Cannot merge a shard with itself");
    StreamState stream = requireStream(streamName);
    stream.requireOpenShard(first).closed = true;
    stream.requireOpenShard(second).closed = true;
    return stream.openShard(ImmutableSet.of(first, second));
  }

  /**
   * The next {@link #getRecords} call, on any shard, throws the given exception instead of reading.
   */
  public synchronized void failNextRead(RuntimeException failure) {
    injectedReadFailures.add(failure);
  }

  private StreamState requireStream(String streamName) {
    StreamState stream = streams.get(streamName);
    if (stream == null) throw new StreamNotFoundException("Stream " + streamName + " not found");
    return stream;
  }

  private static class StreamState {
    final StreamStatus status = StreamStatus.ACTIVE;
    final Map<ShardId, ShardLog> shards = new LinkedHashMap<>();
    long lastSequenceNumber = 0;

    ShardId openShard(Set<ShardId> parents) {
      ShardId shardId = ShardId.of(String.format("shardId-%012d", shards.size()));
      shards.put(shardId, new ShardLog(shardId, parents));
      return shardId;
    }

    ShardLog requireShard(ShardId shardId) {
      ShardLog shard = shards.get(shardId);
      if (shard == null) throw new StreamNotFoundException("Shard " + shardId + " not found");
      return shard;
    }

    ShardLog requireOpenShard(ShardId shardId) {
      ShardLog shard = requireShard(shardId);
      checkState(!shard.closed, "Shard %s is already closed", shardId);
      return shard;
    }
  }

  private static class ShardLog {
    final ShardId shardId;
    final Set<ShardId> parents;
    final List<StreamRecord> records = new ArrayList<>();
    boolean closed = false;

    ShardLog(ShardId shardId, Set<ShardId> parents) {
      this.shardId = shardId;
      this.parents = parents;
    }

    int startIndex(ShardPosition position) {
      if (position.afterSequence().isPresent()) {
        SequenceNumber after = position.afterSequence().get();
        int index = 0;
        while (index < records.size() && !records.get(index).sequenceNumber().isAfter(after)) index++;
        return index;
      }
      return position.initialPosition().orElseThrow() == InitialPosition.TRIM_HORIZON ? 0 : records.size();
    }

    ShardDescriptor descriptor() {
      return ShardDescriptor.builder().shardId(shardId).parentShardIds(parents).closed(closed).build();
    }
  }
}
