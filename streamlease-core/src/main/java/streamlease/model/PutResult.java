package streamlease.model;

import org.immutables.value.Value;

@Value.Immutable
public interface PutResult {
  static PutResult of(ShardId shardId, SequenceNumber sequenceNumber) {
    return ImmutablePutResult.of(shardId, sequenceNumber);
  }

  @Value.Parameter
  ShardId shardId();

  @Value.Parameter
  SequenceNumber sequenceNumber();
}
