package streamlease.model;

import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;

@Value.Immutable
public interface StreamRecord {
  static ImmutableStreamRecord.Builder builder() {
    return ImmutableStreamRecord.builder();
  }

  ShardId shardId();

  String partitionKey();

  SequenceNumber sequenceNumber();

  byte[] data();

  Optional<Instant> approximateArrivalTimestamp();
}
