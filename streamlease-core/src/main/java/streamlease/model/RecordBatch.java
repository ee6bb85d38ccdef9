package streamlease.model;

import org.immutables.value.Value;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One pull from a shard. {@link #shardExhausted} is true once the shard is closed and every record it will ever
 * contain has been returned.
 */
@Value.Immutable
public interface RecordBatch {
  static ImmutableRecordBatch.Builder builder() {
    return ImmutableRecordBatch.builder();
  }

  List<StreamRecord> records();

  ShardPosition nextPosition();

  boolean shardExhausted();

  Optional<Long> millisBehindLatest();

  default Optional<SequenceNumber> lastSequenceNumber() {
    return records().isEmpty()
            ? Optional.empty()
            : Optional.of(records().get(records().size() - 1).sequenceNumber());
  }

  @Value.Check
  default void checkOrdering() {
    for (int i = 1; i < records().size(); i++) {
      checkArgument(records().get(i).sequenceNumber().isAfter(records().get(i - 1).sequenceNumber()),
              "Records must be in strictly increasing sequence order");
    }
  }
}
