package streamlease.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The durable cursor stored with a {@link Lease}: either the sequence number of the last processed record, or
 * {@link #SHARD_END} once a closed shard has been fully drained. {@code SHARD_END} orders after every sequence number,
 * so checkpoints only ever move forward.
 */
public final class Checkpoint implements Comparable<Checkpoint> {
  public static final Checkpoint SHARD_END = new Checkpoint(null);
  private static final String SHARD_END_TOKEN = "SHARD_END";

  private final SequenceNumber sequenceNumber;

  private Checkpoint(SequenceNumber sequenceNumber) {
    this.sequenceNumber = sequenceNumber;
  }

  public static Checkpoint at(SequenceNumber sequenceNumber) {
    return new Checkpoint(Objects.requireNonNull(sequenceNumber, "sequenceNumber"));
  }

  public static Checkpoint parse(String value) {
    return SHARD_END_TOKEN.equals(value) ? SHARD_END : at(SequenceNumber.of(value));
  }

  public boolean isShardEnd() {
    return sequenceNumber == null;
  }

  public Optional<SequenceNumber> sequenceNumber() {
    return Optional.ofNullable(sequenceNumber);
  }

  public boolean isBefore(Checkpoint other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(Checkpoint o) {
    if (isShardEnd()) return o.isShardEnd() ? 0 : 1;
    if (o.isShardEnd()) return -1;
    return sequenceNumber.compareTo(o.sequenceNumber);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Checkpoint that && Objects.equals(sequenceNumber, that.sequenceNumber));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sequenceNumber);
  }

  @Override
  public String toString() {
    return isShardEnd() ? SHARD_END_TOKEN : sequenceNumber.toString();
  }
}
