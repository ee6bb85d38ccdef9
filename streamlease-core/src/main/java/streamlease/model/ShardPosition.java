package streamlease.model;

import org.immutables.value.Value;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The read cursor for a shard: either an {@link InitialPosition} or "strictly after" a sequence number.
 * Backends may attach an opaque {@link #continuationToken} to the position they return with a batch, and reuse it
 * when that same position is passed back for the next read.
 */
@Value.Immutable
public abstract class ShardPosition {
  public static ShardPosition initial(InitialPosition initialPosition) {
    return ImmutableShardPosition.builder().initialPosition(initialPosition).build();
  }

  public static ShardPosition afterSequence(SequenceNumber sequenceNumber) {
    return ImmutableShardPosition.builder().afterSequence(sequenceNumber).build();
  }

  public static ShardPosition resumeFrom(Optional<Checkpoint> checkpoint, InitialPosition initialPosition) {
    return checkpoint.flatMap(Checkpoint::sequenceNumber)
            .map(ShardPosition::afterSequence)
            .orElseGet(() -> initial(initialPosition));
  }

  public abstract Optional<InitialPosition> initialPosition();

  public abstract Optional<SequenceNumber> afterSequence();

  @Value.Auxiliary
  public abstract Optional<String> continuationToken();

  public ShardPosition withContinuationToken(String token) {
    return ImmutableShardPosition.copyOf(this).withContinuationToken(token);
  }

  public ShardPosition withoutContinuationToken() {
    return ImmutableShardPosition.copyOf(this).withContinuationToken(Optional.empty());
  }

  @Value.Check
  protected void check() {
    checkArgument(initialPosition().isPresent() != afterSequence().isPresent(),
            "Exactly one of initialPosition or afterSequence must be set");
  }

  @Override
  public String toString() {
    return afterSequence().map(seq -> "AFTER_SEQUENCE_NUMBER(" + seq + ")")
            .orElseGet(() -> initialPosition().orElseThrow().name());
  }
}
