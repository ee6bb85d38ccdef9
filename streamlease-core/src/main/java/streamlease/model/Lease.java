package streamlease.model;

import org.immutables.value.Value;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * One row of the lease table. The {@link #counter} increases on every acquisition, renewal and release; every
 * mutation is conditional on the counter the writer last observed, so a superseded owner's writes are rejected.
 */
@Value.Immutable
public abstract class Lease {
  public static ImmutableLease.Builder builder() {
    return ImmutableLease.builder();
  }

  public static Lease unassigned(ShardId shardId, Set<ShardId> parentShardIds) {
    return builder()
            .shardId(shardId)
            .parentShardIds(parentShardIds)
            .counter(0)
            .expiresAt(Instant.EPOCH)
            .build();
  }

  public abstract ShardId shardId();

  public abstract Optional<WorkerId> owner();

  public abstract Instant expiresAt();

  public abstract Optional<Checkpoint> checkpoint();

  public abstract long counter();

  public abstract Set<ShardId> parentShardIds();

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt());
  }

  public boolean isOwnedBy(WorkerId workerId) {
    return owner().filter(workerId::equals).isPresent();
  }

  public boolean isAvailableTo(WorkerId workerId, Instant now) {
    return owner().isEmpty() || isOwnedBy(workerId) || isExpired(now);
  }

  public boolean isShardEnded() {
    return checkpoint().filter(Checkpoint::isShardEnd).isPresent();
  }

  public Lease withOwner(WorkerId owner, Instant expiresAt) {
    return ImmutableLease.copyOf(this).withOwner(owner).withExpiresAt(expiresAt).withCounter(counter() + 1);
  }

  public Lease released() {
    return ImmutableLease.copyOf(this).withOwner(Optional.empty()).withExpiresAt(Instant.EPOCH).withCounter(counter() + 1);
  }

  public Lease withCheckpoint(Checkpoint checkpoint) {
    return ImmutableLease.copyOf(this).withCheckpoint(checkpoint);
  }
}
