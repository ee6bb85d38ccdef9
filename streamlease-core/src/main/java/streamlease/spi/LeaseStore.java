package streamlease.spi;

import streamlease.exceptions.LeaseConflictException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable, shared table of per-shard leases and checkpoints. Every mutation of an existing lease is a
 * compare-and-set on the lease counter; implementations raise {@link LeaseConflictException} when the expected
 * counter (or owner) does not match. Lease expiry is judged against the store's own clock.
 *
 * <p>Retryable failures are raised as {@link streamlease.exceptions.TransientException}, and a missing or
 * malformed table as {@link streamlease.exceptions.LeaseStoreSchemaException}.
 */
public interface LeaseStore {
  Optional<Lease> readLease(ShardId shardId);

  List<Lease> listLeases();

  /**
   * Inserts an unassigned lease for the shard if none exists yet; an existing lease is left untouched.
   */
  void createLeaseIfAbsent(ShardId shardId, Set<ShardId> parentShardIds);

  default void createLeaseIfAbsent(ShardId shardId) {
    createLeaseIfAbsent(shardId, Set.of());
  }

  /**
   * Takes or extends ownership of the lease. Succeeds only if the stored counter equals {@code expectedCounter}
   * and the lease is unowned, already owned by {@code workerId}, or expired. On success the counter is incremented
   * and the expiry pushed out by the lease TTL.
   *
   * @return the lease as stored after the update
   * @throws LeaseConflictException if the lease was changed by someone else or is held by a live owner
   */
  Lease acquireOrRenew(ShardId shardId, WorkerId workerId, long expectedCounter);

  /**
   * Records a checkpoint, conditional on the lease counter still equalling {@code leaseCounter}. A checkpoint that
   * is lower than the stored one is ignored.
   *
   * @throws LeaseConflictException if the counter no longer matches
   */
  void writeCheckpoint(ShardId shardId, long leaseCounter, Checkpoint checkpoint);

  /**
   * Gives up ownership so another worker may take the lease without waiting for it to expire.
   *
   * @throws LeaseConflictException if the caller no longer holds the lease at {@code leaseCounter}
   */
  void releaseLease(ShardId shardId, WorkerId workerId, long leaseCounter);
}
