package streamlease.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.exceptions.LeaseConflictException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;
import streamlease.spi.LeaseStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link LeaseStore} held in process memory. Every operation is atomic with respect to the others, which gives
 * the same compare-and-set semantics as a conditional write against a shared table.
 */
public class InMemoryLeaseStore implements LeaseStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryLeaseStore.class);

  private final Duration leaseTtl;
  private final Clock clock;
  private final Map<ShardId, Lease> leases = new LinkedHashMap<>();

  public InMemoryLeaseStore(Duration leaseTtl, Clock clock) {
    this.leaseTtl = leaseTtl;
    this.clock = clock;
  }

  @Override
  public synchronized Optional<Lease> readLease(ShardId shardId) {
    return Optional.ofNullable(leases.get(shardId));
  }

  @Override
  public synchronized List<Lease> listLeases() {
    return new ArrayList<>(leases.values());
  }

  @Override
  public synchronized void createLeaseIfAbsent(ShardId shardId, Set<ShardId> parentShardIds) {
    leases.computeIfAbsent(shardId, id -> {
      LOG.debug("Created lease for shard {}", id);
      return Lease.unassigned(id, parentShardIds);
    });
  }

  @Override
  public synchronized Lease acquireOrRenew(ShardId shardId, WorkerId workerId, long expectedCounter) {
    Lease lease = requireLease(shardId);
    checkCounter(lease, expectedCounter);
    Instant now = clock.instant();
    if (!lease.isAvailableTo(workerId, now)) {
      throw new LeaseConflictException(shardId, "held by " + lease.owner().orElseThrow() + " until " + lease.expiresAt());
    }
    Lease updated = lease.withOwner(workerId, now.plus(leaseTtl));
    leases.put(shardId, updated);
    return updated;
  }

  @Override
  public synchronized void writeCheckpoint(ShardId shardId, long leaseCounter, Checkpoint checkpoint) {
    Lease lease = requireLease(shardId);
    checkCounter(lease, leaseCounter);
    if (lease.checkpoint().filter(checkpoint::isBefore).isPresent()) {
      LOG.debug("Ignoring checkpoint {} for shard {}, already at {}", checkpoint, shardId, lease.checkpoint().get());
      return;
    }
    leases.put(shardId, lease.withCheckpoint(checkpoint));
  }

  @Override
  public synchronized void releaseLease(ShardId shardId, WorkerId workerId, long leaseCounter) {
    Lease lease = requireLease(shardId);
    checkCounter(lease, leaseCounter);
    if (!lease.isOwnedBy(workerId)) throw new LeaseConflictException(shardId, "not owned by " + workerId);
    leases.put(shardId, lease.released());
  }

  private Lease requireLease(ShardId shardId) {
    Lease lease = leases.get(shardId);
    if (lease == null) throw new LeaseConflictException(shardId, "no such lease");
    return lease;
  }

  private static void checkCounter(Lease lease, long expectedCounter) {
    if (lease.counter() != expectedCounter) {
      throw new LeaseConflictException(lease.shardId(), "expected counter " + expectedCounter + " but was " + lease.counter());
    }
  }
}
