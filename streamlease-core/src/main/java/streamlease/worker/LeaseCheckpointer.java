package streamlease.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.exceptions.LeaseConflictException;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardId;
import streamlease.processor.Checkpointer;
import streamlease.spi.LeaseStore;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The {@link Checkpointer} a {@link ShardWorker} hands to its processor. Writes are conditional on the lease counter
 * from the worker's most recent renewal, and are constrained to positions the processor has actually been given:
 * never beyond the last delivered record (or {@code SHARD_END} once drained) and never behind the last checkpoint.
 *
 * <p>A conflict or schema failure is remembered so the worker can react after the processor returns; once the lease
 * is known to be lost no further writes are sent to the store.
 */
class LeaseCheckpointer implements Checkpointer {
  private static final Logger LOG = LoggerFactory.getLogger(LeaseCheckpointer.class);

  private final ShardId shardId;
  private final LeaseStore leaseStore;
  private long leaseCounter;
  private Checkpoint lastCheckpoint;
  private Checkpoint largestPermitted;
  private boolean leaseLost = false;
  private LeaseStoreSchemaException storeFailure;

  LeaseCheckpointer(LeaseStore leaseStore, Lease lease) {
    this.shardId = lease.shardId();
    this.leaseStore = leaseStore;
    this.leaseCounter = lease.counter();
    this.lastCheckpoint = lease.checkpoint().orElse(null);
  }

  @Override
  public ShardId shardId() {
    return shardId;
  }

  void leaseRenewed(Lease lease) {
    checkArgument(lease.shardId().equals(shardId), "Lease for wrong shard: %s", lease.shardId());
    leaseCounter = lease.counter();
  }

  void recordsDelivered(SequenceNumber lastDelivered) {
    checkState(largestPermitted == null || !largestPermitted.isShardEnd(), "Shard %s already ended", shardId);
    largestPermitted = Checkpoint.at(lastDelivered);
  }

  void shardEnded() {
    largestPermitted = Checkpoint.SHARD_END;
  }

  long leaseCounter() {
    return leaseCounter;
  }

  boolean isLeaseLost() {
    return leaseLost;
  }

  Optional<LeaseStoreSchemaException> storeFailure() {
    return Optional.ofNullable(storeFailure);
  }

  boolean isShardEndCheckpointed() {
    return lastCheckpoint != null && lastCheckpoint.isShardEnd();
  }

  @Override
  public Optional<Checkpoint> lastCheckpoint() {
    return Optional.ofNullable(lastCheckpoint);
  }

  @Override
  public void checkpoint() {
    if (largestPermitted == null) {
      LOG.debug("Nothing delivered from shard {} yet, no checkpoint to write", shardId);
      return;
    }
    write(largestPermitted);
  }

  @Override
  public void checkpoint(SequenceNumber sequenceNumber) {
    Checkpoint checkpoint = Checkpoint.at(sequenceNumber);
    checkArgument(largestPermitted != null && !largestPermitted.isBefore(checkpoint),
            "Cannot checkpoint shard %s at %s: largest delivered is %s", shardId, sequenceNumber, largestPermitted);
    write(checkpoint);
  }

  private void write(Checkpoint checkpoint) {
    if (leaseLost) throw new LeaseConflictException(shardId, "lease already lost, checkpoint not written");
    if (storeFailure != null) throw storeFailure;
    checkArgument(lastCheckpoint == null || !checkpoint.isBefore(lastCheckpoint),
            "Checkpoint for shard %s would move backwards: %s < %s", shardId, checkpoint, lastCheckpoint);

    try {
      leaseStore.writeCheckpoint(shardId, leaseCounter, checkpoint);
    } catch (LeaseConflictException e) {
      leaseLost = true;
      throw e;
    } catch (LeaseStoreSchemaException e) {
      storeFailure = e;
      throw e;
    }
    lastCheckpoint = checkpoint;
    LOG.debug("Checkpointed shard {} at {}", shardId, checkpoint);
  }
}
