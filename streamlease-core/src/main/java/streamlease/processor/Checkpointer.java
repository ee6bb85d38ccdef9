package streamlease.processor;

import streamlease.model.Checkpoint;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardId;

import java.util.Optional;

/**
 * Records progress for the shard a {@link RecordProcessor} is bound to.
 *
 * <p>Writes are conditional on the worker still holding the lease, and may fail with
 * {@link streamlease.exceptions.LeaseConflictException} (lease lost),
 * {@link streamlease.exceptions.ThrottledException} / {@link streamlease.exceptions.TransientException}
 * (retryable) or {@link streamlease.exceptions.LeaseStoreSchemaException} (fatal for the shard).
 */
public interface Checkpointer {
  ShardId shardId();

  /**
   * Checkpoints the furthest permitted position: the last record delivered to the processor, or
   * {@link Checkpoint#SHARD_END} once the shard has been drained.
   */
  void checkpoint();

  /**
   * Checkpoints a specific delivered record.
   *
   * @throws IllegalArgumentException if the sequence number was never delivered, or precedes the last checkpoint
   */
  void checkpoint(SequenceNumber sequenceNumber);

  Optional<Checkpoint> lastCheckpoint();
}
