package streamlease.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.config.RetryPolicy;
import streamlease.exceptions.LeaseConflictException;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.exceptions.TransientException;
import streamlease.model.SequenceNumber;
import streamlease.processor.Checkpointer;
import streamlease.util.concurrent.Sleeper;

import java.util.function.Consumer;

/**
 * Writes checkpoints with bounded retry. Throttling and other transient store failures are retried after a fixed
 * backoff, up to {@link RetryPolicy#numRetries} attempts; a lost lease or a broken lease table ends the attempt
 * immediately. No failure escapes to the caller: the outcome is reported as a {@link CheckpointResult}.
 */
public class CheckpointManager {
  private static final Logger LOG = LoggerFactory.getLogger(CheckpointManager.class);

  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public CheckpointManager(RetryPolicy retryPolicy, Sleeper sleeper) {
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  public CheckpointResult checkpoint(Checkpointer checkpointer) {
    return checkpointWithRetries(checkpointer, Checkpointer::checkpoint, "latest");
  }

  public CheckpointResult checkpoint(Checkpointer checkpointer, SequenceNumber sequenceNumber) {
    return checkpointWithRetries(checkpointer, c -> c.checkpoint(sequenceNumber), sequenceNumber);
  }

  private CheckpointResult checkpointWithRetries(Checkpointer checkpointer, Consumer<Checkpointer> write, Object target) {
    LOG.info("Checkpointing shard {} at {}", checkpointer.shardId(), target);
    int maxAttempts = retryPolicy.numRetries();
    for (int attempt = 1; ; attempt++) {
      try {
        write.accept(checkpointer);
        return CheckpointResult.SUCCEEDED;
      } catch (LeaseConflictException e) {
        LOG.info("Lease for shard {} is held by another worker, skipping checkpoint: {}", checkpointer.shardId(), e.getMessage());
        return CheckpointResult.LEASE_LOST;
      } catch (LeaseStoreSchemaException e) {
        LOG.error("Cannot save checkpoint for shard {} to the lease table", checkpointer.shardId(), e);
        return CheckpointResult.FATAL;
      } catch (TransientException e) {
        if (attempt >= maxAttempts) {
          LOG.error("Checkpoint for shard {} failed after {} attempts", checkpointer.shardId(), attempt, e);
          return CheckpointResult.GAVE_UP;
        }
        LOG.info("Transient issue when checkpointing shard {}, attempt {} of {}: {}",
                checkpointer.shardId(), attempt, maxAttempts, e.getMessage());
      }

      try {
        sleeper.sleep(retryPolicy.backoff());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while retrying checkpoint for shard {}", checkpointer.shardId());
        return CheckpointResult.GAVE_UP;
      }
    }
  }
}
