package streamlease.worker;

/**
 * How a {@link ShardWorker} finished, as seen by the coordinator.
 */
public enum ShardWorkerOutcome {
  /** Another worker won the lease before processing started. */
  NOT_ACQUIRED,
  /** The shard was drained and {@code SHARD_END} checkpointed; its children may now be processed. */
  SHARD_ENDED,
  LEASE_LOST,
  /** Stopped on request, or shard end could not be recorded; the lease was released for a later retry. */
  STOPPED,
  /** The lease store rejected checkpoints as unrecoverable; the shard is dropped by this worker. */
  SHARD_FAILED
}
