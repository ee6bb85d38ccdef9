package streamlease.checkpoint;

public enum CheckpointResult {
  SUCCEEDED,
  /** Retryable failures persisted past the retry bound, or the retry wait was interrupted. */
  GAVE_UP,
  /** The lease is owned by another worker; nothing was written. */
  LEASE_LOST,
  /** The lease store cannot accept checkpoints for this shard. */
  FATAL
}
