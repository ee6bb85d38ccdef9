package streamlease.processor;

/**
 * Why a {@link RecordProcessor} is being shut down, and therefore whether it may checkpoint.
 */
public enum ShutdownReason {
  /** The shard is closed and fully drained. The processor must checkpoint {@code SHARD_END}. */
  TERMINATED(true),
  /** The process is stopping while the lease is still held. The processor checkpoints its progress. */
  REQUESTED(true),
  /** Another worker owns the shard now. Checkpointing would fail and must not be attempted. */
  LEASE_LOST(false),
  /** The lease store cannot record progress for this shard. Checkpointing must not be attempted. */
  ABANDONED(false);

  private final boolean checkpointPermitted;

  ShutdownReason(boolean checkpointPermitted) {
    this.checkpointPermitted = checkpointPermitted;
  }

  public boolean isCheckpointPermitted() {
    return checkpointPermitted;
  }
}
