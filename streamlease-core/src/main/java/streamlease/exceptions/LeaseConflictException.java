package streamlease.exceptions;

import streamlease.model.ShardId;

/**
 * A conditional lease-store mutation was rejected because the lease counter or owner no longer matches what the
 * caller last observed: the caller no longer holds the lease.
 */
public class LeaseConflictException extends StreamLeaseException {
  private final ShardId shardId;

  public LeaseConflictException(ShardId shardId, String message) {
    super("Lease conflict for shard " + shardId + ": " + message);
    this.shardId = shardId;
  }

  public LeaseConflictException(ShardId shardId, String message, Throwable cause) {
    super("Lease conflict for shard " + shardId + ": " + message, cause);
    this.shardId = shardId;
  }

  public ShardId shardId() {
    return shardId;
  }
}
