package streamlease.model;

import org.immutables.value.Value;

import java.util.Set;

/**
 * Shard metadata as reported by the stream: its parents (one after a split, two after a merge) and whether it is
 * closed to new records.
 */
@Value.Immutable
public interface ShardDescriptor {
  static ImmutableShardDescriptor.Builder builder() {
    return ImmutableShardDescriptor.builder();
  }

  static ShardDescriptor open(ShardId shardId) {
    return builder().shardId(shardId).closed(false).build();
  }

  ShardId shardId();

  Set<ShardId> parentShardIds();

  boolean closed();
}
