package streamlease.model;

import org.immutables.value.Value;

/**
 * Opaque identifier of one shard within a stream.
 */
@Value.Immutable(intern = true)
public abstract class ShardId implements Comparable<ShardId> {
  public static ShardId of(String id) {
    return ImmutableShardId.of(id);
  }

  @Value.Parameter
  public abstract String id();

  @Override
  public int compareTo(ShardId o) {
    return id().compareTo(o.id());
  }

  @Override
  public String toString() {
    return id();
  }
}
