package streamlease.testing;

import streamlease.memory.InMemoryLeaseStore;
import streamlease.model.Checkpoint;
import streamlease.model.ShardId;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * An {@link InMemoryLeaseStore} that remembers every checkpoint write it accepted, in order.
 */
public class RecordingLeaseStore extends InMemoryLeaseStore {
  private final List<ShardCheckpoint> checkpoints = new CopyOnWriteArrayList<>();

  public RecordingLeaseStore(Duration leaseTtl, Clock clock) {
    super(leaseTtl, clock);
  }

  @Override
  public synchronized void writeCheckpoint(ShardId shardId, long leaseCounter, Checkpoint checkpoint) {
    super.writeCheckpoint(shardId, leaseCounter, checkpoint);
    checkpoints.add(new ShardCheckpoint(shardId, checkpoint));
  }

  public List<Checkpoint> checkpointsFor(ShardId shardId) {
    return checkpoints.stream()
            .filter(c -> c.shardId().equals(shardId))
            .map(ShardCheckpoint::checkpoint)
            .collect(Collectors.toList());
  }

  public record ShardCheckpoint(ShardId shardId, Checkpoint checkpoint) {
  }
}
