package streamlease.spi;

import streamlease.model.RecordBatch;
import streamlease.model.ShardDescriptor;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;

import java.util.List;

/**
 * Read side of a sharded record stream.
 *
 * <p>Implementations raise {@link streamlease.exceptions.TransientException} (or its
 * {@link streamlease.exceptions.ThrottledException} subtype) for retryable failures, and
 * {@link streamlease.exceptions.StreamNotFoundException} when the stream or shard does not exist.
 */
public interface StreamSource {
  /**
   * All shards currently known for the stream, including closed shards that are still retained.
   */
  List<ShardDescriptor> listShards(String streamName);

  /**
   * Returns up to {@code maxRecords} records from the shard, strictly after the given position and in
   * increasing sequence order. The returned {@link RecordBatch#nextPosition()} must be passed to the next call.
   */
  RecordBatch getRecords(String streamName, ShardId shardId, ShardPosition position, int maxRecords);
}
