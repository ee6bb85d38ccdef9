package streamlease.processor;

import streamlease.model.ShardId;
import streamlease.model.StreamRecord;

import java.util.List;

/**
 * Application callback for one shard. An instance is created per leased shard and driven by a single thread:
 * {@link #initialize} once, then {@link #processRecords} for each batch in sequence order, then at most one
 * {@link #shutdown}.
 */
public interface RecordProcessor {
  void initialize(ShardId shardId);

  void processRecords(List<StreamRecord> records, Checkpointer checkpointer);

  void shutdown(ShutdownReason reason, Checkpointer checkpointer);
}
