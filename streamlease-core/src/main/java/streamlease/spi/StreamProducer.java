package streamlease.spi;

import streamlease.model.PutResult;

/**
 * Appends records to one stream. The partition key determines the destination shard.
 */
public interface StreamProducer {
  PutResult put(String partitionKey, byte[] data);
}
