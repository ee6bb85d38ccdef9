package streamlease.processor;

import streamlease.model.StreamRecord;

/**
 * Applies one decoded record. Any exception is treated as a processing failure and the record is retried.
 */
@FunctionalInterface
public interface RecordHandler<T> {
  void handle(StreamRecord record, T value) throws Exception;
}
