package streamlease.spi;

import streamlease.model.StreamStatus;

import java.util.List;

public interface StreamAdmin {
  /**
   * @throws streamlease.exceptions.StreamNotFoundException if the stream does not exist
   */
  StreamStatus describeStream(String streamName);

  void createStream(String streamName, int shardCount);

  /**
   * @return false if the stream did not exist
   */
  boolean deleteStream(String streamName);

  List<String> listStreamNames();
}
