package streamlease.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.config.StreamConfig;
import streamlease.exceptions.StreamActivationTimeoutException;
import streamlease.exceptions.StreamDeletingException;
import streamlease.exceptions.StreamNotFoundException;
import streamlease.model.StreamStatus;
import streamlease.spi.StreamAdmin;
import streamlease.util.concurrent.Deadline;
import streamlease.util.concurrent.Sleeper;

import javax.inject.Inject;
import java.time.Clock;

/**
 * Creates streams on demand and waits for them to become usable.
 */
public class StreamLifecycle {
  private static final Logger LOG = LoggerFactory.getLogger(StreamLifecycle.class);

  private final StreamAdmin admin;
  private final StreamConfig config;
  private final Sleeper sleeper;
  private final Clock clock;

  @Inject
  public StreamLifecycle(StreamAdmin admin, StreamConfig config, Sleeper sleeper, Clock clock) {
    this.admin = admin;
    this.config = config;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public void ensureStreamActive() throws InterruptedException {
    ensureStreamActive(config.name(), config.shardCount());
  }

  /**
   * Returns once the stream is ACTIVE, creating it with {@code shardCount} shards if it does not exist.
   *
   * @throws StreamDeletingException if the stream is being deleted
   * @throws StreamActivationTimeoutException if the stream is not ACTIVE within the configured timeout
   */
  public void ensureStreamActive(String streamName, int shardCount) throws InterruptedException {
    try {
      StreamStatus status = admin.describeStream(streamName);
      LOG.info("Stream {} has a status of {}", streamName, status);
      if (status == StreamStatus.ACTIVE) return;
      if (status == StreamStatus.DELETING) {
        LOG.info("Stream {} is being deleted", streamName);
        throw new StreamDeletingException(streamName);
      }
    } catch (StreamNotFoundException e) {
      LOG.info("Stream {} does not exist. Creating it now with {} shard(s).", streamName, shardCount);
      admin.createStream(streamName, shardCount);
    }
    waitForStreamToBecomeActive(streamName);
  }

  private void waitForStreamToBecomeActive(String streamName) throws InterruptedException {
    LOG.info("Waiting for stream {} to become ACTIVE...", streamName);
    Deadline deadline = Deadline.within(config.activationTimeout(), clock);
    while (!deadline.isExpired()) {
      sleeper.sleep(config.activationPollInterval());
      try {
        StreamStatus status = admin.describeStream(streamName);
        LOG.info("\t- current state: {}", status);
        if (status == StreamStatus.ACTIVE) return;
        if (status == StreamStatus.DELETING) throw new StreamDeletingException(streamName);
      } catch (StreamNotFoundException e) {
        LOG.debug("Stream {} not visible yet", streamName);
      }
    }
    throw new StreamActivationTimeoutException(streamName, config.activationTimeout());
  }

  public boolean deleteStreamIfExists(String streamName) {
    boolean deleted = admin.deleteStream(streamName);
    if (deleted) {
      LOG.info("Deleting the stream {}", streamName);
    } else {
      LOG.info("Stream {} does not exist", streamName);
    }
    return deleted;
  }
}
