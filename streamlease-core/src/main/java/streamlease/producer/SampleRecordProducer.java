package streamlease.producer;

import com.google.common.util.concurrent.AbstractExecutionThreadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.config.ProducerConfig;
import streamlease.config.StreamConfig;
import streamlease.exceptions.TransientException;
import streamlease.model.PutResult;
import streamlease.sample.SampleRecordCodec;
import streamlease.spi.StreamAdmin;
import streamlease.spi.StreamProducer;
import streamlease.stream.StreamLifecycle;
import streamlease.util.concurrent.Sleeper;

import javax.inject.Inject;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Puts timestamped sample records onto the stream until stopped. Startup waits for the stream to be ACTIVE,
 * creating it if needed.
 */
public class SampleRecordProducer extends AbstractExecutionThreadService {
  private static final Logger LOG = LoggerFactory.getLogger(SampleRecordProducer.class);

  private final StreamLifecycle lifecycle;
  private final StreamAdmin admin;
  private final StreamProducer producer;
  private final ProducerConfig producerConfig;
  private final Sleeper sleeper;
  private final Clock clock;
  private final AtomicLong recordsPut = new AtomicLong();
  private volatile Thread runThread;

  @Inject
  public SampleRecordProducer(
          StreamLifecycle lifecycle,
          StreamAdmin admin,
          StreamProducer producer,
          ProducerConfig producerConfig,
          Sleeper sleeper,
          Clock clock
  ) {
    this.lifecycle = lifecycle;
    this.admin = admin;
    this.producer = producer;
    this.producerConfig = producerConfig;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public long recordsPut() {
    return recordsPut.get();
  }

  @Override
  protected void startUp() throws InterruptedException {
    runThread = Thread.currentThread();
    lifecycle.ensureStreamActive();
    LOG.info("List of my streams: ");
    for (String name : admin.listStreamNames()) {
      LOG.info("\t- {}", name);
    }
    LOG.info("Putting records in stream until this application is stopped...");
  }

  @Override
  protected void run() {
    runThread = Thread.currentThread();
    while (isRunning() && !Thread.currentThread().isInterrupted()) {
      long createTime = clock.millis();
      try {
        PutResult result = producer.put(SampleRecordCodec.partitionKey(createTime), SampleRecordCodec.encode(createTime));
        recordsPut.incrementAndGet();
        LOG.info("Successfully put record, partition key : {}, ShardID : {}, SequenceNumber : {}.",
                SampleRecordCodec.partitionKey(createTime), result.shardId(), result.sequenceNumber());
      } catch (TransientException e) {
        LOG.warn("Failed to put record, retrying: {}", e.getMessage());
      }

      if (!producerConfig.putInterval().isZero()) {
        try {
          sleeper.sleep(producerConfig.putInterval());
        } catch (InterruptedException e) {
          return;
        }
      }
    }
  }

  @Override
  protected void triggerShutdown() {
    Thread thread = runThread;
    if (thread != null) thread.interrupt();
  }

  @Override
  protected void shutDown() {
    LOG.info("Stopped producing after {} record(s)", recordsPut.get());
  }
}
