package streamlease.processor;

import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.checkpoint.CheckpointManager;
import streamlease.config.ConsumerConfig;
import streamlease.config.RetryPolicy;
import streamlease.exceptions.RecordDecodeException;
import streamlease.model.SequenceNumber;
import streamlease.model.ShardId;
import streamlease.model.StreamRecord;
import streamlease.spi.RecordDecoder;
import streamlease.util.concurrent.IntervalTimer;
import streamlease.util.concurrent.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * A {@link RecordProcessor} that decodes each record and hands it to a {@link RecordHandler}, retrying failures a
 * bounded number of times before skipping the record. Records are processed strictly in order; a failing record
 * never blocks the shard for longer than {@code numRetries} attempts.
 *
 * <p>Malformed payloads (a {@link RecordDecodeException}) are rejected without retry. Progress is checkpointed at
 * the end of a batch once {@code checkpointInterval} has elapsed since the last attempt, and always on
 * {@link ShutdownReason#TERMINATED}.
 */
public class RetryingRecordProcessor<T> implements RecordProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(RetryingRecordProcessor.class);

  private final RecordDecoder<? extends T> decoder;
  private final RecordHandler<? super T> handler;
  private final RetryPolicy retryPolicy;
  private final CheckpointManager checkpointManager;
  private final IntervalTimer checkpointTimer;
  private final Sleeper sleeper;

  private ShardId shardId;
  private SequenceNumber lastProcessed;

  public RetryingRecordProcessor(
          RecordDecoder<? extends T> decoder,
          RecordHandler<? super T> handler,
          RetryPolicy retryPolicy,
          Duration checkpointInterval,
          Sleeper sleeper,
          Ticker ticker
  ) {
    this.decoder = decoder;
    this.handler = handler;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
    this.checkpointManager = new CheckpointManager(retryPolicy, sleeper);
    this.checkpointTimer = new IntervalTimer(checkpointInterval, ticker);
  }

  public static <T> RecordProcessorFactory factory(
          RecordDecoder<? extends T> decoder,
          RecordHandler<? super T> handler,
          ConsumerConfig config,
          Sleeper sleeper,
          Ticker ticker
  ) {
    return () -> new RetryingRecordProcessor<T>(decoder, handler, config.retry(), config.checkpointInterval(), sleeper, ticker);
  }

  @Override
  public void initialize(ShardId shardId) {
    checkState(this.shardId == null, "Processor already initialized for shard %s", this.shardId);
    LOG.info("Initializing record processor for shard: {}", shardId);
    this.shardId = shardId;
  }

  @Override
  public void processRecords(List<StreamRecord> records, Checkpointer checkpointer) {
    LOG.info("Processing {} records from {}", records.size(), shardId);
    for (StreamRecord record : records) {
      if (Thread.currentThread().isInterrupted() || processWithRetries(record) == Outcome.INTERRUPTED) {
        LOG.info("Interrupted while processing shard {}, abandoning the rest of the batch", shardId);
        break;
      }
      lastProcessed = record.sequenceNumber();
    }

    if (checkpointTimer.isDue()) {
      checkpointProgress(checkpointer);
      checkpointTimer.reset();
    }
  }

  @Override
  public void shutdown(ShutdownReason reason, Checkpointer checkpointer) {
    LOG.info("Shutting down record processor for shard {}: {}", shardId, reason);
    if (!reason.isCheckpointPermitted()) return;
    if (reason == ShutdownReason.TERMINATED) {
      checkpointManager.checkpoint(checkpointer);
    } else {
      checkpointProgress(checkpointer);
    }
  }

  private void checkpointProgress(Checkpointer checkpointer) {
    Optional<SequenceNumber> progress = Optional.ofNullable(lastProcessed);
    if (progress.isEmpty()) return;
    boolean alreadyRecorded = checkpointer.lastCheckpoint()
            .flatMap(c -> c.sequenceNumber())
            .filter(progress.get()::equals)
            .isPresent();
    if (!alreadyRecorded) checkpointManager.checkpoint(checkpointer, progress.get());
  }

  private Outcome processWithRetries(StreamRecord record) {
    int maxAttempts = retryPolicy.numRetries();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        T value = decoder.decode(record.data());
        handler.handle(record, value);
        return Outcome.APPLIED;
      } catch (RecordDecodeException e) {
        LOG.warn("Rejecting malformed record {} from shard {}: {}", record.sequenceNumber(), shardId, e.getMessage());
        return Outcome.REJECTED;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Outcome.INTERRUPTED;
      } catch (Exception e) {
        LOG.warn("Caught exception while processing record {} from shard {} (attempt {} of {})",
                record.sequenceNumber(), shardId, attempt, maxAttempts, e);
      }

      if (attempt < maxAttempts) {
        try {
          sleeper.sleep(retryPolicy.backoff());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return Outcome.INTERRUPTED;
        }
      }
    }
    LOG.error("Couldn't process record {} from shard {} after {} attempts. Skipping the record.",
            record.sequenceNumber(), shardId, maxAttempts);
    return Outcome.SKIPPED;
  }

  private enum Outcome {
    APPLIED,
    REJECTED,
    SKIPPED,
    INTERRUPTED
  }
}
