package streamlease.worker;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AbstractExecutionThreadService;
import com.google.common.util.concurrent.Uninterruptibles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.config.ConsumerConfig;
import streamlease.exceptions.LeaseConflictException;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.exceptions.TransientException;
import streamlease.model.Lease;
import streamlease.model.RecordBatch;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;
import streamlease.model.WorkerId;
import streamlease.processor.RecordProcessor;
import streamlease.processor.ShutdownReason;
import streamlease.spi.LeaseStore;
import streamlease.spi.StreamSource;
import streamlease.util.concurrent.IntervalTimer;
import streamlease.util.concurrent.Sleeper;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Owns one shard for as long as it holds the shard's lease: acquires the lease, pulls batches in sequence order and
 * feeds them to a {@link RecordProcessor}, renews the lease between batches, and shuts the processor down with the
 * {@link ShutdownReason} that matches how processing ended.
 *
 * <p>{@link #stopAsync} interrupts the worker thread; the current record finishes or its retry backoff is cut short,
 * and the processor is shut down with {@link ShutdownReason#REQUESTED}.
 *
 * <p>A failure thrown by the processor fails this service (and only this shard); the lease is left to expire.
 */
public class ShardWorker extends AbstractExecutionThreadService {
  private static final Logger LOG = LoggerFactory.getLogger(ShardWorker.class);

  private final String streamName;
  private final ShardId shardId;
  private final long expectedLeaseCounter;
  private final WorkerId workerId;
  private final ConsumerConfig config;
  private final StreamSource streamSource;
  private final LeaseStore leaseStore;
  private final RecordProcessor processor;
  private final Sleeper sleeper;
  private final Ticker ticker;

  private volatile ShardWorkerState workerState = ShardWorkerState.ACQUIRING;
  private volatile ShardWorkerOutcome outcome;
  private volatile Thread runThread;
  private final CountDownLatch shutdownTriggered = new CountDownLatch(1);

  public ShardWorker(
          String streamName,
          ShardId shardId,
          long expectedLeaseCounter,
          WorkerId workerId,
          ConsumerConfig config,
          StreamSource streamSource,
          LeaseStore leaseStore,
          RecordProcessor processor,
          Sleeper sleeper,
          Ticker ticker
  ) {
    this.streamName = streamName;
    this.shardId = shardId;
    this.expectedLeaseCounter = expectedLeaseCounter;
    this.workerId = workerId;
    this.config = config;
    this.streamSource = streamSource;
    this.leaseStore = leaseStore;
    this.processor = processor;
    this.sleeper = sleeper;
    this.ticker = ticker;
  }

  public ShardId shardId() {
    return shardId;
  }

  public ShardWorkerState workerState() {
    return workerState;
  }

  /**
   * How the worker finished; empty until it has terminated normally.
   */
  public Optional<ShardWorkerOutcome> outcome() {
    return Optional.ofNullable(outcome);
  }

  @Override
  protected void run() {
    runThread = Thread.currentThread();
    outcome = processShard();
    transition(ShardWorkerState.SHUTDOWN);
    LOG.info("Worker for shard {} finished: {}", shardId, outcome);
  }

  @Override
  protected void triggerShutdown() {
    Thread thread = runThread;
    if (thread != null) thread.interrupt();
    shutdownTriggered.countDown();
  }

  @Override
  protected String serviceName() {
    return "ShardWorker-" + shardId;
  }

  private ShardWorkerOutcome processShard() {
    Lease lease;
    try {
      lease = leaseStore.acquireOrRenew(shardId, workerId, expectedLeaseCounter);
    } catch (LeaseConflictException e) {
      LOG.info("Lease for shard {} was taken by another worker: {}", shardId, e.getMessage());
      return ShardWorkerOutcome.NOT_ACQUIRED;
    } catch (TransientException e) {
      LOG.warn("Unable to acquire lease for shard {}, will retry on next shard sync", shardId, e);
      return ShardWorkerOutcome.NOT_ACQUIRED;
    } catch (LeaseStoreSchemaException e) {
      LOG.error("Lease store rejected the lease for shard {}, dropping the shard", shardId, e);
      return ShardWorkerOutcome.SHARD_FAILED;
    }
    LOG.info("Acquired lease for shard {} (counter {}, checkpoint {})",
            shardId, lease.counter(), lease.checkpoint().map(Object::toString).orElse("none"));

    if (lease.isShardEnded()) {
      releaseLease(lease.counter());
      return ShardWorkerOutcome.SHARD_ENDED;
    }

    LeaseCheckpointer checkpointer = new LeaseCheckpointer(leaseStore, lease);
    processor.initialize(shardId);
    transition(ShardWorkerState.PROCESSING);

    ShardPosition position = ShardPosition.resumeFrom(lease.checkpoint(), config.initialPosition());
    IntervalTimer renewalTimer = new IntervalTimer(config.leaseTtl().dividedBy(3), ticker);
    renewalTimer.reset();
    Stopwatch sinceRenewal = Stopwatch.createStarted(ticker);

    while (true) {
      if (stopRequested()) return shutdownRequested(checkpointer);

      if (renewalTimer.isDue()) {
        renewalTimer.reset();
        try {
          checkpointer.leaseRenewed(leaseStore.acquireOrRenew(shardId, workerId, checkpointer.leaseCounter()));
          sinceRenewal.reset().start();
        } catch (LeaseConflictException e) {
          LOG.info("Lost lease for shard {}: {}", shardId, e.getMessage());
          return leaseLost(checkpointer);
        } catch (LeaseStoreSchemaException e) {
          return abandon(checkpointer, e);
        } catch (TransientException e) {
          if (sinceRenewal.elapsed(TimeUnit.NANOSECONDS) >= config.leaseTtl().toNanos()) {
            LOG.warn("Unable to renew lease for shard {} within its TTL, treating it as lost", shardId, e);
            return leaseLost(checkpointer);
          }
          LOG.warn("Unable to renew lease for shard {}, will retry: {}", shardId, e.getMessage());
        }
      }

      RecordBatch batch;
      try {
        batch = streamSource.getRecords(streamName, shardId, position, config.maxRecordsPerBatch());
      } catch (TransientException e) {
        LOG.warn("Failed to read from shard {}, backing off: {}", shardId, e.getMessage());
        idle();
        continue;
      }

      if (!batch.records().isEmpty()) {
        checkpointer.recordsDelivered(batch.lastSequenceNumber().orElseThrow());
        processor.processRecords(batch.records(), checkpointer);

        if (checkpointer.isLeaseLost()) return leaseLost(checkpointer);
        if (checkpointer.storeFailure().isPresent()) return abandon(checkpointer, checkpointer.storeFailure().get());
      }
      position = batch.nextPosition();

      if (stopRequested()) return shutdownRequested(checkpointer);
      if (batch.shardExhausted()) return drain(checkpointer);
      if (batch.records().isEmpty()) idle();
    }
  }

  private ShardWorkerOutcome drain(LeaseCheckpointer checkpointer) {
    transition(ShardWorkerState.DRAINING);
    LOG.info("Reached end of shard {}", shardId);
    checkpointer.shardEnded();
    processor.shutdown(ShutdownReason.TERMINATED, checkpointer);

    if (checkpointer.isLeaseLost()) {
      transition(ShardWorkerState.LEASE_LOST);
      return ShardWorkerOutcome.LEASE_LOST;
    }
    if (checkpointer.storeFailure().isPresent()) return ShardWorkerOutcome.SHARD_FAILED;

    releaseLease(checkpointer.leaseCounter());
    if (checkpointer.isShardEndCheckpointed()) return ShardWorkerOutcome.SHARD_ENDED;

    LOG.error("Shard {} was drained but SHARD_END was not checkpointed; it will be processed again", shardId);
    return ShardWorkerOutcome.STOPPED;
  }

  private ShardWorkerOutcome shutdownRequested(LeaseCheckpointer checkpointer) {
    // the stop interrupt may still be in flight; wait for it before clearing so the final checkpoint can complete
    Uninterruptibles.awaitUninterruptibly(shutdownTriggered, config.leaseTtl());
    Thread.interrupted();
    LOG.info("Stopping worker for shard {}", shardId);
    processor.shutdown(ShutdownReason.REQUESTED, checkpointer);
    if (checkpointer.isLeaseLost()) return ShardWorkerOutcome.LEASE_LOST;
    releaseLease(checkpointer.leaseCounter());
    return ShardWorkerOutcome.STOPPED;
  }

  private ShardWorkerOutcome leaseLost(LeaseCheckpointer checkpointer) {
    transition(ShardWorkerState.LEASE_LOST);
    processor.shutdown(ShutdownReason.LEASE_LOST, checkpointer);
    return ShardWorkerOutcome.LEASE_LOST;
  }

  private ShardWorkerOutcome abandon(LeaseCheckpointer checkpointer, Throwable storeFailure) {
    LOG.error("Lease store cannot record progress for shard {}, dropping the shard", shardId, storeFailure);
    processor.shutdown(ShutdownReason.ABANDONED, checkpointer);
    return ShardWorkerOutcome.SHARD_FAILED;
  }

  private void releaseLease(long leaseCounter) {
    try {
      leaseStore.releaseLease(shardId, workerId, leaseCounter);
      LOG.info("Released lease for shard {}", shardId);
    } catch (LeaseConflictException e) {
      LOG.info("Lease for shard {} already taken over, nothing to release", shardId);
    } catch (TransientException e) {
      LOG.warn("Unable to release lease for shard {}, it will expire instead", shardId, e);
    }
  }

  private boolean stopRequested() {
    return !isRunning() || Thread.currentThread().isInterrupted();
  }

  private void idle() {
    Duration idleTime = config.idleTimeBetweenReads();
    try {
      sleeper.sleep(idleTime);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void transition(ShardWorkerState next) {
    LOG.debug("Shard {}: {} -> {}", shardId, workerState, next);
    workerState = next;
  }
}
