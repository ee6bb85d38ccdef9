package streamlease.coordinator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.AbstractScheduledService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.config.ConsumerConfig;
import streamlease.config.StreamConfig;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.exceptions.StreamNotFoundException;
import streamlease.exceptions.TransientException;
import streamlease.model.Lease;
import streamlease.model.ShardDescriptor;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;
import streamlease.spi.LeaseStore;
import streamlease.spi.StreamSource;
import streamlease.util.concurrent.Deadline;
import streamlease.worker.ShardWorker;
import streamlease.worker.ShardWorkerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkState;

/**
 * Keeps this process working on its share of the stream's shards. Every {@code shardSyncInterval} it lists the
 * shards, makes sure each has a lease, and starts a {@link ShardWorker} for each shard whose lease is available to
 * this worker and whose parents have been fully processed. At most one worker runs per shard in this process.
 *
 * <p>Workers that fail with an unhandled exception are counted; see {@link #hasWorkerFailures}. Stopping the
 * coordinator stops every worker and waits up to {@code shutdownGracePeriod} for them to finish.
 */
@Singleton
public class ShardCoordinator extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(ShardCoordinator.class);

  private final String streamName;
  private final ConsumerConfig config;
  private final StreamSource streamSource;
  private final LeaseStore leaseStore;
  private final ShardWorkerFactory workerFactory;
  private final WorkerId workerId;
  private final Clock clock;

  private final Map<ShardId, ShardWorker> activeWorkers = new ConcurrentHashMap<>();
  private final AtomicInteger failedWorkers = new AtomicInteger();

  @Inject
  public ShardCoordinator(
          StreamConfig streamConfig,
          ConsumerConfig config,
          StreamSource streamSource,
          LeaseStore leaseStore,
          ShardWorkerFactory workerFactory,
          Clock clock
  ) {
    this.streamName = streamConfig.name();
    this.config = config;
    this.streamSource = streamSource;
    this.leaseStore = leaseStore;
    this.workerFactory = workerFactory;
    this.workerId = workerFactory.workerId();
    this.clock = clock;
  }

  public WorkerId workerId() {
    return workerId;
  }

  public boolean hasWorkerFailures() {
    return failedWorkers.get() > 0;
  }

  public Set<ShardId> activeShards() {
    return ImmutableSet.copyOf(activeWorkers.keySet());
  }

  @Override
  protected void startUp() {
    LOG.info("Worker {} coordinating shards of stream {} for {}", workerId, streamName, config.applicationName());
  }

  @Override
  protected void runOneIteration() {
    try {
      syncShards();
    } catch (TransientException e) {
      LOG.warn("Shard sync failed, will retry in {}", config.shardSyncInterval(), e);
    } catch (StreamNotFoundException e) {
      LOG.warn("Stream {} not found, will retry in {}: {}", streamName, config.shardSyncInterval(), e.getMessage());
    } catch (LeaseStoreSchemaException e) {
      LOG.error("Lease store is unusable, will retry shard sync in {}", config.shardSyncInterval(), e);
    }
  }

  @VisibleForTesting
  void syncShards() {
    List<ShardDescriptor> shards = streamSource.listShards(streamName);
    for (ShardDescriptor shard : shards) {
      leaseStore.createLeaseIfAbsent(shard.shardId(), shard.parentShardIds());
    }

    reapFinishedWorkers();

    Map<ShardId, Lease> leases = Maps.uniqueIndex(leaseStore.listLeases(), Lease::shardId);
    shards.stream()
            .sorted(Comparator.comparing(ShardDescriptor::shardId))
            .filter(shard -> !activeWorkers.containsKey(shard.shardId()))
            .forEach(shard -> {
              if (activeWorkers.size() >= config.maxLeasesPerWorker() || !isRunning()) return;
              Lease lease = leases.get(shard.shardId());
              if (lease != null && isEligible(lease, leases)) startWorker(lease);
            });
  }

  private boolean isEligible(Lease lease, Map<ShardId, Lease> leases) {
    if (lease.isShardEnded()) return false;
    if (!lease.isAvailableTo(workerId, clock.instant())) return false;
    for (ShardId parentId : lease.parentShardIds()) {
      if (!isParentComplete(parentId, leases)) {
        LOG.debug("Shard {} is waiting for parent {} to be fully processed", lease.shardId(), parentId);
        return false;
      }
    }
    return true;
  }

  /**
   * A parent is complete once its lease records SHARD_END. A parent with no lease at all has aged out of the
   * stream's retention, so it can no longer block its children.
   */
  private boolean isParentComplete(ShardId parentId, Map<ShardId, Lease> leases) {
    if (activeWorkers.containsKey(parentId)) return false;
    Lease parentLease = leases.get(parentId);
    return parentLease == null || parentLease.isShardEnded();
  }

  private void startWorker(Lease lease) {
    ShardId shardId = lease.shardId();
    LOG.info("Worker {} taking lease for shard {} (previous owner {})",
            workerId, shardId, lease.owner().map(Object::toString).orElse("none"));
    ShardWorker worker = workerFactory.newWorker(shardId, lease.counter());
    worker.addListener(new WorkerListener(shardId), MoreExecutors.directExecutor());
    checkState(activeWorkers.putIfAbsent(shardId, worker) == null, "Shard %s already has a worker", shardId);
    worker.startAsync();
  }

  private void reapFinishedWorkers() {
    activeWorkers.values().removeIf(worker -> {
      State state = worker.state();
      return state == State.TERMINATED || state == State.FAILED;
    });
  }

  @Override
  protected void shutDown() {
    LOG.info("Stopping {} shard worker(s)", activeWorkers.size());
    activeWorkers.values().forEach(Service::stopAsync);

    Deadline deadline = Deadline.within(config.shutdownGracePeriod());
    for (ShardWorker worker : activeWorkers.values()) {
      Duration remaining = deadline.remaining();
      try {
        worker.awaitTerminated(Math.max(0, remaining.toMillis()), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        LOG.warn("Worker for shard {} did not stop within {}", worker.shardId(), config.shutdownGracePeriod());
      } catch (IllegalStateException e) {
        LOG.debug("Worker for shard {} ended in {}", worker.shardId(), worker.state());
      }
    }
    reapFinishedWorkers();
  }

  @Override
  protected Scheduler scheduler() {
    long delayMillis = config.shardSyncInterval().toMillis();
    return Scheduler.newFixedDelaySchedule(0, delayMillis, TimeUnit.MILLISECONDS);
  }

  @Override
  protected String serviceName() {
    return "ShardCoordinator-" + streamName;
  }

  private class WorkerListener extends Service.Listener {
    private final ShardId shardId;

    WorkerListener(ShardId shardId) {
      this.shardId = shardId;
    }

    @Override
    public void failed(State from, Throwable failure) {
      failedWorkers.incrementAndGet();
      LOG.error("Worker for shard {} failed while {}", shardId, from, failure);
    }
  }
}
