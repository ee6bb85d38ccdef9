package streamlease.coordinator;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import streamlease.config.ConsumerConfig;
import streamlease.exceptions.LeaseStoreSchemaException;
import streamlease.memory.InMemoryLeaseStore;
import streamlease.memory.InMemoryStream;
import streamlease.model.Checkpoint;
import streamlease.model.Lease;
import streamlease.model.ShardId;
import streamlease.model.StreamRecord;
import streamlease.model.WorkerId;
import streamlease.processor.Checkpointer;
import streamlease.processor.RecordProcessor;
import streamlease.processor.RecordProcessorFactory;
import streamlease.processor.RetryingRecordProcessor;
import streamlease.processor.ShutdownReason;
import streamlease.testing.TestConfigs;
import streamlease.util.concurrent.Sleeper;
import streamlease.worker.ShardWorkerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static com.google.common.truth.Truth.assertThat;
import static org.awaitility.Awaitility.await;
import static streamlease.testing.TestConfigs.STREAM_NAME;

class ShardCoordinatorTest {
  private final InMemoryStream stream = new InMemoryStream(Clock.systemUTC());
  private final AtomicBoolean leaseTableMissing = new AtomicBoolean();
  private final InMemoryLeaseStore leaseStore = new InMemoryLeaseStore(TestConfigs.fastConsumer().leaseTtl(), Clock.systemUTC()) {
    @Override
    public synchronized List<Lease> listLeases() {
      if (leaseTableMissing.getAndSet(false)) throw new LeaseStoreSchemaException("lease table does not exist");
      return super.listLeases();
    }
  };
  private final List<StreamRecord> handled = Collections.synchronizedList(new ArrayList<>());
  private final List<ShardCoordinator> coordinators = new ArrayList<>();

  @AfterEach
  void stopCoordinators() throws Exception {
    for (ShardCoordinator coordinator : coordinators) {
      coordinator.stopAsync().awaitTerminated(10, TimeUnit.SECONDS);
    }
  }

  @Test
  void childrenAreProcessedOnlyAfterParentEnds() {
    stream.createStream(STREAM_NAME, 1);
    ShardId parent = stream.listShards(STREAM_NAME).get(0).shardId();
    putRecords(5);
    List<ShardId> children = stream.splitShard(STREAM_NAME, parent);
    putRecords(5);

    startCoordinator("worker:1", TestConfigs.fastConsumer(), recordingProcessors());

    await().atMost(10, TimeUnit.SECONDS).until(() -> handled.size() == 10);
    List<ShardId> processingOrder = handled.stream().map(StreamRecord::shardId).collect(Collectors.toList());
    assertThat(processingOrder.subList(0, 5)).containsExactly(parent, parent, parent, parent, parent);
    assertThat(processingOrder.subList(5, 10)).doesNotContain(parent);
    assertThat(children).containsAtLeastElementsIn(processingOrder.subList(5, 10).stream().distinct().collect(Collectors.toList()));
    assertThat(leaseStore.readLease(parent).orElseThrow().checkpoint()).hasValue(Checkpoint.SHARD_END);
  }

  @Test
  void everyRecordIsHandledOnceAcrossWorkers() {
    stream.createStream(STREAM_NAME, 4);
    putRecords(40);

    startCoordinator("worker:1", TestConfigs.fastConsumer(), recordingProcessors());
    startCoordinator("worker:2", TestConfigs.fastConsumer(), recordingProcessors());

    await().atMost(10, TimeUnit.SECONDS).until(() -> handled.size() >= 40);
    assertThat(handled.stream().map(StreamRecord::sequenceNumber).distinct().count()).isEqualTo(40);
    assertThat(handled).hasSize(40);
  }

  @Test
  void respectsMaxLeasesPerWorker() throws Exception {
    stream.createStream(STREAM_NAME, 3);
    ConsumerConfig config = ConsumerConfig.builder().from(TestConfigs.fastConsumer()).maxLeasesPerWorker(2).build();

    ShardCoordinator coordinator = startCoordinator("worker:1", config, recordingProcessors());

    await().atMost(5, TimeUnit.SECONDS).until(() -> coordinator.activeShards().size() == 2);
    Thread.sleep(config.shardSyncInterval().toMillis() * 5);
    assertThat(coordinator.activeShards()).hasSize(2);
  }

  @Test
  void stoppingReleasesLeasesWithProgress() throws Exception {
    stream.createStream(STREAM_NAME, 1);
    ShardId shard = stream.listShards(STREAM_NAME).get(0).shardId();
    putRecords(3);

    ShardCoordinator coordinator = startCoordinator("worker:1", TestConfigs.fastConsumer(), recordingProcessors());
    await().atMost(5, TimeUnit.SECONDS).until(() -> handled.size() == 3);
    coordinator.stopAsync().awaitTerminated(10, TimeUnit.SECONDS);

    assertThat(leaseStore.readLease(shard).orElseThrow().owner()).isEmpty();
    assertThat(leaseStore.readLease(shard).orElseThrow().checkpoint()).isPresent();
    assertThat(coordinator.hasWorkerFailures()).isFalse();
  }

  @Test
  void unhandledProcessorFailureIsCounted() {
    stream.createStream(STREAM_NAME, 1);
    putRecords(1);

    ShardCoordinator coordinator = startCoordinator("worker:1", TestConfigs.fastConsumer(), FailingProcessor::new);

    await().atMost(5, TimeUnit.SECONDS).until(coordinator::hasWorkerFailures);
    assertThat(coordinator.isRunning()).isTrue();
  }

  @Test
  void shardSyncSurvivesLeaseStoreSchemaFailure() {
    stream.createStream(STREAM_NAME, 1);
    putRecords(2);
    leaseTableMissing.set(true);

    ShardCoordinator coordinator = startCoordinator("worker:1", TestConfigs.fastConsumer(), recordingProcessors());

    await().atMost(5, TimeUnit.SECONDS).until(() -> handled.size() == 2);
    assertThat(leaseTableMissing.get()).isFalse();
    assertThat(coordinator.isRunning()).isTrue();
  }

  private RecordProcessorFactory recordingProcessors() {
    ConsumerConfig config = TestConfigs.fastConsumer();
    return RetryingRecordProcessor.<StreamRecord>factory(
            data -> null,
            (record, ignored) -> handled.add(record),
            config,
            Sleeper.SYSTEM,
            Ticker.systemTicker());
  }

  private ShardCoordinator startCoordinator(String workerId, ConsumerConfig config, RecordProcessorFactory processors) {
    ShardWorkerFactory workerFactory = new ShardWorkerFactory(TestConfigs.stream(), WorkerId.of(workerId), config,
            stream, leaseStore, processors, Sleeper.SYSTEM, Ticker.systemTicker());
    ShardCoordinator coordinator = new ShardCoordinator(TestConfigs.stream(), config, stream, leaseStore, workerFactory,
            Clock.systemUTC());
    coordinators.add(coordinator);
    coordinator.startAsync().awaitRunning();
    return coordinator;
  }

  private void putRecords(int count) {
    for (int i = 0; i < count; i++) {
      stream.put(STREAM_NAME, "partitionKey-" + i, ("record-" + i).getBytes(StandardCharsets.UTF_8));
    }
  }

  private static class FailingProcessor implements RecordProcessor {
    @Override
    public void initialize(ShardId shardId) {
    }

    @Override
    public void processRecords(List<StreamRecord> records, Checkpointer checkpointer) {
      throw new IllegalStateException("processor bug");
    }

    @Override
    public void shutdown(ShutdownReason reason, Checkpointer checkpointer) {
    }
  }
}
