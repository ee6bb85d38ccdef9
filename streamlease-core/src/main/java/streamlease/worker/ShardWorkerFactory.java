package streamlease.worker;

import com.google.common.base.Ticker;
import streamlease.config.ConsumerConfig;
import streamlease.config.StreamConfig;
import streamlease.model.ShardId;
import streamlease.model.WorkerId;
import streamlease.processor.RecordProcessorFactory;
import streamlease.spi.LeaseStore;
import streamlease.spi.StreamSource;
import streamlease.util.concurrent.Sleeper;

import javax.inject.Inject;

public class ShardWorkerFactory {
  private final String streamName;
  private final WorkerId workerId;
  private final ConsumerConfig config;
  private final StreamSource streamSource;
  private final LeaseStore leaseStore;
  private final RecordProcessorFactory processorFactory;
  private final Sleeper sleeper;
  private final Ticker ticker;

  @Inject
  public ShardWorkerFactory(
          StreamConfig streamConfig,
          WorkerId workerId,
          ConsumerConfig config,
          StreamSource streamSource,
          LeaseStore leaseStore,
          RecordProcessorFactory processorFactory,
          Sleeper sleeper,
          Ticker ticker
  ) {
    this.streamName = streamConfig.name();
    this.workerId = workerId;
    this.config = config;
    this.streamSource = streamSource;
    this.leaseStore = leaseStore;
    this.processorFactory = processorFactory;
    this.sleeper = sleeper;
    this.ticker = ticker;
  }

  public WorkerId workerId() {
    return workerId;
  }

  public ShardWorker newWorker(ShardId shardId, long expectedLeaseCounter) {
    return new ShardWorker(
            streamName,
            shardId,
            expectedLeaseCounter,
            workerId,
            config,
            streamSource,
            leaseStore,
            processorFactory.newProcessor(),
            sleeper,
            ticker
    );
  }
}
