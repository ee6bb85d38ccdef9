package streamlease.cli;

import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import streamlease.config.ConsumerConfig;
import streamlease.config.ProducerConfig;
import streamlease.config.StreamConfig;
import streamlease.config.StreamLeaseConfig;
import streamlease.model.WorkerId;
import streamlease.processor.RecordProcessorFactory;
import streamlease.processor.RetryingRecordProcessor;
import streamlease.sample.SampleRecordCodec;
import streamlease.sample.SampleRecordHandler;
import streamlease.util.concurrent.Sleeper;

import javax.inject.Singleton;
import java.time.Clock;

/**
 * Backend-independent bindings: typed settings, time sources, the worker id and the sample record processor.
 */
public class StreamLeaseModule extends AbstractModule {
  private final Config config;

  public StreamLeaseModule(Config config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(Ticker.class).toInstance(Ticker.systemTicker());
    bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
  }

  @Provides
  @Singleton
  ConsumerConfig consumerConfig() {
    return StreamLeaseConfig.consumer(config);
  }

  @Provides
  @Singleton
  StreamConfig streamConfig() {
    return StreamLeaseConfig.stream(config);
  }

  @Provides
  @Singleton
  ProducerConfig producerConfig() {
    return StreamLeaseConfig.producer(config);
  }

  @Provides
  @Singleton
  WorkerId workerId() {
    return WorkerId.generate();
  }

  @Provides
  @Singleton
  RecordProcessorFactory recordProcessorFactory(
          SampleRecordHandler handler,
          ConsumerConfig consumerConfig,
          Sleeper sleeper,
          Ticker ticker
  ) {
    return RetryingRecordProcessor.factory(new SampleRecordCodec(), handler, consumerConfig, sleeper, ticker);
  }
}
