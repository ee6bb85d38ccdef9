package streamlease.producer;

import org.junit.jupiter.api.Test;
import streamlease.config.ProducerConfig;
import streamlease.exceptions.TransientException;
import streamlease.memory.InMemoryStream;
import streamlease.model.InitialPosition;
import streamlease.model.ShardId;
import streamlease.model.ShardPosition;
import streamlease.model.StreamRecord;
import streamlease.spi.StreamProducer;
import streamlease.stream.StreamLifecycle;
import streamlease.testing.RecordingSleeper;
import streamlease.testing.TestConfigs;
import streamlease.util.concurrent.Sleeper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.truth.Truth.assertThat;
import static org.awaitility.Awaitility.await;
import static streamlease.testing.TestConfigs.STREAM_NAME;

class SampleRecordProducerTest {
  private final InMemoryStream stream = new InMemoryStream(Clock.systemUTC());
  private final StreamLifecycle lifecycle = new StreamLifecycle(stream, TestConfigs.stream(), new RecordingSleeper(), Clock.systemUTC());
  private final ProducerConfig config = ProducerConfig.builder().putInterval(Duration.ofMillis(1)).build();

  @Test
  void createsStreamAndPutsSampleRecords() throws Exception {
    SampleRecordProducer producer = new SampleRecordProducer(lifecycle, stream, stream.producer(STREAM_NAME), config,
            Sleeper.SYSTEM, Clock.systemUTC());

    producer.startAsync().awaitRunning();
    await().atMost(5, TimeUnit.SECONDS).until(() -> producer.recordsPut() >= 3);
    producer.stopAsync().awaitTerminated(5, TimeUnit.SECONDS);

    assertThat(stream.listStreamNames()).containsExactly(STREAM_NAME);
    ShardId shard = stream.listShards(STREAM_NAME).get(0).shardId();
    List<StreamRecord> records = stream.getRecords(STREAM_NAME, shard,
            ShardPosition.initial(InitialPosition.TRIM_HORIZON), 100).records();
    assertThat(records).hasSize((int) producer.recordsPut());
    String payload = new String(records.get(0).data(), StandardCharsets.UTF_8);
    assertThat(payload).startsWith("testData-");
    assertThat(records.get(0).partitionKey()).isEqualTo("partitionKey-" + payload.substring("testData-".length()));
  }

  @Test
  void transientPutFailuresAreRetried() throws Exception {
    stream.createStream(STREAM_NAME, 1);
    StreamProducer delegate = stream.producer(STREAM_NAME);
    AtomicInteger calls = new AtomicInteger();
    StreamProducer flaky = (partitionKey, data) -> {
      if (calls.incrementAndGet() <= 2) throw new TransientException("connection reset");
      return delegate.put(partitionKey, data);
    };
    SampleRecordProducer producer = new SampleRecordProducer(lifecycle, stream, flaky, config, Sleeper.SYSTEM,
            Clock.systemUTC());

    producer.startAsync().awaitRunning();
    await().atMost(5, TimeUnit.SECONDS).until(() -> producer.recordsPut() >= 1);
    producer.stopAsync().awaitTerminated(5, TimeUnit.SECONDS);

    assertThat(calls.get()).isGreaterThan(2);
  }
}
