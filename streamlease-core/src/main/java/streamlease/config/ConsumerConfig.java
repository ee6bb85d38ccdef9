package streamlease.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;
import streamlease.model.InitialPosition;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings under {@code streamlease.consumer}.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableConsumerConfig.class)
public interface ConsumerConfig {
  static ImmutableConsumerConfig.Builder builder() {
    return ImmutableConsumerConfig.builder();
  }

  /** Names the consumer group; also the name of the lease table. */
  String applicationName();

  @Value.Default
  default InitialPosition initialPosition() {
    return InitialPosition.LATEST;
  }

  @Value.Default
  default Duration leaseTtl() {
    return Duration.ofSeconds(10);
  }

  @Value.Default
  default Duration shardSyncInterval() {
    return Duration.ofSeconds(10);
  }

  @Value.Default
  default Duration checkpointInterval() {
    return Duration.ofMinutes(1);
  }

  @Value.Default
  default RetryPolicy retry() {
    return RetryPolicy.DEFAULT;
  }

  @Value.Default
  default int maxRecordsPerBatch() {
    return 10000;
  }

  @Value.Default
  default Duration idleTimeBetweenReads() {
    return Duration.ofSeconds(1);
  }

  @Value.Default
  default int maxLeasesPerWorker() {
    return Integer.MAX_VALUE;
  }

  @Value.Default
  default Duration shutdownGracePeriod() {
    return Duration.ofSeconds(30);
  }

  @Value.Check
  default void checkValues() {
    checkArgument(!applicationName().isBlank(), "applicationName must not be blank");
    checkPositive("leaseTtl", leaseTtl());
    checkPositive("shardSyncInterval", shardSyncInterval());
    checkArgument(!checkpointInterval().isNegative(), "checkpointInterval must not be negative");
    checkArgument(!idleTimeBetweenReads().isNegative(), "idleTimeBetweenReads must not be negative");
    checkArgument(!shutdownGracePeriod().isNegative(), "shutdownGracePeriod must not be negative");
    checkArgument(maxRecordsPerBatch() > 0, "maxRecordsPerBatch must be positive: %s", maxRecordsPerBatch());
    checkArgument(maxLeasesPerWorker() > 0, "maxLeasesPerWorker must be positive: %s", maxLeasesPerWorker());
  }

  private static void checkPositive(String name, Duration value) {
    checkArgument(!value.isNegative() && !value.isZero(), "%s must be positive: %s", name, value);
  }
}
