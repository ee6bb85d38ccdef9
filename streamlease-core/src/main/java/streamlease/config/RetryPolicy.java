package streamlease.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Bounded retry with a fixed pause between attempts. Shared by record processing and checkpointing.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRetryPolicy.class)
public interface RetryPolicy {
  RetryPolicy DEFAULT = builder().build();

  static ImmutableRetryPolicy.Builder builder() {
    return ImmutableRetryPolicy.builder();
  }

  /** Total attempts, including the first. */
  @Value.Default
  default int numRetries() {
    return 10;
  }

  @Value.Default
  default Duration backoff() {
    return Duration.ofSeconds(3);
  }

  @Value.Check
  default void checkValues() {
    checkArgument(numRetries() >= 1, "retry.numRetries must be at least 1: %s", numRetries());
    checkArgument(!backoff().isNegative(), "retry.backoff must not be negative: %s", backoff());
  }
}
