package streamlease.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings under {@code streamlease.producer}.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableProducerConfig.class)
public interface ProducerConfig {
  ProducerConfig DEFAULT = builder().build();

  static ImmutableProducerConfig.Builder builder() {
    return ImmutableProducerConfig.builder();
  }

  /** Pause between puts; zero produces in a tight loop. */
  @Value.Default
  default Duration putInterval() {
    return Duration.ZERO;
  }

  @Value.Check
  default void checkValues() {
    checkArgument(!putInterval().isNegative(), "putInterval must not be negative: %s", putInterval());
  }
}
