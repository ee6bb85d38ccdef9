package streamlease.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import java.time.Duration;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings under {@code streamlease.stream}.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableStreamConfig.class)
public interface StreamConfig {
  Pattern VALID_NAME_PATTERN = Pattern.compile("[a-zA-Z0-9_.-]{1,128}");

  static ImmutableStreamConfig.Builder builder() {
    return ImmutableStreamConfig.builder();
  }

  String name();

  /** Used only when the producer has to create the stream. */
  @Value.Default
  default int shardCount() {
    return 1;
  }

  @Value.Default
  default Duration activationPollInterval() {
    return Duration.ofSeconds(20);
  }

  @Value.Default
  default Duration activationTimeout() {
    return Duration.ofMinutes(10);
  }

  @Value.Check
  default void checkValues() {
    checkArgument(VALID_NAME_PATTERN.matcher(name()).matches(), "Invalid stream name: '%s'", name());
    checkArgument(shardCount() > 0, "shardCount must be positive: %s", shardCount());
    checkArgument(!activationPollInterval().isNegative(), "activationPollInterval must not be negative");
    checkArgument(!activationTimeout().isNegative(), "activationTimeout must not be negative");
  }
}
