package streamlease.util.concurrent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A point in time after which some operation should give up, measured against an injectable {@link Clock}.
 */
public final class Deadline {
  private final Instant startInstant;
  private final Instant deadline;
  private final Clock clock;

  private Deadline(Instant startInstant, Instant deadline, Clock clock) {
    this.startInstant = startInstant;
    this.deadline = deadline;
    this.clock = clock;
  }

  public static Deadline within(Duration duration) {
    return within(duration, Clock.systemUTC());
  }

  public static Deadline within(Duration duration, Clock clock) {
    Instant now = clock.instant();
    return new Deadline(now, now.plus(duration), clock);
  }

  public Instant startInstant() {
    return startInstant;
  }

  public Instant deadline() {
    return deadline;
  }

  public Duration expiredSinceStart() {
    return Duration.between(startInstant, clock.instant());
  }

  public Duration remaining() {
    return Duration.between(clock.instant(), deadline);
  }

  public boolean isExpired() {
    return remaining().compareTo(Duration.ZERO) <= 0;
  }

  @Override
  public String toString() {
    return "Deadline{" +
            "startInstant=" + startInstant +
            ", deadline=" + deadline +
            '}';
  }
}
