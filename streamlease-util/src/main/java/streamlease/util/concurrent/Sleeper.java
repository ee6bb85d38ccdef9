package streamlease.util.concurrent;

import java.time.Duration;

/**
 * The suspension point used by retry and polling loops. Implementations must respond to
 * {@link Thread#interrupt interruption} by throwing {@link InterruptedException} promptly, so a stopping service
 * never waits out a full backoff.
 */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> {
    if (!duration.isNegative() && !duration.isZero()) Thread.sleep(duration.toMillis());
    else if (Thread.interrupted()) throw new InterruptedException();
  };

  void sleep(Duration duration) throws InterruptedException;
}
