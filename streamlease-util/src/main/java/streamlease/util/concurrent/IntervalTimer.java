package streamlease.util.concurrent;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tracks monotonic elapsed time since the last {@link #reset}, and reports when a fixed interval has passed.
 * Readings come from a {@link Ticker}, so wall-clock adjustments never shorten or stretch the interval.
 * <p/>
 * A new timer starts out {@link #isDue due}, which matches a processor that has never checkpointed.
 * <p/>
 * Not thread-safe: intended to be owned by a single shard's processing thread.
 */
public class IntervalTimer {
  private final long intervalNanos;
  private final Ticker ticker;
  private long lastResetNanos;
  private boolean everReset = false;

  public IntervalTimer(Duration interval) {
    this(interval, Ticker.systemTicker());
  }

  public IntervalTimer(Duration interval, Ticker ticker) {
    checkArgument(!interval.isNegative(), "interval must not be negative", interval);
    this.intervalNanos = interval.toNanos();
    this.ticker = ticker;
  }

  public boolean isDue() {
    return !everReset || elapsedNanos() >= intervalNanos;
  }

  public void reset() {
    lastResetNanos = ticker.read();
    everReset = true;
  }

  public Duration elapsed() {
    return everReset ? Duration.ofNanos(elapsedNanos()) : Duration.ofNanos(Long.MAX_VALUE);
  }

  private long elapsedNanos() {
    return ticker.read() - lastResetNanos;
  }

  @Override
  public String toString() {
    return "IntervalTimer{interval=" + TimeUnit.NANOSECONDS.toMillis(intervalNanos) + "ms, due=" + isDue() + '}';
  }
}
