package streamlease.testing;

import streamlease.util.concurrent.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns immediately, remembering every requested pause. If a clock is supplied it is advanced by each pause, so
 * deadline-based loops make progress.
 */
public class RecordingSleeper implements Sleeper {
  private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
  private final MutableClock clock;
  private volatile boolean interruptOnSleep = false;

  public RecordingSleeper() {
    this(null);
  }

  public RecordingSleeper(MutableClock clock) {
    this.clock = clock;
  }

  public RecordingSleeper interruptOnSleep() {
    interruptOnSleep = true;
    return this;
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    sleeps.add(duration);
    if (interruptOnSleep) throw new InterruptedException("test interruption");
    if (clock != null) clock.advance(duration);
  }

  public List<Duration> sleeps() {
    return sleeps;
  }
}
