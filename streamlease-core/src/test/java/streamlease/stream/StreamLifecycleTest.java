package streamlease.stream;

import org.junit.jupiter.api.Test;
import streamlease.config.StreamConfig;
import streamlease.exceptions.StreamActivationTimeoutException;
import streamlease.exceptions.StreamDeletingException;
import streamlease.exceptions.StreamNotFoundException;
import streamlease.model.StreamStatus;
import streamlease.spi.StreamAdmin;
import streamlease.testing.MutableClock;
import streamlease.testing.RecordingSleeper;

import java.time.Duration;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamLifecycleTest {
  private static final String STREAM = "myFirstStream";
  private static final Duration POLL = Duration.ofSeconds(20);

  private final StreamAdmin admin = mock(StreamAdmin.class);
  private final MutableClock clock = new MutableClock();
  private final RecordingSleeper sleeper = new RecordingSleeper(clock);
  private final StreamLifecycle lifecycle = new StreamLifecycle(admin, StreamConfig.builder().name(STREAM).build(), sleeper, clock);

  @Test
  void activeStreamNeedsNoWait() throws InterruptedException {
    when(admin.describeStream(STREAM)).thenReturn(StreamStatus.ACTIVE);

    lifecycle.ensureStreamActive(STREAM, 1);

    verify(admin, never()).createStream(STREAM, 1);
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void missingStreamIsCreatedAndAwaited() throws InterruptedException {
    when(admin.describeStream(STREAM))
            .thenThrow(new StreamNotFoundException("missing"))
            .thenThrow(new StreamNotFoundException("not visible yet"))
            .thenReturn(StreamStatus.CREATING)
            .thenReturn(StreamStatus.ACTIVE);

    lifecycle.ensureStreamActive(STREAM, 2);

    verify(admin).createStream(STREAM, 2);
    assertThat(sleeper.sleeps()).containsExactly(POLL, POLL, POLL);
  }

  @Test
  void deletingStreamIsRejected() {
    when(admin.describeStream(STREAM)).thenReturn(StreamStatus.DELETING);

    assertThrows(StreamDeletingException.class, () -> lifecycle.ensureStreamActive(STREAM, 1));
    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void updatingStreamThatStartsDeletingIsRejected() {
    when(admin.describeStream(STREAM)).thenReturn(StreamStatus.UPDATING).thenReturn(StreamStatus.DELETING);

    assertThrows(StreamDeletingException.class, () -> lifecycle.ensureStreamActive(STREAM, 1));
  }

  @Test
  void givesUpAfterActivationTimeout() {
    when(admin.describeStream(STREAM)).thenReturn(StreamStatus.CREATING);

    assertThrows(StreamActivationTimeoutException.class, () -> lifecycle.ensureStreamActive(STREAM, 1));
    assertThat(sleeper.sleeps()).hasSize(30);
  }

  @Test
  void deleteReportsWhetherStreamExisted() {
    when(admin.deleteStream(STREAM)).thenReturn(false);

    assertThat(lifecycle.deleteStreamIfExists(STREAM)).isFalse();
  }
}
