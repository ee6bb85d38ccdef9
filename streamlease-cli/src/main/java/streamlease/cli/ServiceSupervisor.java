package streamlease.cli;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Binds the process lifecycle to a guava {@link Service}:
 * <ul>
 *   <li>blocks the calling thread until the service terminates, reporting whether it failed</li>
 *   <li>installs a {@link Runtime#addShutdownHook(Thread) shutdown hook} so SIGINT/SIGTERM stop the service
 *   gracefully, halting the process if that takes longer than the grace period</li>
 *   <li>logs any exception that escapes a thread</li>
 * </ul>
 */
public class ServiceSupervisor {
  private static final Logger LOG = LoggerFactory.getLogger(ServiceSupervisor.class);

  private final Service service;
  private final Duration shutdownGracePeriod;

  public ServiceSupervisor(Service service, Duration shutdownGracePeriod) {
    this.service = service;
    this.shutdownGracePeriod = shutdownGracePeriod;
  }

  /**
   * @return true if the service stopped cleanly, false if it failed
   */
  public boolean runUntilTerminated() {
    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("UNCAUGHT EXCEPTION in thread {}", t, e));
    Thread shutdownHook = new Thread(this::stopGracefully, threadName("ShutdownHook"));
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    try {
      return supervise();
    } finally {
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        LOG.debug("Process is already shutting down");
      }
    }
  }

  boolean supervise() {
    service.addListener(new Service.Listener() {
      @Override
      public void stopping(Service.State from) {
        LOG.info("Service stopping... (was {})", from);
      }

      @Override
      public void failed(Service.State from, Throwable failure) {
        LOG.error("Service failed while {}: {}", from, service, failure);
      }
    }, MoreExecutors.directExecutor());

    Stopwatch stopwatch = Stopwatch.createStarted();
    LOG.info("Starting {}...", service);
    service.startAsync();
    try {
      service.awaitTerminated();
      LOG.info("Service stopped after {}", stopwatch);
      return true;
    } catch (IllegalStateException e) {
      return false;
    }
  }

  void stopGracefully() {
    if (service.state() == Service.State.TERMINATED || service.state() == Service.State.FAILED) return;
    LOG.info("ShutdownHook invoked, stopping {}...", service);
    service.stopAsync();
    try {
      service.awaitTerminated(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
      LOG.info("Shutdown complete");
    } catch (TimeoutException e) {
      LOG.warn("Graceful shutdown timed out after {}, halting forcibly!", shutdownGracePeriod);
      Runtime.getRuntime().halt(1);
    } catch (IllegalStateException e) {
      LOG.warn("Service failed during shutdown", e);
    }
  }

  private static String threadName(String threadPurpose) {
    return ServiceSupervisor.class.getSimpleName() + "-" + threadPurpose;
  }
}
