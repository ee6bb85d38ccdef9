package streamlease.cli;

import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import streamlease.config.ConsumerConfig;
import streamlease.config.StreamConfig;
import streamlease.coordinator.ShardCoordinator;
import streamlease.spi.LeaseTableAdmin;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "run",
        description = "Consume the stream until interrupted, logging each sample record",
        subcommands = DeleteResourcesCommand.class
)
public class RunCommand implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  @CommandLine.ParentCommand StreamLeaseCli parent;

  @Override
  public Integer call() {
    Injector injector = parent.injector();
    ConsumerConfig consumerConfig = injector.getInstance(ConsumerConfig.class);
    StreamConfig streamConfig = injector.getInstance(StreamConfig.class);

    injector.getInstance(LeaseTableAdmin.class).createTableIfNotExists(consumerConfig.applicationName());

    ShardCoordinator coordinator = injector.getInstance(ShardCoordinator.class);
    LOG.info("Running {} to process stream {} as worker {}",
            consumerConfig.applicationName(), streamConfig.name(), coordinator.workerId());

    boolean stoppedCleanly = new ServiceSupervisor(coordinator, consumerConfig.shutdownGracePeriod()).runUntilTerminated();
    if (coordinator.hasWorkerFailures()) {
      LOG.error("Exiting with failure: at least one shard worker failed");
      return 1;
    }
    return stoppedCleanly ? 0 : 1;
  }
}
