package streamlease.cli;

import com.google.inject.Injector;
import picocli.CommandLine;
import streamlease.config.ConsumerConfig;
import streamlease.config.StreamConfig;
import streamlease.spi.LeaseTableAdmin;
import streamlease.stream.StreamLifecycle;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "delete-resources", description = "Delete the stream and the lease table")
public class DeleteResourcesCommand implements Callable<Integer> {
  @CommandLine.ParentCommand RunCommand parent;

  @Override
  public Integer call() {
    Injector injector = parent.parent.injector();
    StreamConfig streamConfig = injector.getInstance(StreamConfig.class);
    ConsumerConfig consumerConfig = injector.getInstance(ConsumerConfig.class);

    injector.getInstance(StreamLifecycle.class).deleteStreamIfExists(streamConfig.name());
    injector.getInstance(LeaseTableAdmin.class).deleteTableIfExists(consumerConfig.applicationName());
    return 0;
  }
}
