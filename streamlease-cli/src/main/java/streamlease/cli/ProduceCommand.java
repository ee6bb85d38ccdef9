package streamlease.cli;

import com.google.inject.Injector;
import picocli.CommandLine;
import streamlease.config.ConsumerConfig;
import streamlease.producer.SampleRecordProducer;

import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "produce",
        description = "Put sample records on the stream until interrupted, creating the stream if needed"
)
public class ProduceCommand implements Callable<Integer> {
  @CommandLine.ParentCommand StreamLeaseCli parent;

  @Override
  public Integer call() {
    Injector injector = parent.injector();
    SampleRecordProducer producer = injector.getInstance(SampleRecordProducer.class);
    boolean stoppedCleanly = new ServiceSupervisor(producer, injector.getInstance(ConsumerConfig.class).shutdownGracePeriod())
            .runUntilTerminated();
    return stoppedCleanly ? 0 : 1;
  }
}
