package streamlease.sample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamlease.model.StreamRecord;
import streamlease.processor.RecordHandler;

import javax.inject.Inject;
import java.time.Clock;

/**
 * Logs each sample record along with how long ago it was produced.
 */
public class SampleRecordHandler implements RecordHandler<SampleRecord> {
  private static final Logger LOG = LoggerFactory.getLogger(SampleRecordHandler.class);

  private final Clock clock;

  @Inject
  public SampleRecordHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void handle(StreamRecord record, SampleRecord value) {
    long ageMillis = clock.millis() - value.createTimeMillis();
    LOG.info("{}, {}, {}, Created {} milliseconds ago.",
            record.sequenceNumber(), record.partitionKey(), value.data(), ageMillis);
  }
}
