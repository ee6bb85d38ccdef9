package streamlease.sample;

import org.immutables.value.Value;

/**
 * The payload written by the sample producer: {@code testData-<creationMillis>}.
 */
@Value.Immutable
public interface SampleRecord {
  static SampleRecord of(String data, long createTimeMillis) {
    return ImmutableSampleRecord.of(data, createTimeMillis);
  }

  @Value.Parameter
  String data();

  @Value.Parameter
  long createTimeMillis();
}
