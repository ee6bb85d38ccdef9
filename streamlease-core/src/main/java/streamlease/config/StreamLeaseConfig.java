package streamlease.config;

import com.typesafe.config.Config;
import streamlease.util.config.ConfigMapper;
import streamlease.util.config.HoconConfigMapper;

/**
 * Reads the typed settings out of a loaded {@link Config}. Defaults come from {@code reference.conf}.
 */
public final class StreamLeaseConfig {
  public static final String ROOT_PATH = "streamlease";
  public static final String CONSUMER_PATH = ROOT_PATH + ".consumer";
  public static final String STREAM_PATH = ROOT_PATH + ".stream";
  public static final String PRODUCER_PATH = ROOT_PATH + ".producer";

  private static final ConfigMapper MAPPER = new HoconConfigMapper();

  private StreamLeaseConfig() {
  }

  public static ConfigMapper configMapper() {
    return MAPPER;
  }

  public static ConsumerConfig consumer(Config config) {
    return MAPPER.mapSubConfig(config, CONSUMER_PATH, ConsumerConfig.class);
  }

  public static StreamConfig stream(Config config) {
    return MAPPER.mapSubConfig(config, STREAM_PATH, StreamConfig.class);
  }

  public static ProducerConfig producer(Config config) {
    return MAPPER.mapSubConfig(config, PRODUCER_PATH, ProducerConfig.class);
  }
}
