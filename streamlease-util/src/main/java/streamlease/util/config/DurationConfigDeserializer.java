package streamlease.util.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.google.common.collect.ImmutableMap;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations the way HOCON writes them ("500ms", "10 s", "3 minutes"). Bare numbers are milliseconds,
 * matching {@link com.typesafe.config.Config#getDuration}; anything else falls back to ISO-8601 ("PT30S").
 */
public class DurationConfigDeserializer extends JsonDeserializer<Duration> {
  public static final Module JACKSON_MODULE = new SimpleModule("DurationConfigModule")
          .addDeserializer(Duration.class, new DurationConfigDeserializer())
          .addSerializer(Duration.class, ToStringSerializer.instance);
  private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)\\s*(\\S+)");

  private static final Map<String, ChronoUnit> SUFFIXES = ImmutableMap.<String, ChronoUnit>builder()
          .put("ns", ChronoUnit.NANOS)
          .put("nanos", ChronoUnit.NANOS)
          .put("nanoseconds", ChronoUnit.NANOS)
          .put("us", ChronoUnit.MICROS)
          .put("micros", ChronoUnit.MICROS)
          .put("microseconds", ChronoUnit.MICROS)
          .put("ms", ChronoUnit.MILLIS)
          .put("millis", ChronoUnit.MILLIS)
          .put("milliseconds", ChronoUnit.MILLIS)
          .put("s", ChronoUnit.SECONDS)
          .put("second", ChronoUnit.SECONDS)
          .put("seconds", ChronoUnit.SECONDS)
          .put("m", ChronoUnit.MINUTES)
          .put("min", ChronoUnit.MINUTES)
          .put("minute", ChronoUnit.MINUTES)
          .put("minutes", ChronoUnit.MINUTES)
          .put("h", ChronoUnit.HOURS)
          .put("hour", ChronoUnit.HOURS)
          .put("hours", ChronoUnit.HOURS)
          .put("d", ChronoUnit.DAYS)
          .put("day", ChronoUnit.DAYS)
          .put("days", ChronoUnit.DAYS)
          .build();

  @Override
  public Duration deserialize(JsonParser jsonParser, DeserializationContext context) throws IOException {
    if (jsonParser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
      return Duration.ofMillis(jsonParser.getLongValue());
    }
    return parse(jsonParser.getValueAsString());
  }

  public static Duration parse(String duration) {
    String trimmed = duration.trim();
    if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
      return Duration.ofMillis(Long.parseLong(trimmed));
    }
    Matcher matcher = DURATION_PATTERN.matcher(trimmed);
    if (matcher.matches()) {
      ChronoUnit unit = SUFFIXES.get(matcher.group(2));
      if (unit != null) {
        return Duration.of(Long.parseLong(matcher.group(1)), unit);
      }
    }
    return Duration.parse(trimmed);
  }
}
