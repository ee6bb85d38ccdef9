package streamlease.util.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.lang.reflect.Type;

/**
 * A {@link ConfigMapper} that converts the unwrapped HOCON structure with Jackson, so any type Jackson can
 * deserialize (including Immutables value types annotated with {@code @JsonDeserialize}) can be used as a
 * config holder.
 * <p/>
 * Durations may be written in HOCON style ("10s", "3000ms", "10m"); see {@link DurationConfigDeserializer}.
 */
public class HoconConfigMapper implements ConfigMapper {
  private final ObjectMapper objectMapper;

  public HoconConfigMapper() {
    this(new ObjectMapper());
  }

  public HoconConfigMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
            .registerModule(new Jdk8Module())
            .registerModule(DurationConfigDeserializer.JACKSON_MODULE)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
  }

  @Override
  public <T> T map(Object configObject, Type mappedType) {
    JavaType javaType = objectMapper.getTypeFactory().constructType(mappedType);
    return objectMapper.convertValue(configObject, javaType);
  }
}
