package streamlease.util.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import java.lang.reflect.Type;

/**
 * Maps HOCON {@link Config} trees onto typed value objects.
 */
public interface ConfigMapper {
  <T> T map(Object configObject, Type mappedType);

  default <T> T mapConfig(Config config, Class<T> mappedType) {
    return mapConfigValue(config.root(), mappedType);
  }

  default <T> T mapSubConfig(Config config, String path, Class<T> mappedType) {
    try {
      return mapConfigValue(config.getValue(path), mappedType);
    } catch (RuntimeException e) {
      throw new ConfigMappingException(path, mappedType, e);
    }
  }

  default <T> T mapConfigValue(ConfigValue configValue, Class<T> mappedType) {
    return mappedType.cast(map(configValue.unwrapped(), mappedType));
  }

  class ConfigMappingException extends RuntimeException {
    ConfigMappingException(String path, Type mappedType, Throwable cause) {
      super(String.format("Unable to map config at '%s' to %s: %s", path, mappedType.getTypeName(), cause.getMessage()), cause);
    }
  }
}
