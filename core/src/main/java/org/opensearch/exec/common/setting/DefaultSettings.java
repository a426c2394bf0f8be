/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.exec.common.setting;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;

/**
 * Settings read from {@code exec-settings.properties} on the classpath. Keys missing from the file
 * take their default; explicit overrides win over both and are converted to the key's type.
 */
@Log4j2
public class DefaultSettings extends Settings {

  public static final String RESOURCE = "exec-settings.properties";

  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public DefaultSettings() {
    this(Map.of());
  }

  public DefaultSettings(Map<Key, Object> overrides) {
    this(loadResource(RESOURCE), overrides);
  }

  public DefaultSettings(Properties properties, Map<Key, Object> overrides) {
    for (Key key : Key.values()) {
      String raw = properties.getProperty(key.getKeyValue());
      values.put(key, raw == null ? key.getDefaultValue() : key.parse(raw));
    }
    for (String name : properties.stringPropertyNames()) {
      if (Key.of(name).isEmpty()) {
        log.warn("Ignoring unknown setting {}", name);
      }
    }
    overrides.forEach((key, value) -> values.put(key, key.convert(value)));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  private static Properties loadResource(String resource) {
    Properties properties = new Properties();
    try (InputStream in = DefaultSettings.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No {} on the classpath, using defaults", resource);
      } else {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
    return properties;
  }
}
