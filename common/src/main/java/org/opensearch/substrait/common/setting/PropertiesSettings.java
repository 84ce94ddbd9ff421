/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.common.setting;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * {@link Settings} backed by a properties file. Keys missing from the file fall back to the
 * defaults below.
 */
public class PropertiesSettings extends Settings {

  public static final String DEFAULT_RESOURCE = "substrait.properties";

  static final Map<Key, Object> DEFAULTS =
      ImmutableMap.of(
          Key.FUNCTION_EXTENSION_FILES,
          ImmutableList.of(
              "functions_aggregate_generic.yaml",
              "functions_arithmetic.yaml",
              "functions_arithmetic_decimal.yaml",
              "functions_boolean.yaml",
              "functions_comparison.yaml",
              "functions_datetime.yaml",
              "functions_logarithmic.yaml",
              "functions_rounding.yaml",
              "functions_string.yaml"),
          Key.PUSHDOWN_ENABLED,
          Boolean.TRUE);

  private final Map<Key, Object> values;

  public PropertiesSettings(Properties properties) {
    ImmutableMap.Builder<Key, Object> builder = ImmutableMap.builder();
    for (Key key : Key.values()) {
      String raw = properties.getProperty(key.getKeyValue());
      builder.put(key, raw == null ? DEFAULTS.get(key) : parse(key, raw));
    }
    this.values = builder.build();
  }

  /** Loads settings from {@link #DEFAULT_RESOURCE}, or defaults when the resource is absent. */
  public static PropertiesSettings load() {
    return load(DEFAULT_RESOURCE);
  }

  public static PropertiesSettings load(String resource) {
    Properties properties = new Properties();
    try (InputStream in = PropertiesSettings.class.getClassLoader().getResourceAsStream(resource)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed settings resource " + resource, e);
    }
    return new PropertiesSettings(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return ImmutableList.copyOf(values.entrySet());
  }

  private static Object parse(Key key, String raw) {
    switch (key) {
      case FUNCTION_EXTENSION_FILES:
        return ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(raw));
      case PUSHDOWN_ENABLED:
        return Boolean.parseBoolean(raw.trim());
      default:
        throw new IllegalArgumentException("Unknown setting " + key);
    }
  }
}
