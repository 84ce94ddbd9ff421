/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.common.setting;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Substrait conversion settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Comma separated classpath resources holding the function extension definitions. */
    FUNCTION_EXTENSION_FILES("plugins.substrait.function.extensions"),

    /** Whether read filters are extracted into range filters on the table handle. */
    PUSHDOWN_ENABLED("plugins.substrait.pushdown.enabled");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      String key = Strings.isNullOrEmpty(keyValue) ? "" : keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.getOrDefault(key, null));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
