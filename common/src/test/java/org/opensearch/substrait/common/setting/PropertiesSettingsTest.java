/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PropertiesSettingsTest {

  @Test
  void missing_keys_fall_back_to_defaults() {
    Settings settings = new PropertiesSettings(new Properties());

    List<String> files = settings.getSettingValue(Settings.Key.FUNCTION_EXTENSION_FILES);
    assertTrue(files.contains("functions_comparison.yaml"));
    assertEquals(Boolean.TRUE, settings.getSettingValue(Settings.Key.PUSHDOWN_ENABLED));
  }

  @Test
  void properties_override_defaults() {
    Properties properties = new Properties();
    properties.setProperty("plugins.substrait.function.extensions", " a.yaml, b.yaml ,");
    properties.setProperty("plugins.substrait.pushdown.enabled", "false");
    Settings settings = new PropertiesSettings(properties);

    assertEquals(
        List.of("a.yaml", "b.yaml"),
        settings.getSettingValue(Settings.Key.FUNCTION_EXTENSION_FILES));
    assertEquals(Boolean.FALSE, settings.getSettingValue(Settings.Key.PUSHDOWN_ENABLED));
  }

  @Test
  void load_reads_classpath_resource() {
    Settings settings = PropertiesSettings.load("substrait-test.properties");

    assertEquals(Boolean.FALSE, settings.getSettingValue(Settings.Key.PUSHDOWN_ENABLED));
  }

  @Test
  void key_lookup_by_name() {
    assertEquals(
        Settings.Key.PUSHDOWN_ENABLED, Settings.Key.of("plugins.substrait.pushdown.enabled").get());
    assertFalse(Settings.Key.of("plugins.unknown").isPresent());
    assertFalse(Settings.Key.of(null).isPresent());
  }
}
