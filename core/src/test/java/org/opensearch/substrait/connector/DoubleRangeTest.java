/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DoubleRangeTest {

  @Test
  void default_range_accepts_everything() {
    DoubleRange range = new DoubleRange();

    assertTrue(range.test(null));
    assertTrue(range.test(Double.MAX_VALUE));
    assertEquals("(-inf, +inf) or null", range.toString());
  }

  @Test
  void not_null_rejects_only_null() {
    assertFalse(DoubleRange.notNull().test(null));
    assertTrue(DoubleRange.notNull().test(-1.0));
  }

  @Test
  void exclusive_bounds_reject_endpoints() {
    DoubleRange range = new DoubleRange(1, false, true, 2, false, true, false);

    assertFalse(range.test(1.0));
    assertTrue(range.test(1.5));
    assertFalse(range.test(2.0));
    assertEquals("(1.0, 2.0)", range.toString());
  }
}
