/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical.page;

/**
 * A batch of literal rows held by a values operator. Values are plain Java objects: Boolean,
 * Byte, Short, Integer, Long, Float, Double, String, byte[], BigDecimal, Integer days for dates,
 * Long microseconds for timestamps, List for arrays and rows, Map for maps.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /** Returns an empty page with zero rows and the given number of columns. */
  static Page empty(int channelCount) {
    return new RowPage(new Object[0][channelCount], channelCount);
  }
}
