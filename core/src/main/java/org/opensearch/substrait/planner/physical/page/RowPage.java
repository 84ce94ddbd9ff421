/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical.page;

import java.util.Arrays;

/** Row-based {@link Page}: {@code rows[i][j]} is the value at row i, column j. */
public class RowPage implements Page {

  private final Object[][] rows;
  private final int channelCount;

  public RowPage(Object[][] rows, int channelCount) {
    for (Object[] row : rows) {
      if (row.length != channelCount) {
        throw new IllegalArgumentException(
            "Row width " + row.length + " does not match channel count " + channelCount);
      }
    }
    this.rows = rows;
    this.channelCount = channelCount;
  }

  @Override
  public int getPositionCount() {
    return rows.length;
  }

  @Override
  public int getChannelCount() {
    return channelCount;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (position < 0 || position >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.length + ")");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    return rows[position][channel];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowPage)) {
      return false;
    }
    RowPage other = (RowPage) o;
    return channelCount == other.channelCount && Arrays.deepEquals(rows, other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.deepHashCode(rows) + channelCount;
  }

  @Override
  public String toString() {
    return "RowPage" + Arrays.deepToString(rows);
  }
}
