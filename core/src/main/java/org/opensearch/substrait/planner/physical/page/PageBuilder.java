/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical.page;

import java.util.ArrayList;
import java.util.List;

/** Builds a {@link Page} from rows, or from a flat column-major value list. */
public class PageBuilder {

  private final int channelCount;
  private final List<Object[]> rows;

  public PageBuilder(int channelCount) {
    if (channelCount < 0) {
      throw new IllegalArgumentException("channelCount must be non-negative: " + channelCount);
    }
    this.channelCount = channelCount;
    this.rows = new ArrayList<>();
  }

  /** Appends one row; the number of values must equal the channel count. */
  public PageBuilder addRow(Object... values) {
    if (values.length != channelCount) {
      throw new IllegalArgumentException(
          "Expected " + channelCount + " values but got " + values.length);
    }
    rows.add(values.clone());
    return this;
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  public Page build() {
    return new RowPage(rows.toArray(new Object[0][]), channelCount);
  }

  /**
   * Builds a page from values laid out column by column: the value of row r in column c sits at
   * {@code c * positionCount + r}.
   */
  public static Page fromColumnMajor(List<Object> values, int channelCount, int positionCount) {
    if (values.size() != channelCount * positionCount) {
      throw new IllegalArgumentException(
          "Expected "
              + channelCount * positionCount
              + " values for "
              + channelCount
              + " columns of "
              + positionCount
              + " rows but got "
              + values.size());
    }
    Object[][] data = new Object[positionCount][channelCount];
    for (int column = 0; column < channelCount; column++) {
      for (int row = 0; row < positionCount; row++) {
        data[row][column] = values.get(column * positionCount + row);
      }
    }
    return new RowPage(data, channelCount);
  }
}
