/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.connector;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;

/** Identifies the table read by a scan, together with the range filters pushed into it. */
@Getter
public class TableHandle {

  private final String connectorId;
  private final String tableName;
  private final boolean filterPushdownEnabled;

  /** Range filters keyed by column name. */
  private final Map<String, DoubleRange> subfieldFilters;

  public TableHandle(
      String connectorId,
      String tableName,
      boolean filterPushdownEnabled,
      Map<String, DoubleRange> subfieldFilters) {
    this.connectorId = connectorId;
    this.tableName = tableName;
    this.filterPushdownEnabled = filterPushdownEnabled;
    this.subfieldFilters = ImmutableMap.copyOf(subfieldFilters);
  }

  @Override
  public String toString() {
    return connectorId + "." + tableName + (subfieldFilters.isEmpty() ? "" : subfieldFilters);
  }
}
