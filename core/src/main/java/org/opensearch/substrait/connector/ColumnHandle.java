/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.connector;

import lombok.Data;
import org.apache.calcite.rel.type.RelDataType;

/** A column of a scanned table as exposed to the scan operator. */
@Data
public class ColumnHandle {

  private final String name;
  private final RelDataType type;
}
