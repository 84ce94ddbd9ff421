/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.TableHandle;

/** Physical operator representing a table scan operation. */
@Getter
@RequiredArgsConstructor
public class ScanPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final RelDataType outputType;

  /** Table to read, carrying pushed-down range filters. */
  private final TableHandle tableHandle;

  /** Table columns keyed by output column name. */
  private final Map<String, ColumnHandle> assignments;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Collections.emptyList();
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SCAN;
  }

  @Override
  public String describe() {
    return String.format(
        "Scan[%s](table=%s, columns=[%s])",
        id, tableHandle, String.join(", ", outputType.getFieldNames()));
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitScan(this, context);
  }
}
