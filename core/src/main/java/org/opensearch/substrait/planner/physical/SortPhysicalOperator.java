/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexInputRef;

/** Physical operator ordering rows by key columns. */
@Getter
@RequiredArgsConstructor
public class SortPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final PhysicalOperatorNode source;

  private final List<RexInputRef> sortKeys;

  /** One order per sort key. */
  private final List<SortOrder> sortOrders;

  /** Whether this sort only orders the rows of one partition. */
  private final boolean partial;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Collections.singletonList(source);
  }

  @Override
  public RelDataType getOutputType() {
    return source.getOutputType();
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.SORT;
  }

  @Override
  public String describe() {
    List<String> keys = new ArrayList<>();
    for (int i = 0; i < sortKeys.size(); i++) {
      keys.add(sortKeys.get(i) + " " + sortOrders.get(i));
    }
    return String.format("Sort[%s](%s)", id, String.join(", ", keys));
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitSort(this, context);
  }
}
