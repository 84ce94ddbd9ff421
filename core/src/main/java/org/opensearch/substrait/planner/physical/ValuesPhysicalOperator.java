/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.substrait.planner.physical.page.Page;

/** Leaf operator producing in-memory rows, one {@link Page} per batch. */
@Getter
@RequiredArgsConstructor
public class ValuesPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final RelDataType outputType;

  private final List<Page> values;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Collections.emptyList();
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.VALUES;
  }

  @Override
  public String describe() {
    int rows = values.stream().mapToInt(Page::getPositionCount).sum();
    return String.format("Values[%s](batches=%d, rows=%d)", id, values.size(), rows);
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitValues(this, context);
  }
}
