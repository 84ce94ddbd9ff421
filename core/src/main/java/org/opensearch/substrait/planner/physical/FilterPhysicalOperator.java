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
import org.apache.calcite.rex.RexNode;

/** Physical operator keeping the rows of its source that satisfy a condition. */
@Getter
@RequiredArgsConstructor
public class FilterPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final PhysicalOperatorNode source;

  /** Filter condition as Calcite RexNode, over the source's output columns. */
  private final RexNode condition;

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
    return PhysicalOperatorType.FILTER;
  }

  @Override
  public String describe() {
    return String.format("Filter[%s](condition=%s)", id, condition);
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
