/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexNode;

/**
 * Physical operator joining two sources on pairs of equal key columns. Left keys index the left
 * source, right keys index the right source, and the optional residual filter is evaluated over
 * the left columns followed by the right columns.
 */
@Getter
@RequiredArgsConstructor
public class JoinPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final JoinRelType joinType;

  private final List<RexInputRef> leftKeys;

  private final List<RexInputRef> rightKeys;

  /** Non-equi part of the join condition, null when absent. */
  private final RexNode filter;

  private final PhysicalOperatorNode left;

  private final PhysicalOperatorNode right;

  private final RelDataType outputType;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Arrays.asList(left, right);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.JOIN;
  }

  @Override
  public String describe() {
    return String.format(
        "Join[%s](type=%s, leftKeys=%s, rightKeys=%s%s)",
        id, joinType, leftKeys, rightKeys, filter == null ? "" : ", filter=" + filter);
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
