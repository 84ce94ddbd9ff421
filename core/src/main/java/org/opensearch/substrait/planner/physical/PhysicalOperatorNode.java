/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import java.util.List;
import org.apache.calcite.rel.type.RelDataType;

/**
 * Base interface for physical operator nodes. A node owns its sources; trees never share
 * subtrees.
 */
public interface PhysicalOperatorNode {

  /** Identifier of the node, unique within one plan. */
  String getId();

  /** Input operators in order, empty for leaves. */
  List<PhysicalOperatorNode> getSources();

  /** Ordered output columns as a Calcite row type. */
  RelDataType getOutputType();

  /** Returns the type of this physical operator. */
  PhysicalOperatorType getOperatorType();

  /** Returns a string representation of this operator's configuration. */
  String describe();

  <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context);
}
