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
import org.apache.calcite.rex.RexNode;

/** Physical operator computing one output column per projection expression. */
@Getter
@RequiredArgsConstructor
public class ProjectionPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final PhysicalOperatorNode source;

  /** Output column names, one per projection. */
  private final List<String> names;

  /** Projection expressions over the source's output columns. */
  private final List<RexNode> projections;

  private final RelDataType outputType;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Collections.singletonList(source);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.PROJECTION;
  }

  @Override
  public String describe() {
    List<String> items = new ArrayList<>();
    for (int i = 0; i < projections.size(); i++) {
      items.add(names.get(i) + "=" + projections.get(i));
    }
    return String.format("Project[%s](%s)", id, String.join(", ", items));
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitProjection(this, context);
  }
}
