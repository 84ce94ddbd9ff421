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

/** Physical operator skipping {@code offset} rows and returning at most {@code count} rows. */
@Getter
@RequiredArgsConstructor
public class LimitPhysicalOperator implements PhysicalOperatorNode {

  private final String id;

  private final PhysicalOperatorNode source;

  private final long offset;

  /** Maximum number of rows to return. */
  private final long count;

  /** Whether the limit applies per partition before a final limit. */
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
    return PhysicalOperatorType.LIMIT;
  }

  @Override
  public String describe() {
    return String.format("Limit[%s](offset=%d, count=%d)", id, offset, count);
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitLimit(this, context);
  }
}
