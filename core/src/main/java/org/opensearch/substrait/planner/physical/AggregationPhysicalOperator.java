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
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;

/**
 * Physical operator grouping its source by key columns and computing aggregate calls. Output
 * columns are the grouping keys followed by one column per aggregate.
 */
@Getter
@RequiredArgsConstructor
public class AggregationPhysicalOperator implements PhysicalOperatorNode {

  /** Stage of a possibly distributed aggregation. */
  public enum Step {
    /** Raw input to accumulators. */
    PARTIAL,
    /** Accumulators to merged accumulators. */
    INTERMEDIATE,
    /** Raw input to final results in one stage. */
    SINGLE,
    /** Accumulators to final results. */
    FINAL
  }

  private final String id;

  private final PhysicalOperatorNode source;

  private final Step step;

  private final List<RexInputRef> groupingKeys;

  private final List<String> aggregateNames;

  /** Aggregate calls whose operands are columns of the source. */
  private final List<RexCall> aggregates;

  /**
   * Boolean mask column per aggregate, in aggregate order. A null entry or a missing trailing
   * entry means the aggregate sees every row.
   */
  private final List<RexInputRef> aggregateMasks;

  private final RelDataType outputType;

  @Override
  public List<PhysicalOperatorNode> getSources() {
    return Collections.singletonList(source);
  }

  @Override
  public PhysicalOperatorType getOperatorType() {
    return PhysicalOperatorType.AGGREGATION;
  }

  @Override
  public String describe() {
    List<String> items = new ArrayList<>();
    for (int i = 0; i < aggregates.size(); i++) {
      RexInputRef mask = i < aggregateMasks.size() ? aggregateMasks.get(i) : null;
      items.add(
          aggregateNames.get(i) + "=" + aggregates.get(i) + (mask == null ? "" : " mask " + mask));
    }
    return String.format(
        "Aggregate[%s](step=%s, keys=%s, aggregates=[%s])",
        id, step, groupingKeys, String.join(", ", items));
  }

  @Override
  public <R, C> R accept(PhysicalOperatorVisitor<R, C> visitor, C context) {
    return visitor.visitAggregation(this, context);
  }
}
