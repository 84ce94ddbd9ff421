/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.validate.SqlValidatorUtil;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.TableHandle;
import org.opensearch.substrait.planner.physical.page.Page;

/**
 * Creates physical operators for one plan. Node ids are handed out sequentially starting at "0",
 * and output types are derived from the sources.
 */
public class PhysicalPlanBuilder {

  @Getter private final RexBuilder rexBuilder;

  private int nextId;

  public PhysicalPlanBuilder(RexBuilder rexBuilder) {
    this.rexBuilder = rexBuilder;
  }

  public RelDataTypeFactory getTypeFactory() {
    return rexBuilder.getTypeFactory();
  }

  public String nextId() {
    return String.valueOf(nextId++);
  }

  public ValuesPhysicalOperator values(RelDataType outputType, List<Page> values) {
    return values(nextId(), outputType, values);
  }

  public ValuesPhysicalOperator values(String id, RelDataType outputType, List<Page> values) {
    for (Page page : values) {
      Preconditions.checkArgument(
          page.getChannelCount() == outputType.getFieldCount(),
          "Values page has %s channels, expected %s",
          page.getChannelCount(),
          outputType.getFieldCount());
    }
    return new ValuesPhysicalOperator(id, outputType, values);
  }

  public ScanPhysicalOperator scan(
      String id,
      RelDataType outputType,
      TableHandle tableHandle,
      Map<String, ColumnHandle> assignments) {
    return new ScanPhysicalOperator(id, outputType, tableHandle, assignments);
  }

  public FilterPhysicalOperator filter(PhysicalOperatorNode source, RexNode condition) {
    return new FilterPhysicalOperator(nextId(), source, condition);
  }

  public ProjectionPhysicalOperator project(
      PhysicalOperatorNode source, List<String> names, List<RexNode> projections) {
    return project(nextId(), source, names, projections);
  }

  /** Projection with an id taken from {@link #nextId()} beforehand. */
  public ProjectionPhysicalOperator project(
      String id, PhysicalOperatorNode source, List<String> names, List<RexNode> projections) {
    Preconditions.checkArgument(
        names.size() == projections.size(),
        "Got %s names for %s projections",
        names.size(),
        projections.size());
    RelDataTypeFactory.Builder outputType = getTypeFactory().builder();
    for (int i = 0; i < names.size(); i++) {
      outputType.add(names.get(i), projections.get(i).getType());
    }
    return new ProjectionPhysicalOperator(
        id, source, names, projections, outputType.uniquify().build());
  }

  public AggregationPhysicalOperator aggregate(
      PhysicalOperatorNode source,
      AggregationPhysicalOperator.Step step,
      List<RexInputRef> groupingKeys,
      List<String> aggregateNames,
      List<RexCall> aggregates,
      List<RexInputRef> aggregateMasks) {
    return aggregate(
        nextId(), source, step, groupingKeys, aggregateNames, aggregates, aggregateMasks);
  }

  /** Aggregation with an id taken from {@link #nextId()} beforehand. */
  public AggregationPhysicalOperator aggregate(
      String id,
      PhysicalOperatorNode source,
      AggregationPhysicalOperator.Step step,
      List<RexInputRef> groupingKeys,
      List<String> aggregateNames,
      List<RexCall> aggregates,
      List<RexInputRef> aggregateMasks) {
    Preconditions.checkArgument(
        aggregateNames.size() == aggregates.size(),
        "Got %s names for %s aggregates",
        aggregateNames.size(),
        aggregates.size());
    RelDataTypeFactory.Builder outputType = getTypeFactory().builder();
    for (RexInputRef key : groupingKeys) {
      outputType.add(source.getOutputType().getFieldList().get(key.getIndex()));
    }
    for (int i = 0; i < aggregates.size(); i++) {
      outputType.add(aggregateNames.get(i), aggregates.get(i).getType());
    }
    return new AggregationPhysicalOperator(
        id,
        source,
        step,
        groupingKeys,
        aggregateNames,
        aggregates,
        aggregateMasks,
        outputType.uniquify().build());
  }

  /** Joins two sources; semi and anti joins only output the left columns. */
  public JoinPhysicalOperator join(
      JoinRelType joinType,
      PhysicalOperatorNode left,
      PhysicalOperatorNode right,
      List<RexInputRef> leftKeys,
      List<RexInputRef> rightKeys,
      RexNode filter) {
    Preconditions.checkArgument(
        leftKeys.size() == rightKeys.size(),
        "Got %s left keys and %s right keys",
        leftKeys.size(),
        rightKeys.size());
    RelDataType outputType =
        SqlValidatorUtil.deriveJoinRowType(
            left.getOutputType(),
            right.getOutputType(),
            joinType,
            getTypeFactory(),
            null,
            Collections.emptyList());
    return new JoinPhysicalOperator(
        nextId(), joinType, leftKeys, rightKeys, filter, left, right, outputType);
  }

  public SortPhysicalOperator sort(
      PhysicalOperatorNode source,
      List<RexInputRef> sortKeys,
      List<SortOrder> sortOrders,
      boolean partial) {
    Preconditions.checkArgument(
        sortKeys.size() == sortOrders.size(),
        "Got %s sort keys and %s sort orders",
        sortKeys.size(),
        sortOrders.size());
    return new SortPhysicalOperator(nextId(), source, sortKeys, sortOrders, partial);
  }

  public LimitPhysicalOperator limit(
      PhysicalOperatorNode source, long offset, long count, boolean partial) {
    return new LimitPhysicalOperator(nextId(), source, offset, count, partial);
  }
}
