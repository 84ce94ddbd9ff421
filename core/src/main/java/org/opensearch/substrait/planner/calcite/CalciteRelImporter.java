/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.calcite;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.RelFieldCollation;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Aggregate;
import org.apache.calcite.rel.core.AggregateCall;
import org.apache.calcite.rel.core.JoinInfo;
import org.apache.calcite.rel.core.TableScan;
import org.apache.calcite.rel.logical.LogicalAggregate;
import org.apache.calcite.rel.logical.LogicalFilter;
import org.apache.calcite.rel.logical.LogicalJoin;
import org.apache.calcite.rel.logical.LogicalProject;
import org.apache.calcite.rel.logical.LogicalSort;
import org.apache.calcite.rel.logical.LogicalValues;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeField;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.TableHandle;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.expression.LiteralConverter;
import org.opensearch.substrait.planner.converter.SubstraitToPhysicalPlanConverter;
import org.opensearch.substrait.planner.physical.AggregationPhysicalOperator;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;
import org.opensearch.substrait.planner.physical.PhysicalPlanBuilder;
import org.opensearch.substrait.planner.physical.SortOrder;
import org.opensearch.substrait.planner.physical.page.PageBuilder;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Builds a physical operator tree from a Calcite logical plan, so that plans produced by the
 * Calcite planner can be exported to Substrait.
 *
 * <p>Supported RelNode patterns:
 *
 * <ul>
 *   <li>{@link LogicalFilter}, {@link LogicalProject}
 *   <li>{@link LogicalAggregate} with a single grouping set and no DISTINCT calls
 *   <li>{@link LogicalJoin} whose condition splits into equi keys and a residual filter
 *   <li>{@link LogicalSort} with collation, offset and fetch as literals
 *   <li>{@link LogicalValues} and any {@link TableScan}
 * </ul>
 */
@Log4j2
public class CalciteRelImporter {

  private final LiteralConverter literalConverter;

  public CalciteRelImporter(TypeConverter typeConverter) {
    this.literalConverter = new LiteralConverter(typeConverter);
  }

  /**
   * Converts the tree below {@code root}.
   *
   * @throws UnsupportedConstructException if the tree contains an operator with no physical
   *     counterpart
   */
  public PhysicalOperatorNode importPlan(RelNode root) {
    PhysicalPlanBuilder builder = new PhysicalPlanBuilder(root.getCluster().getRexBuilder());
    PhysicalOperatorNode node = visit(root, builder);
    log.debug("Imported Calcite {} as {}", root.getRelTypeName(), node.describe());
    return node;
  }

  private PhysicalOperatorNode visit(RelNode node, PhysicalPlanBuilder builder) {
    if (node instanceof LogicalFilter) {
      LogicalFilter filter = (LogicalFilter) node;
      return builder.filter(visit(filter.getInput(), builder), filter.getCondition());
    } else if (node instanceof LogicalProject) {
      LogicalProject project = (LogicalProject) node;
      return builder.project(
          visit(project.getInput(), builder),
          project.getRowType().getFieldNames(),
          project.getProjects());
    } else if (node instanceof LogicalAggregate) {
      return visitAggregate((LogicalAggregate) node, builder);
    } else if (node instanceof LogicalJoin) {
      return visitJoin((LogicalJoin) node, builder);
    } else if (node instanceof LogicalSort) {
      return visitSort((LogicalSort) node, builder);
    } else if (node instanceof LogicalValues) {
      return visitValues((LogicalValues) node, builder);
    } else if (node instanceof TableScan) {
      return visitTableScan((TableScan) node, builder);
    }
    throw new UnsupportedConstructException(
        String.format("Unsupported relational operator %s", node.getRelTypeName()));
  }

  private PhysicalOperatorNode visitAggregate(
      LogicalAggregate aggregate, PhysicalPlanBuilder builder) {
    if (aggregate.getGroupType() != Aggregate.Group.SIMPLE) {
      throw new UnsupportedConstructException(
          String.format("Unsupported aggregate group type %s", aggregate.getGroupType()));
    }
    PhysicalOperatorNode source = visit(aggregate.getInput(), builder);
    RexBuilder rexBuilder = builder.getRexBuilder();
    List<RelDataTypeField> inputFields = source.getOutputType().getFieldList();

    List<RexInputRef> groupingKeys = new ArrayList<>();
    for (int key : aggregate.getGroupSet()) {
      groupingKeys.add(rexBuilder.makeInputRef(inputFields.get(key).getType(), key));
    }
    List<String> names = new ArrayList<>();
    List<RexCall> calls = new ArrayList<>();
    List<RexInputRef> masks = new ArrayList<>();
    List<String> outputNames = aggregate.getRowType().getFieldNames();
    for (AggregateCall call : aggregate.getAggCallList()) {
      if (call.isDistinct()) {
        throw new UnsupportedConstructException(
            String.format("Unsupported DISTINCT aggregate %s", call));
      }
      List<RexNode> operands = new ArrayList<>();
      for (int argument : call.getArgList()) {
        operands.add(rexBuilder.makeInputRef(inputFields.get(argument).getType(), argument));
      }
      names.add(outputNames.get(groupingKeys.size() + calls.size()));
      calls.add((RexCall) rexBuilder.makeCall(call.getType(), call.getAggregation(), operands));
      masks.add(
          call.filterArg < 0
              ? null
              : rexBuilder.makeInputRef(
                  inputFields.get(call.filterArg).getType(), call.filterArg));
    }
    return builder.aggregate(
        source, AggregationPhysicalOperator.Step.SINGLE, groupingKeys, names, calls, masks);
  }

  private PhysicalOperatorNode visitJoin(LogicalJoin join, PhysicalPlanBuilder builder) {
    PhysicalOperatorNode left = visit(join.getLeft(), builder);
    PhysicalOperatorNode right = visit(join.getRight(), builder);
    RexBuilder rexBuilder = builder.getRexBuilder();
    JoinInfo info = join.analyzeCondition();

    List<RexInputRef> leftKeys = new ArrayList<>();
    List<RexInputRef> rightKeys = new ArrayList<>();
    for (int i = 0; i < info.leftKeys.size(); i++) {
      int leftKey = info.leftKeys.get(i);
      int rightKey = info.rightKeys.get(i);
      leftKeys.add(
          rexBuilder.makeInputRef(
              left.getOutputType().getFieldList().get(leftKey).getType(), leftKey));
      rightKeys.add(
          rexBuilder.makeInputRef(
              right.getOutputType().getFieldList().get(rightKey).getType(), rightKey));
    }
    RexNode remaining = info.getRemaining(rexBuilder);
    return builder.join(
        join.getJoinType(),
        left,
        right,
        leftKeys,
        rightKeys,
        remaining.isAlwaysTrue() ? null : remaining);
  }

  private PhysicalOperatorNode visitSort(LogicalSort sort, PhysicalPlanBuilder builder) {
    PhysicalOperatorNode node = visit(sort.getInput(), builder);
    List<RelFieldCollation> collations = sort.getCollation().getFieldCollations();
    if (!collations.isEmpty()) {
      RexBuilder rexBuilder = builder.getRexBuilder();
      List<RelDataTypeField> fields = node.getOutputType().getFieldList();
      List<RexInputRef> keys = new ArrayList<>();
      List<SortOrder> orders = new ArrayList<>();
      for (RelFieldCollation collation : collations) {
        int index = collation.getFieldIndex();
        keys.add(rexBuilder.makeInputRef(fields.get(index).getType(), index));
        orders.add(toSortOrder(collation));
      }
      node = builder.sort(node, keys, orders, false);
    }
    if (sort.offset != null || sort.fetch != null) {
      long offset = sort.offset == null ? 0 : literalValue(sort.offset);
      long count = sort.fetch == null ? Long.MAX_VALUE : literalValue(sort.fetch);
      node = builder.limit(node, offset, count, false);
    }
    return node;
  }

  private PhysicalOperatorNode visitValues(LogicalValues values, PhysicalPlanBuilder builder) {
    RelDataType rowType = values.getRowType();
    PageBuilder page = new PageBuilder(rowType.getFieldCount());
    for (List<RexLiteral> tuple : values.getTuples()) {
      Object[] row = new Object[tuple.size()];
      for (int i = 0; i < row.length; i++) {
        row[i] = literalConverter.toJavaValue(tuple.get(i));
      }
      page.addRow(row);
    }
    if (page.getRowCount() == 0) {
      return builder.values(rowType, Collections.emptyList());
    }
    return builder.values(rowType, Collections.singletonList(page.build()));
  }

  private PhysicalOperatorNode visitTableScan(TableScan scan, PhysicalPlanBuilder builder) {
    List<String> qualifiedName = scan.getTable().getQualifiedName();
    String tableName = qualifiedName.get(qualifiedName.size() - 1);
    String connectorId =
        qualifiedName.size() == 1
            ? SubstraitToPhysicalPlanConverter.DEFAULT_CONNECTOR
            : Joiner.on('.').join(qualifiedName.subList(0, qualifiedName.size() - 1));
    Map<String, ColumnHandle> assignments = new LinkedHashMap<>();
    for (RelDataTypeField field : scan.getRowType().getFieldList()) {
      assignments.put(field.getName(), new ColumnHandle(field.getName(), field.getType()));
    }
    return builder.scan(
        builder.nextId(),
        scan.getRowType(),
        new TableHandle(connectorId, tableName, false, Collections.emptyMap()),
        assignments);
  }

  private static SortOrder toSortOrder(RelFieldCollation collation) {
    boolean descending = collation.getDirection().isDescending();
    RelFieldCollation.NullDirection nulls = collation.nullDirection;
    if (nulls == RelFieldCollation.NullDirection.UNSPECIFIED) {
      nulls = collation.getDirection().defaultNullDirection();
    }
    boolean nullsFirst = nulls == RelFieldCollation.NullDirection.FIRST;
    if (descending) {
      return nullsFirst ? SortOrder.DESC_NULLS_FIRST : SortOrder.DESC_NULLS_LAST;
    }
    return nullsFirst ? SortOrder.ASC_NULLS_FIRST : SortOrder.ASC_NULLS_LAST;
  }

  private static long literalValue(RexNode node) {
    if (!(node instanceof RexLiteral)) {
      throw new UnsupportedConstructException(
          String.format("Unsupported non-literal offset or fetch %s", node));
    }
    Long value = ((RexLiteral) node).getValueAs(Long.class);
    if (value == null) {
      throw new UnsupportedConstructException("Unsupported NULL offset or fetch");
    }
    return value;
  }
}
