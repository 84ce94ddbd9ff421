/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import io.substrait.proto.AggregateFunction;
import io.substrait.proto.AggregateRel;
import io.substrait.proto.AggregationPhase;
import io.substrait.proto.Expression;
import io.substrait.proto.FetchRel;
import io.substrait.proto.FilterRel;
import io.substrait.proto.FunctionArgument;
import io.substrait.proto.JoinRel;
import io.substrait.proto.Plan;
import io.substrait.proto.PlanRel;
import io.substrait.proto.ProjectRel;
import io.substrait.proto.ReadRel;
import io.substrait.proto.Rel;
import io.substrait.proto.RelCommon;
import io.substrait.proto.RelRoot;
import io.substrait.proto.SortField;
import io.substrait.proto.SortRel;
import io.substrait.proto.Type;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rel.type.RelDataTypeField;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlOperator;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeName;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.DoubleRange;
import org.opensearch.substrait.connector.TableHandle;
import org.opensearch.substrait.exception.FunctionNotFoundException;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.expression.RexToSubstraitConverter;
import org.opensearch.substrait.function.FunctionCatalog;
import org.opensearch.substrait.function.FunctionMappings;
import org.opensearch.substrait.function.FunctionReferenceCollector;
import org.opensearch.substrait.function.FunctionSignature;
import org.opensearch.substrait.function.FunctionVariant;
import org.opensearch.substrait.planner.physical.AggregationPhysicalOperator;
import org.opensearch.substrait.planner.physical.FilterPhysicalOperator;
import org.opensearch.substrait.planner.physical.JoinPhysicalOperator;
import org.opensearch.substrait.planner.physical.LimitPhysicalOperator;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;
import org.opensearch.substrait.planner.physical.PhysicalOperatorVisitor;
import org.opensearch.substrait.planner.physical.ProjectionPhysicalOperator;
import org.opensearch.substrait.planner.physical.ScanPhysicalOperator;
import org.opensearch.substrait.planner.physical.SortPhysicalOperator;
import org.opensearch.substrait.planner.physical.ValuesPhysicalOperator;
import org.opensearch.substrait.planner.physical.page.Page;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Converts a physical operator tree into a Substrait plan.
 *
 * <p>The converter itself holds no per-plan state and can be shared. Each call to {@link
 * #toSubstrait(PhysicalOperatorNode)} uses a fresh {@link FunctionReferenceCollector}, whose
 * anchors are written to the plan extensions once the whole tree is converted.
 */
@Log4j2
public class PhysicalToSubstraitPlanConverter {

  @Getter private final TypeConverter typeConverter;
  @Getter private final FunctionCatalog functionCatalog;
  private final RexBuilder rexBuilder;

  public PhysicalToSubstraitPlanConverter(
      TypeConverter typeConverter, FunctionCatalog functionCatalog) {
    this.typeConverter = typeConverter;
    this.functionCatalog = functionCatalog;
    this.rexBuilder = new RexBuilder(typeConverter.getTypeFactory());
  }

  /** Converts the tree below {@code root} into a plan with a single root relation. */
  public Plan toSubstrait(PhysicalOperatorNode root) {
    FunctionReferenceCollector collector = new FunctionReferenceCollector();
    RexToSubstraitConverter expressions =
        new RexToSubstraitConverter(typeConverter, functionCatalog, collector);
    Rel rel = root.accept(new RelConverter(), expressions);

    Plan.Builder plan = Plan.newBuilder();
    plan.addRelations(
        PlanRel.newBuilder()
            .setRoot(
                RelRoot.newBuilder()
                    .setInput(rel)
                    .addAllNames(
                        typeConverter.toNamedStruct(root.getOutputType()).getNamesList())));
    collector.addExtensionsToPlan(plan);
    log.info(
        "Converted physical plan rooted at {} to Substrait with {} function references",
        root.getId(),
        collector.size());
    return plan.build();
  }

  private class RelConverter implements PhysicalOperatorVisitor<Rel, RexToSubstraitConverter> {

    @Override
    public Rel visitFilter(FilterPhysicalOperator node, RexToSubstraitConverter expressions) {
      PhysicalOperatorNode source = singleSource(node);
      return Rel.newBuilder()
          .setFilter(
              FilterRel.newBuilder()
                  .setInput(source.accept(this, expressions))
                  .setCondition(
                      expressions.toExpression(node.getCondition(), source.getOutputType())))
          .build();
    }

    @Override
    public Rel visitProjection(
        ProjectionPhysicalOperator node, RexToSubstraitConverter expressions) {
      PhysicalOperatorNode source = singleSource(node);
      RelDataType inputType = source.getOutputType();
      ProjectRel.Builder project =
          ProjectRel.newBuilder().setInput(source.accept(this, expressions));
      // Project appends its expressions after the input columns.
      RelCommon.Emit.Builder emit = RelCommon.Emit.newBuilder();
      for (int i = 0; i < node.getProjections().size(); i++) {
        project.addExpressions(expressions.toExpression(node.getProjections().get(i), inputType));
        emit.addOutputMapping(inputType.getFieldCount() + i);
      }
      project.setCommon(RelCommon.newBuilder().setEmit(emit));
      return Rel.newBuilder().setProject(project).build();
    }

    @Override
    public Rel visitAggregation(
        AggregationPhysicalOperator node, RexToSubstraitConverter expressions) {
      PhysicalOperatorNode source = singleSource(node);
      RelDataType inputType = source.getOutputType();
      List<RexInputRef> masks =
          node.getAggregateMasks() == null
              ? Collections.emptyList()
              : node.getAggregateMasks();
      if (masks.size() > node.getAggregates().size()) {
        throw new PlanStructureException(
            String.format(
                "Aggregation %s has %d masks for %d aggregates",
                node.getId(), masks.size(), node.getAggregates().size()));
      }
      AggregationPhase phase = AggregationPhases.toPhase(node.getStep());

      AggregateRel.Builder aggregate =
          AggregateRel.newBuilder().setInput(source.accept(this, expressions));
      AggregateRel.Grouping.Builder grouping = AggregateRel.Grouping.newBuilder();
      for (RexInputRef key : node.getGroupingKeys()) {
        grouping.addGroupingExpressions(expressions.toExpression(key, inputType));
      }
      aggregate.addGroupings(grouping);

      for (int i = 0; i < node.getAggregates().size(); i++) {
        AggregateRel.Measure.Builder measure =
            AggregateRel.Measure.newBuilder()
                .setMeasure(
                    toAggregateFunction(
                        node.getAggregates().get(i), phase, inputType, expressions));
        RexInputRef mask = i < masks.size() ? masks.get(i) : null;
        if (mask != null) {
          measure.setFilter(expressions.toExpression(mask, inputType));
        }
        aggregate.addMeasures(measure);
      }
      return Rel.newBuilder().setAggregate(aggregate).build();
    }

    @Override
    public Rel visitJoin(JoinPhysicalOperator node, RexToSubstraitConverter expressions) {
      if (node.getSources().size() != 2) {
        throw new PlanStructureException(
            String.format(
                "Join %s needs exactly two sources, got %d",
                node.getId(), node.getSources().size()));
      }
      if (node.getJoinType() != JoinRelType.INNER) {
        throw new UnsupportedConstructException(
            String.format("Unsupported join type %s", node.getJoinType()));
      }
      PhysicalOperatorNode left = node.getSources().get(0);
      PhysicalOperatorNode right = node.getSources().get(1);
      RelDataType joinedType =
          typeConverter
              .getTypeFactory()
              .createJoinType(left.getOutputType(), right.getOutputType());
      int leftWidth = left.getOutputType().getFieldCount();

      List<RexNode> conjuncts = new ArrayList<>();
      for (int i = 0; i < node.getLeftKeys().size(); i++) {
        RexInputRef leftKey = node.getLeftKeys().get(i);
        RexInputRef rightKey = node.getRightKeys().get(i);
        conjuncts.add(
            rexBuilder.makeCall(
                SqlStdOperatorTable.EQUALS,
                rexBuilder.makeInputRef(leftKey.getType(), leftKey.getIndex()),
                rexBuilder.makeInputRef(rightKey.getType(), leftWidth + rightKey.getIndex())));
      }
      if (node.getFilter() != null) {
        conjuncts.add(node.getFilter());
      }
      RexNode condition;
      if (conjuncts.isEmpty()) {
        condition = rexBuilder.makeLiteral(true);
      } else if (conjuncts.size() == 1) {
        condition = conjuncts.get(0);
      } else {
        condition = rexBuilder.makeCall(SqlStdOperatorTable.AND, conjuncts);
      }

      return Rel.newBuilder()
          .setJoin(
              JoinRel.newBuilder()
                  .setLeft(left.accept(this, expressions))
                  .setRight(right.accept(this, expressions))
                  .setType(JoinRel.JoinType.JOIN_TYPE_INNER)
                  .setExpression(expressions.toExpression(condition, joinedType)))
          .build();
    }

    @Override
    public Rel visitValues(ValuesPhysicalOperator node, RexToSubstraitConverter expressions) {
      List<RelDataTypeField> fields = node.getOutputType().getFieldList();
      ReadRel.VirtualTable.Builder table = ReadRel.VirtualTable.newBuilder();
      for (Page page : node.getValues()) {
        // Column-major: all values of the first column, then the second, and so on.
        Expression.Literal.Struct.Builder struct = Expression.Literal.Struct.newBuilder();
        for (int channel = 0; channel < page.getChannelCount(); channel++) {
          RelDataType type = fields.get(channel).getType();
          for (int position = 0; position < page.getPositionCount(); position++) {
            struct.addFields(
                expressions
                    .getLiteralConverter()
                    .toLiteral(page.getValue(position, channel), type));
          }
        }
        table.addValues(struct);
      }
      return Rel.newBuilder()
          .setRead(
              ReadRel.newBuilder()
                  .setBaseSchema(typeConverter.toNamedStruct(node.getOutputType()))
                  .setVirtualTable(table))
          .build();
    }

    @Override
    public Rel visitScan(ScanPhysicalOperator node, RexToSubstraitConverter expressions) {
      RelDataType schema = baseSchema(node);
      TableHandle handle = node.getTableHandle();
      ReadRel.Builder read =
          ReadRel.newBuilder()
              .setBaseSchema(typeConverter.toNamedStruct(schema))
              .setNamedTable(
                  ReadRel.NamedTable.newBuilder()
                      .addNames(handle.getConnectorId())
                      .addNames(handle.getTableName()));
      if (!handle.getSubfieldFilters().isEmpty()) {
        RexNode condition = toRangeCondition(handle.getSubfieldFilters(), schema);
        read.setFilter(expressions.toExpression(condition, schema));
      }
      return Rel.newBuilder().setRead(read).build();
    }

    @Override
    public Rel visitSort(SortPhysicalOperator node, RexToSubstraitConverter expressions) {
      PhysicalOperatorNode source = singleSource(node);
      SortRel.Builder sort = SortRel.newBuilder().setInput(source.accept(this, expressions));
      for (int i = 0; i < node.getSortKeys().size(); i++) {
        sort.addSorts(
            SortField.newBuilder()
                .setExpr(
                    expressions.toExpression(node.getSortKeys().get(i), source.getOutputType()))
                .setDirection(SortDirections.toDirection(node.getSortOrders().get(i))));
      }
      return Rel.newBuilder().setSort(sort).build();
    }

    @Override
    public Rel visitLimit(LimitPhysicalOperator node, RexToSubstraitConverter expressions) {
      PhysicalOperatorNode source = singleSource(node);
      return Rel.newBuilder()
          .setFetch(
              FetchRel.newBuilder()
                  .setInput(source.accept(this, expressions))
                  .setOffset(node.getOffset())
                  .setCount(node.getCount()))
          .build();
    }
  }

  private AggregateFunction toAggregateFunction(
      RexCall call,
      AggregationPhase phase,
      RelDataType inputType,
      RexToSubstraitConverter expressions) {
    List<Type> argumentTypes = new ArrayList<>();
    AggregateFunction.Builder function = AggregateFunction.newBuilder();
    for (RexNode operand : call.getOperands()) {
      if (!(operand instanceof RexInputRef) && !(operand instanceof RexLiteral)) {
        throw new UnsupportedConstructException(
            String.format(
                "Aggregate argument %s of %s must be projected before aggregation",
                operand, call.getOperator().getName()));
      }
      function.addArguments(
          FunctionArgument.newBuilder().setValue(expressions.toExpression(operand, inputType)));
      argumentTypes.add(typeConverter.toSubstrait(operand.getType()));
    }
    SqlOperator operator = call.getOperator();
    FunctionSignature signature =
        FunctionSignature.of(FunctionMappings.toFunctionName(operator), argumentTypes, true);
    FunctionVariant variant =
        functionCatalog
            .lookup(signature)
            .orElseThrow(() -> new FunctionNotFoundException(signature.toString()));
    return function
        .setFunctionReference(expressions.getFunctionCollector().getReference(variant))
        .setOutputType(typeConverter.toSubstrait(call.getType()))
        .setPhase(phase)
        .build();
  }

  /** Table columns in output order, named after the assigned column handles. */
  private RelDataType baseSchema(ScanPhysicalOperator node) {
    Map<String, ColumnHandle> assignments = node.getAssignments();
    RelDataTypeFactory.Builder schema = typeConverter.getTypeFactory().builder();
    for (RelDataTypeField field : node.getOutputType().getFieldList()) {
      ColumnHandle column = assignments.get(field.getName());
      schema.add(column == null ? field.getName() : column.getName(), field.getType());
    }
    return schema.build();
  }

  private RexNode boundLiteral(String column, double bound, RelDataType literalType) {
    if (Double.isNaN(bound) || Double.isInfinite(bound)) {
      throw new UnsupportedConstructException(
          String.format("Non-finite range bound %s on column %s", bound, column));
    }
    return rexBuilder.makeApproxLiteral(BigDecimal.valueOf(bound), literalType);
  }

  /** Re-encodes pushed-down ranges as a conjunction of comparisons with float literals. */
  private RexNode toRangeCondition(Map<String, DoubleRange> ranges, RelDataType schema) {
    List<RexNode> conjuncts = new ArrayList<>();
    ranges.forEach(
        (column, range) -> {
          RelDataTypeField field = schema.getField(column, true, false);
          if (field == null) {
            throw new PlanStructureException(
                String.format("Range filter on unknown column %s", column));
          }
          SqlTypeName typeName = field.getType().getSqlTypeName();
          if (typeName != SqlTypeName.DOUBLE
              && typeName != SqlTypeName.FLOAT
              && typeName != SqlTypeName.REAL) {
            throw new UnsupportedConstructException(
                String.format(
                    "Unsupported range filter on column %s of type %s", column, typeName));
          }
          RexNode ref = rexBuilder.makeInputRef(field.getType(), field.getIndex());
          RelDataType literalType =
              typeConverter.getTypeFactory().createTypeWithNullability(field.getType(), false);
          if (!range.isNullAllowed()) {
            conjuncts.add(rexBuilder.makeCall(SqlStdOperatorTable.IS_NOT_NULL, ref));
          }
          if (!range.isLowerUnbounded()) {
            conjuncts.add(
                rexBuilder.makeCall(
                    range.isLowerExclusive()
                        ? SqlStdOperatorTable.GREATER_THAN
                        : SqlStdOperatorTable.GREATER_THAN_OR_EQUAL,
                    ref,
                    boundLiteral(column, range.getLower(), literalType)));
          }
          if (!range.isUpperUnbounded()) {
            conjuncts.add(
                rexBuilder.makeCall(
                    range.isUpperExclusive()
                        ? SqlStdOperatorTable.LESS_THAN
                        : SqlStdOperatorTable.LESS_THAN_OR_EQUAL,
                    ref,
                    boundLiteral(column, range.getUpper(), literalType)));
          }
        });
    if (conjuncts.isEmpty()) {
      return rexBuilder.makeLiteral(true);
    }
    return conjuncts.size() == 1
        ? conjuncts.get(0)
        : rexBuilder.makeCall(SqlStdOperatorTable.AND, conjuncts);
  }

  private static PhysicalOperatorNode singleSource(PhysicalOperatorNode node) {
    List<PhysicalOperatorNode> sources = node.getSources();
    if (sources.size() != 1 || sources.get(0) == null) {
      throw new PlanStructureException(
          String.format(
              "%s %s needs exactly one source, got %d",
              node.getOperatorType(), node.getId(), sources.size()));
    }
    return sources.get(0);
  }
}
