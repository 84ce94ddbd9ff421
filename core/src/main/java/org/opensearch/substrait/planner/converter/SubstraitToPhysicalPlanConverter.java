/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import com.google.common.base.Joiner;
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
import io.substrait.proto.SimpleExtensionDeclaration;
import io.substrait.proto.SortField;
import io.substrait.proto.SortRel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
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
import org.apache.calcite.sql.SqlAggFunction;
import org.opensearch.substrait.common.setting.Settings;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.DoubleRange;
import org.opensearch.substrait.connector.FileFormat;
import org.opensearch.substrait.connector.TableHandle;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.expression.SubstraitToRexConverter;
import org.opensearch.substrait.function.FunctionMappings;
import org.opensearch.substrait.planner.physical.AggregationPhysicalOperator;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;
import org.opensearch.substrait.planner.physical.PhysicalPlanBuilder;
import org.opensearch.substrait.planner.physical.ScanPhysicalOperator;
import org.opensearch.substrait.planner.physical.SortOrder;
import org.opensearch.substrait.planner.physical.page.Page;
import org.opensearch.substrait.planner.physical.page.PageBuilder;
import org.opensearch.substrait.planner.pushdown.FilterPushdownExtractor;
import org.opensearch.substrait.split.SplitInfo;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Converts a Substrait plan into a physical operator tree. Function anchors are resolved through
 * the extension declarations of the plan being converted.
 *
 * <p>Output columns the plan does not name are called {@code n<node id>_<position>}.
 */
@Log4j2
public class SubstraitToPhysicalPlanConverter {

  /** Connector of scans reading local files. */
  public static final String LOCAL_FILES_CONNECTOR = "local";

  /** Connector of named tables given without a qualifier. */
  public static final String DEFAULT_CONNECTOR = "default";

  private static final String UNKNOWN_EXTENSION_TYPE = "unknown";

  @Getter private final TypeConverter typeConverter;
  @Getter private final boolean pushdownEnabled;
  private final RexBuilder rexBuilder;

  public SubstraitToPhysicalPlanConverter(TypeConverter typeConverter, boolean pushdownEnabled) {
    this.typeConverter = typeConverter;
    this.pushdownEnabled = pushdownEnabled;
    this.rexBuilder = new RexBuilder(typeConverter.getTypeFactory());
  }

  public SubstraitToPhysicalPlanConverter(TypeConverter typeConverter, Settings settings) {
    this(typeConverter, settings.<Boolean>getSettingValue(Settings.Key.PUSHDOWN_ENABLED));
  }

  /**
   * Converts the single relation of {@code plan}.
   *
   * @throws PlanStructureException if the plan does not hold exactly one relation
   * @throws UnsupportedConstructException if the plan declares extension types
   */
  public SubstraitPlanConversion toPhysicalPlan(Plan plan) {
    if (plan.getRelationsCount() != 1) {
      throw new PlanStructureException(
          String.format("Expected exactly one plan relation, got %d", plan.getRelationsCount()));
    }
    for (SimpleExtensionDeclaration declaration : plan.getExtensionsList()) {
      if (declaration.hasExtensionType()
          && !UNKNOWN_EXTENSION_TYPE.equals(declaration.getExtensionType().getName())) {
        throw new UnsupportedConstructException(
            String.format(
                "Unsupported extension type %s", declaration.getExtensionType().getName()));
      }
    }
    PlanRel relation = plan.getRelations(0);
    Rel rel;
    if (relation.hasRoot()) {
      rel = relation.getRoot().getInput();
    } else if (relation.hasRel()) {
      rel = relation.getRel();
    } else {
      throw new PlanStructureException("Plan relation holds neither a root nor a relation");
    }

    Conversion conversion = new Conversion(SubstraitToRexConverter.functionNames(plan));
    PhysicalOperatorNode root = conversion.toNode(rel);
    log.info(
        "Converted Substrait plan to physical plan rooted at {} with {} split infos",
        root.getId(),
        conversion.splitInfos.size());
    return new SubstraitPlanConversion(root, conversion.splitInfos);
  }

  /** State of a single plan conversion. */
  private class Conversion {

    private final PhysicalPlanBuilder builder = new PhysicalPlanBuilder(rexBuilder);
    private final SubstraitToRexConverter expressions;
    private final Map<String, SplitInfo> splitInfos = new LinkedHashMap<>();

    Conversion(Map<Integer, String> functionNames) {
      this.expressions = new SubstraitToRexConverter(rexBuilder, typeConverter, functionNames);
    }

    PhysicalOperatorNode toNode(Rel rel) {
      switch (rel.getRelTypeCase()) {
        case FILTER:
          return toFilter(rel.getFilter());
        case PROJECT:
          return toProjection(rel.getProject());
        case AGGREGATE:
          return toAggregation(rel.getAggregate());
        case JOIN:
          return toJoin(rel.getJoin());
        case READ:
          return toRead(rel.getRead());
        case SORT:
          return toSort(rel.getSort());
        case FETCH:
          return toLimit(rel.getFetch());
        default:
          throw new UnsupportedConstructException(
              String.format("Unsupported relation %s", rel.getRelTypeCase()));
      }
    }

    private PhysicalOperatorNode toFilter(FilterRel filter) {
      PhysicalOperatorNode source = input(filter.hasInput(), filter.getInput(), "Filter");
      if (!filter.hasCondition()) {
        throw new PlanStructureException("Filter relation without condition");
      }
      return builder.filter(
          source, expressions.toRexNode(filter.getCondition(), source.getOutputType()));
    }

    private PhysicalOperatorNode toProjection(ProjectRel project) {
      PhysicalOperatorNode source = input(project.hasInput(), project.getInput(), "Project");
      RelDataType inputType = source.getOutputType();
      int width = inputType.getFieldCount();
      List<RexNode> computed = new ArrayList<>();
      for (Expression expression : project.getExpressionsList()) {
        computed.add(expressions.toRexNode(expression, inputType));
      }

      List<Integer> mapping = new ArrayList<>();
      if (project.hasCommon() && project.getCommon().hasEmit()) {
        mapping.addAll(project.getCommon().getEmit().getOutputMappingList());
      } else {
        for (int i = 0; i < width + computed.size(); i++) {
          mapping.add(i);
        }
      }

      String id = builder.nextId();
      List<String> names = new ArrayList<>();
      List<RexNode> projections = new ArrayList<>();
      for (int i = 0; i < mapping.size(); i++) {
        int index = mapping.get(i);
        if (index < 0 || index >= width + computed.size()) {
          throw new PlanStructureException(
              String.format(
                  "Project output mapping %d is out of range for %d columns",
                  index, width + computed.size()));
        }
        if (index < width) {
          RelDataTypeField field = inputType.getFieldList().get(index);
          names.add(field.getName());
          projections.add(rexBuilder.makeInputRef(field.getType(), index));
        } else {
          names.add(outputName(id, i));
          projections.add(computed.get(index - width));
        }
      }
      return builder.project(id, source, names, projections);
    }

    private PhysicalOperatorNode toAggregation(AggregateRel aggregate) {
      PhysicalOperatorNode source = input(aggregate.hasInput(), aggregate.getInput(), "Aggregate");
      RelDataType inputType = source.getOutputType();
      if (aggregate.getGroupingsCount() > 1) {
        throw new UnsupportedConstructException(
            String.format(
                "Unsupported aggregation with %d grouping sets", aggregate.getGroupingsCount()));
      }
      List<RexInputRef> groupingKeys = new ArrayList<>();
      for (AggregateRel.Grouping grouping : aggregate.getGroupingsList()) {
        for (Expression key : grouping.getGroupingExpressionsList()) {
          groupingKeys.add(inputRef(key, inputType));
        }
      }

      AggregationPhysicalOperator.Step step = AggregationPhysicalOperator.Step.SINGLE;
      if (aggregate.getMeasuresCount() > 0) {
        AggregationPhase phase = aggregate.getMeasures(0).getMeasure().getPhase();
        for (AggregateRel.Measure measure : aggregate.getMeasuresList()) {
          if (measure.getMeasure().getPhase() != phase) {
            throw new PlanStructureException(
                String.format(
                    "Aggregate measures disagree on phase: %s and %s",
                    phase, measure.getMeasure().getPhase()));
          }
        }
        step = AggregationPhases.toStep(phase);
      }

      String id = builder.nextId();
      List<String> names = new ArrayList<>();
      List<RexCall> aggregates = new ArrayList<>();
      List<RexInputRef> masks = new ArrayList<>();
      for (AggregateRel.Measure measure : aggregate.getMeasuresList()) {
        names.add(outputName(id, groupingKeys.size() + names.size()));
        aggregates.add(toAggregateCall(measure.getMeasure(), inputType));
        masks.add(measure.hasFilter() ? inputRef(measure.getFilter(), inputType) : null);
      }
      return builder.aggregate(id, source, step, groupingKeys, names, aggregates, masks);
    }

    private RexCall toAggregateCall(AggregateFunction function, RelDataType inputType) {
      String name = expressions.functionName(function.getFunctionReference());
      SqlAggFunction operator =
          FunctionMappings.toAggregateFunction(name)
              .orElseThrow(
                  () ->
                      new UnsupportedConstructException(
                          String.format("Unsupported aggregate function %s", name)));
      List<RexNode> operands = new ArrayList<>();
      for (FunctionArgument argument : function.getArgumentsList()) {
        RexNode operand = expressions.toRexNode(argument, inputType);
        if (!(operand instanceof RexInputRef) && !(operand instanceof RexLiteral)) {
          throw new UnsupportedConstructException(
              String.format("Unsupported argument %s of aggregate function %s", operand, name));
        }
        operands.add(operand);
      }
      return (RexCall)
          rexBuilder.makeCall(
              typeConverter.toRelDataType(function.getOutputType()), operator, operands);
    }

    private PhysicalOperatorNode toJoin(JoinRel join) {
      if (!join.hasLeft() || !join.hasRight()) {
        throw new PlanStructureException("Join relation needs a left and a right input");
      }
      JoinRelType joinType = toJoinType(join.getType());
      PhysicalOperatorNode left = toNode(join.getLeft());
      PhysicalOperatorNode right = toNode(join.getRight());
      RelDataType joinedType =
          typeConverter
              .getTypeFactory()
              .createJoinType(left.getOutputType(), right.getOutputType());

      List<RexInputRef> leftKeys = new ArrayList<>();
      List<RexInputRef> rightKeys = new ArrayList<>();
      if (join.hasExpression()) {
        collectJoinKeys(
            join.getExpression(),
            left.getOutputType(),
            right.getOutputType(),
            joinedType,
            leftKeys,
            rightKeys);
      }
      RexNode filter =
          join.hasPostJoinFilter()
              ? expressions.toRexNode(join.getPostJoinFilter(), joinedType)
              : null;
      return builder.join(joinType, left, right, leftKeys, rightKeys, filter);
    }

    private void collectJoinKeys(
        Expression condition,
        RelDataType leftType,
        RelDataType rightType,
        RelDataType joinedType,
        List<RexInputRef> leftKeys,
        List<RexInputRef> rightKeys) {
      if (condition.hasLiteral()
          && condition.getLiteral().hasBoolean()
          && condition.getLiteral().getBoolean()) {
        return;
      }
      if (!condition.hasScalarFunction()) {
        throw new UnsupportedConstructException(
            String.format("Unsupported join condition %s", condition.getRexTypeCase()));
      }
      Expression.ScalarFunction function = condition.getScalarFunction();
      String name = expressions.functionName(function.getFunctionReference());
      if ("and".equals(name)) {
        for (FunctionArgument argument : function.getArgumentsList()) {
          collectJoinKeys(
              argument.getValue(), leftType, rightType, joinedType, leftKeys, rightKeys);
        }
        return;
      }
      if (!"equal".equals(name) || function.getArgumentsCount() != 2) {
        throw new UnsupportedConstructException(
            String.format("Unsupported join condition %s", name));
      }
      int first =
          SubstraitToRexConverter.fieldIndex(function.getArguments(0).getValue(), joinedType);
      int second =
          SubstraitToRexConverter.fieldIndex(function.getArguments(1).getValue(), joinedType);
      int leftWidth = leftType.getFieldCount();
      if (first >= leftWidth && second < leftWidth) {
        int swap = first;
        first = second;
        second = swap;
      }
      if (first >= leftWidth || second < leftWidth) {
        throw new UnsupportedConstructException(
            String.format(
                "Unsupported join condition: $%d = $%d does not compare the two inputs",
                first, second));
      }
      leftKeys.add(
          rexBuilder.makeInputRef(leftType.getFieldList().get(first).getType(), first));
      rightKeys.add(
          rexBuilder.makeInputRef(
              rightType.getFieldList().get(second - leftWidth).getType(), second - leftWidth));
    }

    private PhysicalOperatorNode toRead(ReadRel read) {
      switch (read.getReadTypeCase()) {
        case VIRTUAL_TABLE:
          return withFilter(toValues(read), read);
        case LOCAL_FILES:
        case NAMED_TABLE:
          return toScan(read);
        default:
          throw new UnsupportedConstructException(
              String.format("Unsupported read type %s", read.getReadTypeCase()));
      }
    }

    private PhysicalOperatorNode toValues(ReadRel read) {
      List<Expression.Literal.Struct> structs = read.getVirtualTable().getValuesList();
      String id = builder.nextId();
      RelDataType outputType;
      if (read.hasBaseSchema()) {
        outputType = typeConverter.toRowType(read.getBaseSchema());
      } else if (!structs.isEmpty()) {
        RelDataTypeFactory.Builder type = typeConverter.getTypeFactory().builder();
        List<Expression.Literal> fields = structs.get(0).getFieldsList();
        for (int i = 0; i < fields.size(); i++) {
          type.add(
              outputName(id, i),
              expressions.getLiteralConverter().toRelDataType(fields.get(i)));
        }
        outputType = type.build();
      } else {
        throw new PlanStructureException("Virtual table without base schema or values");
      }

      int columns = outputType.getFieldCount();
      List<Page> pages = new ArrayList<>();
      for (Expression.Literal.Struct struct : structs) {
        int fields = struct.getFieldsCount();
        if (columns == 0 ? fields != 0 : fields % columns != 0) {
          throw new PlanStructureException(
              String.format(
                  "Virtual table batch with %d values does not fit %d columns", fields, columns));
        }
        int batchSize = columns == 0 ? 0 : fields / columns;
        List<Object> values = new ArrayList<>(fields);
        for (Expression.Literal literal : struct.getFieldsList()) {
          values.add(expressions.getLiteralConverter().toJavaValue(literal));
        }
        pages.add(PageBuilder.fromColumnMajor(values, columns, batchSize));
      }
      return builder.values(id, outputType, pages);
    }

    private PhysicalOperatorNode toScan(ReadRel read) {
      if (!read.hasBaseSchema()) {
        throw new PlanStructureException("Read relation without base schema");
      }
      RelDataType schema = typeConverter.toRowType(read.getBaseSchema());
      String id = builder.nextId();

      String connectorId;
      String tableName;
      if (read.hasLocalFiles()) {
        connectorId = LOCAL_FILES_CONNECTOR;
        tableName = LOCAL_FILES_CONNECTOR;
        splitInfos.put(id, toSplitInfo(read.getLocalFiles()));
      } else {
        List<String> names = read.getNamedTable().getNamesList();
        if (names.isEmpty()) {
          throw new PlanStructureException("Named table without a name");
        }
        tableName = names.get(names.size() - 1);
        connectorId =
            names.size() == 1
                ? DEFAULT_CONNECTOR
                : Joiner.on('.').join(names.subList(0, names.size() - 1));
      }

      RelDataTypeFactory.Builder outputType = typeConverter.getTypeFactory().builder();
      Map<String, ColumnHandle> assignments = new LinkedHashMap<>();
      for (RelDataTypeField field : schema.getFieldList()) {
        String name = outputName(id, field.getIndex());
        outputType.add(name, field.getType());
        assignments.put(name, new ColumnHandle(field.getName(), field.getType()));
      }

      boolean pushdown = pushdownEnabled && read.hasFilter();
      Map<String, DoubleRange> ranges =
          pushdown
              ? FilterPushdownExtractor.extract(
                  read.getFilter(), schema, expressions.getFunctionNames())
              : Collections.emptyMap();
      ScanPhysicalOperator scan =
          builder.scan(
              id,
              outputType.build(),
              new TableHandle(connectorId, tableName, pushdown, ranges),
              assignments);
      log.debug("Converted read to {}", scan.describe());
      return pushdown ? scan : withFilter(scan, read);
    }

    private PhysicalOperatorNode withFilter(PhysicalOperatorNode node, ReadRel read) {
      if (!read.hasFilter()) {
        return node;
      }
      return builder.filter(node, expressions.toRexNode(read.getFilter(), node.getOutputType()));
    }

    private PhysicalOperatorNode toSort(SortRel sort) {
      PhysicalOperatorNode source = input(sort.hasInput(), sort.getInput(), "Sort");
      List<RexInputRef> keys = new ArrayList<>();
      List<SortOrder> orders = new ArrayList<>();
      for (SortField field : sort.getSortsList()) {
        if (field.getSortKindCase() != SortField.SortKindCase.DIRECTION) {
          throw new UnsupportedConstructException(
              String.format("Unsupported sort kind %s", field.getSortKindCase()));
        }
        keys.add(inputRef(field.getExpr(), source.getOutputType()));
        orders.add(SortDirections.toSortOrder(field.getDirection()));
      }
      return builder.sort(source, keys, orders, false);
    }

    private PhysicalOperatorNode toLimit(FetchRel fetch) {
      PhysicalOperatorNode source = input(fetch.hasInput(), fetch.getInput(), "Fetch");
      return builder.limit(source, fetch.getOffset(), fetch.getCount(), false);
    }

    private PhysicalOperatorNode input(boolean present, Rel input, String relation) {
      if (!present) {
        throw new PlanStructureException(
            String.format("%s relation without input", relation));
      }
      return toNode(input);
    }

    private RexInputRef inputRef(Expression expression, RelDataType inputType) {
      int index = SubstraitToRexConverter.fieldIndex(expression, inputType);
      return rexBuilder.makeInputRef(inputType.getFieldList().get(index).getType(), index);
    }
  }

  private static SplitInfo toSplitInfo(ReadRel.LocalFiles localFiles) {
    long partitionIndex = 0;
    List<String> paths = new ArrayList<>();
    List<Long> starts = new ArrayList<>();
    List<Long> lengths = new ArrayList<>();
    FileFormat format = FileFormat.UNKNOWN;
    for (ReadRel.LocalFiles.FileOrFiles file : localFiles.getItemsList()) {
      switch (file.getPathTypeCase()) {
        case URI_FILE:
          paths.add(file.getUriFile());
          break;
        case URI_PATH:
          paths.add(file.getUriPath());
          break;
        case URI_PATH_GLOB:
          paths.add(file.getUriPathGlob());
          break;
        case URI_FOLDER:
          paths.add(file.getUriFolder());
          break;
        default:
          throw new PlanStructureException("Local file item without a path");
      }
      starts.add(file.getStart());
      lengths.add(file.getLength());
      partitionIndex = file.getPartitionIndex();
      format = toFileFormat(file);
    }
    return new SplitInfo(partitionIndex, paths, starts, lengths, format);
  }

  private static FileFormat toFileFormat(ReadRel.LocalFiles.FileOrFiles file) {
    switch (file.getFileFormatCase()) {
      case ORC:
      case DWRF:
        return FileFormat.DWRF;
      case PARQUET:
        return FileFormat.PARQUET;
      default:
        return FileFormat.UNKNOWN;
    }
  }

  private static JoinRelType toJoinType(JoinRel.JoinType type) {
    switch (type) {
      case JOIN_TYPE_INNER:
        return JoinRelType.INNER;
      case JOIN_TYPE_OUTER:
        return JoinRelType.FULL;
      case JOIN_TYPE_LEFT:
        return JoinRelType.LEFT;
      case JOIN_TYPE_RIGHT:
        return JoinRelType.RIGHT;
      case JOIN_TYPE_SEMI:
        return JoinRelType.SEMI;
      case JOIN_TYPE_ANTI:
        return JoinRelType.ANTI;
      default:
        throw new UnsupportedConstructException(String.format("Unsupported join type %s", type));
    }
  }

  private static String outputName(String id, int index) {
    return "n" + id + "_" + index;
  }
}
