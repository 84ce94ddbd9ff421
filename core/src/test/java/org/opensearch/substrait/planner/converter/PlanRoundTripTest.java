/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.substrait.proto.Plan;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.substrait.connector.ColumnHandle;
import org.opensearch.substrait.connector.DoubleRange;
import org.opensearch.substrait.connector.TableHandle;
import org.opensearch.substrait.function.FunctionCatalog;
import org.opensearch.substrait.function.FunctionCatalogLoader;
import org.opensearch.substrait.planner.physical.AggregationPhysicalOperator;
import org.opensearch.substrait.planner.physical.FilterPhysicalOperator;
import org.opensearch.substrait.planner.physical.JoinPhysicalOperator;
import org.opensearch.substrait.planner.physical.LimitPhysicalOperator;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;
import org.opensearch.substrait.planner.physical.PhysicalPlanBuilder;
import org.opensearch.substrait.planner.physical.ProjectionPhysicalOperator;
import org.opensearch.substrait.planner.physical.ScanPhysicalOperator;
import org.opensearch.substrait.planner.physical.SortOrder;
import org.opensearch.substrait.planner.physical.SortPhysicalOperator;
import org.opensearch.substrait.planner.physical.ValuesPhysicalOperator;
import org.opensearch.substrait.planner.physical.page.PageBuilder;
import org.opensearch.substrait.type.SubstraitTypeSystem;
import org.opensearch.substrait.type.TypeConverter;

/** Converts physical plans to Substrait and back. */
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanRoundTripTest {

  private static FunctionCatalog catalog;

  private RexBuilder rexBuilder;
  private PhysicalPlanBuilder builder;
  private PhysicalToSubstraitPlanConverter toSubstrait;
  private SubstraitToPhysicalPlanConverter toPhysical;

  @BeforeAll
  static void loadCatalog() {
    catalog =
        FunctionCatalogLoader.fromResources(
            List.of(
                "functions_comparison.yaml",
                "functions_boolean.yaml",
                "functions_arithmetic.yaml",
                "functions_aggregate_generic.yaml"));
  }

  @BeforeEach
  void setUp() {
    RelDataTypeFactory typeFactory = new SqlTypeFactoryImpl(SubstraitTypeSystem.INSTANCE);
    TypeConverter typeConverter = new TypeConverter(typeFactory);
    rexBuilder = new RexBuilder(typeFactory);
    builder = new PhysicalPlanBuilder(rexBuilder);
    toSubstrait = new PhysicalToSubstraitPlanConverter(typeConverter, catalog);
    toPhysical = new SubstraitToPhysicalPlanConverter(typeConverter, true);
  }

  @Test
  void values_pipeline_keeps_shape_and_data() {
    RelDataType rowType =
        rexBuilder
            .getTypeFactory()
            .builder()
            .add("k", SqlTypeName.INTEGER)
            .add("v", SqlTypeName.DOUBLE)
            .build();
    ValuesPhysicalOperator values =
        builder.values(
            rowType, List.of(new PageBuilder(2).addRow(1, 0.5).addRow(2, 3.0).build()));
    RexInputRef k = rexBuilder.makeInputRef(rowType.getFieldList().get(0).getType(), 0);
    RexInputRef v = rexBuilder.makeInputRef(rowType.getFieldList().get(1).getType(), 1);
    PhysicalOperatorNode plan =
        builder.limit(
            builder.sort(
                builder.project(
                    builder.filter(
                        values,
                        rexBuilder.makeCall(
                            SqlStdOperatorTable.GREATER_THAN_OR_EQUAL,
                            v,
                            rexBuilder.makeApproxLiteral(BigDecimal.ONE))),
                    List.of("k", "twice"),
                    List.of(k, rexBuilder.makeCall(SqlStdOperatorTable.MULTIPLY, v, v))),
                List.of(k),
                List.of(SortOrder.ASC_NULLS_FIRST),
                false),
            1,
            10,
            false);

    Plan substrait = toSubstrait.toSubstrait(plan);
    PhysicalOperatorNode converted = toPhysical.toPhysicalPlan(substrait).getRoot();

    LimitPhysicalOperator limit = (LimitPhysicalOperator) converted;
    assertEquals(1, limit.getOffset());
    assertEquals(10, limit.getCount());
    SortPhysicalOperator sort = (SortPhysicalOperator) limit.getSource();
    assertEquals(List.of(SortOrder.ASC_NULLS_FIRST), sort.getSortOrders());
    ProjectionPhysicalOperator project = (ProjectionPhysicalOperator) sort.getSource();
    assertEquals(SqlKind.INPUT_REF, project.getProjections().get(0).getKind());
    assertEquals(SqlKind.TIMES, project.getProjections().get(1).getKind());
    FilterPhysicalOperator filter = (FilterPhysicalOperator) project.getSource();
    assertEquals(SqlKind.GREATER_THAN_OR_EQUAL, filter.getCondition().getKind());
    ValuesPhysicalOperator roundTripped = (ValuesPhysicalOperator) filter.getSource();
    assertEquals(values.getValues(), roundTripped.getValues());
    assertEquals(rowType.getFieldNames(), roundTripped.getOutputType().getFieldNames());
  }

  @Test
  void partial_aggregation_keeps_step_keys_and_types() {
    ValuesPhysicalOperator values = keyedValues();
    RexInputRef v = column(values, 1);
    RexCall sum =
        (RexCall) rexBuilder.makeCall(v.getType(), SqlStdOperatorTable.SUM, List.of(v));
    AggregationPhysicalOperator aggregate =
        builder.aggregate(
            values,
            AggregationPhysicalOperator.Step.PARTIAL,
            List.of(column(values, 0)),
            List.of("total"),
            List.of(sum),
            Collections.emptyList());

    PhysicalOperatorNode converted =
        toPhysical.toPhysicalPlan(toSubstrait.toSubstrait(aggregate)).getRoot();

    AggregationPhysicalOperator roundTripped = (AggregationPhysicalOperator) converted;
    assertEquals(AggregationPhysicalOperator.Step.PARTIAL, roundTripped.getStep());
    assertEquals(1, roundTripped.getGroupingKeys().size());
    assertEquals(0, roundTripped.getGroupingKeys().get(0).getIndex());
    assertEquals(SqlKind.SUM, roundTripped.getAggregates().get(0).getKind());
    assertEquals(typeNames(aggregate), typeNames(roundTripped));
  }

  @Test
  void inner_join_keeps_keys_and_output_schema() {
    ValuesPhysicalOperator orders = keyedValues();
    RelDataType customerType =
        rexBuilder
            .getTypeFactory()
            .builder()
            .add("id", SqlTypeName.INTEGER)
            .add("name", SqlTypeName.VARCHAR)
            .build();
    ValuesPhysicalOperator customers =
        builder.values(customerType, List.of(new PageBuilder(2).addRow(1, "a").build()));
    JoinPhysicalOperator join =
        builder.join(
            JoinRelType.INNER,
            orders,
            customers,
            List.of(column(orders, 0)),
            List.of(column(customers, 0)),
            null);

    PhysicalOperatorNode converted =
        toPhysical.toPhysicalPlan(toSubstrait.toSubstrait(join)).getRoot();

    JoinPhysicalOperator roundTripped = (JoinPhysicalOperator) converted;
    assertEquals(JoinRelType.INNER, roundTripped.getJoinType());
    assertEquals(0, roundTripped.getLeftKeys().get(0).getIndex());
    assertEquals(0, roundTripped.getRightKeys().get(0).getIndex());
    assertEquals(
        join.getOutputType().getFieldNames(), roundTripped.getOutputType().getFieldNames());
    assertEquals(typeNames(join), typeNames(roundTripped));
  }

  @Test
  void pushed_down_ranges_survive() {
    RelDataType doubleType =
        rexBuilder
            .getTypeFactory()
            .createTypeWithNullability(
                rexBuilder.getTypeFactory().createSqlType(SqlTypeName.DOUBLE), true);
    RelDataType outputType =
        rexBuilder.getTypeFactory().builder().add("price", doubleType).build();
    Map<String, DoubleRange> ranges =
        Map.of("price", new DoubleRange(0, false, true, 100, false, false, false));
    ScanPhysicalOperator scan =
        builder.scan(
            "0",
            outputType,
            new TableHandle("catalog", "items", true, ranges),
            Map.of("price", new ColumnHandle("price", doubleType)));

    PhysicalOperatorNode converted =
        toPhysical.toPhysicalPlan(toSubstrait.toSubstrait(scan)).getRoot();

    assertThat(converted, instanceOf(ScanPhysicalOperator.class));
    TableHandle handle = ((ScanPhysicalOperator) converted).getTableHandle();
    assertEquals("catalog", handle.getConnectorId());
    assertEquals("items", handle.getTableName());
    assertEquals(ranges, handle.getSubfieldFilters());
  }

  private ValuesPhysicalOperator keyedValues() {
    RelDataType rowType =
        rexBuilder
            .getTypeFactory()
            .builder()
            .add("k", SqlTypeName.INTEGER)
            .add("v", SqlTypeName.DOUBLE)
            .build();
    return builder.values(rowType, List.of(new PageBuilder(2).addRow(1, 0.5).build()));
  }

  private RexInputRef column(PhysicalOperatorNode node, int index) {
    return rexBuilder.makeInputRef(
        node.getOutputType().getFieldList().get(index).getType(), index);
  }

  private static List<SqlTypeName> typeNames(PhysicalOperatorNode node) {
    return node.getOutputType().getFieldList().stream()
        .map(field -> field.getType().getSqlTypeName())
        .collect(Collectors.toList());
  }
}
