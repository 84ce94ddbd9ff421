/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.substrait.proto.Expression;
import io.substrait.proto.FunctionArgument;
import io.substrait.proto.Plan;
import io.substrait.proto.SimpleExtensionDeclaration;
import io.substrait.proto.Type;
import java.util.Map;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.type.SubstraitTypeSystem;
import org.opensearch.substrait.type.TypeConverter;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SubstraitToRexConverterTest {

  private static final Type BOOL =
      Type.newBuilder()
          .setBool(Type.Boolean.newBuilder().setNullability(Type.Nullability.NULLABILITY_REQUIRED))
          .build();

  private RelDataType rowType;
  private SubstraitToRexConverter converter;

  @BeforeEach
  void setUp() {
    RelDataTypeFactory typeFactory = new SqlTypeFactoryImpl(SubstraitTypeSystem.INSTANCE);
    rowType =
        typeFactory.builder().add("a", SqlTypeName.INTEGER).add("b", SqlTypeName.DOUBLE).build();
    converter =
        new SubstraitToRexConverter(
            new RexBuilder(typeFactory),
            new TypeConverter(typeFactory),
            Map.of(0, "gt", 1, "my_udf"));
  }

  @Test
  void function_names_come_from_plan_extensions() {
    Plan plan =
        Plan.newBuilder()
            .addExtensions(
                SimpleExtensionDeclaration.newBuilder()
                    .setExtensionFunction(
                        SimpleExtensionDeclaration.ExtensionFunction.newBuilder()
                            .setFunctionAnchor(4)
                            .setName("gte:any_any")))
            .build();

    assertEquals(Map.of(4, "gte"), SubstraitToRexConverter.functionNames(plan));
  }

  @Test
  void field_reference_resolves_by_position() {
    RexNode node = converter.toRexNode(RexToSubstraitConverter.fieldReference(1), rowType);

    assertTrue(node instanceof RexInputRef);
    assertEquals(1, ((RexInputRef) node).getIndex());
    assertEquals(SqlTypeName.DOUBLE, node.getType().getSqlTypeName());
  }

  @Test
  void scalar_function_keeps_declared_type() {
    Expression call = call(0, RexToSubstraitConverter.fieldReference(0), literal(3));

    RexNode node = converter.toRexNode(call, rowType);

    assertEquals(SqlKind.GREATER_THAN, node.getKind());
    assertEquals(SqlTypeName.BOOLEAN, node.getType().getSqlTypeName());
    assertEquals(2, ((RexCall) node).getOperands().size());
  }

  @Test
  void unmapped_function_becomes_user_defined_call() {
    RexNode node = converter.toRexNode(call(1, RexToSubstraitConverter.fieldReference(0)), rowType);

    assertEquals("MY_UDF", ((RexCall) node).getOperator().getName());
    assertEquals(SqlTypeName.BOOLEAN, node.getType().getSqlTypeName());
  }

  @Test
  void undeclared_anchor_fails() {
    assertThrows(
        PlanStructureException.class,
        () -> converter.toRexNode(call(9, RexToSubstraitConverter.fieldReference(0)), rowType));
  }

  @Test
  void if_then_becomes_case() {
    Expression ifThen =
        Expression.newBuilder()
            .setIfThen(
                Expression.IfThen.newBuilder()
                    .addIfs(
                        Expression.IfThen.IfClause.newBuilder()
                            .setIf(call(0, RexToSubstraitConverter.fieldReference(0), literal(3)))
                            .setThen(literal(1)))
                    .setElse(literal(2)))
            .build();

    RexNode node = converter.toRexNode(ifThen, rowType);

    assertEquals(SqlKind.CASE, node.getKind());
    assertEquals(3, ((RexCall) node).getOperands().size());
  }

  @Test
  void enum_argument_is_unsupported() {
    Expression call =
        Expression.newBuilder()
            .setScalarFunction(
                Expression.ScalarFunction.newBuilder()
                    .setFunctionReference(0)
                    .setOutputType(BOOL)
                    .addArguments(FunctionArgument.newBuilder().setEnum("FLOOR")))
            .build();

    assertThrows(UnsupportedConstructException.class, () -> converter.toRexNode(call, rowType));
  }

  @Test
  void field_index_requires_field_reference() {
    assertThrows(
        UnsupportedConstructException.class,
        () -> SubstraitToRexConverter.fieldIndex(literal(1), rowType));
    assertThrows(
        PlanStructureException.class,
        () ->
            SubstraitToRexConverter.fieldIndex(
                RexToSubstraitConverter.fieldReference(5), rowType));
  }

  private static Expression call(int anchor, Expression... arguments) {
    Expression.ScalarFunction.Builder function =
        Expression.ScalarFunction.newBuilder().setFunctionReference(anchor).setOutputType(BOOL);
    for (Expression argument : arguments) {
      function.addArguments(FunctionArgument.newBuilder().setValue(argument));
    }
    return Expression.newBuilder().setScalarFunction(function).build();
  }

  private static Expression literal(int value) {
    return Expression.newBuilder()
        .setLiteral(Expression.Literal.newBuilder().setI32(value))
        .build();
  }
}
