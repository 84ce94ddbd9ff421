/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import com.google.common.collect.ImmutableMap;
import io.substrait.proto.Expression;
import io.substrait.proto.FunctionArgument;
import io.substrait.proto.Plan;
import io.substrait.proto.SimpleExtensionDeclaration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.function.FunctionMappings;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Converts Substrait expressions to Calcite row expressions. Function anchors are resolved through
 * the names declared in the extension section of the plan being converted.
 */
@Getter
public class SubstraitToRexConverter {

  private final RexBuilder rexBuilder;
  private final TypeConverter typeConverter;
  private final LiteralConverter literalConverter;

  /** Function name by anchor, without the argument part of the compound signature. */
  private final Map<Integer, String> functionNames;

  public SubstraitToRexConverter(
      RexBuilder rexBuilder, TypeConverter typeConverter, Map<Integer, String> functionNames) {
    this.rexBuilder = rexBuilder;
    this.typeConverter = typeConverter;
    this.literalConverter = new LiteralConverter(typeConverter);
    this.functionNames = ImmutableMap.copyOf(functionNames);
  }

  /** Collects the function names declared by a plan, keyed by anchor. */
  public static Map<Integer, String> functionNames(Plan plan) {
    ImmutableMap.Builder<Integer, String> names = ImmutableMap.builder();
    for (SimpleExtensionDeclaration declaration : plan.getExtensionsList()) {
      if (declaration.hasExtensionFunction()) {
        SimpleExtensionDeclaration.ExtensionFunction function = declaration.getExtensionFunction();
        String name = function.getName();
        int colon = name.indexOf(':');
        names.put(function.getFunctionAnchor(), colon < 0 ? name : name.substring(0, colon));
      }
    }
    return names.buildKeepingLast();
  }

  public RexNode toRexNode(Expression expression, RelDataType inputType) {
    switch (expression.getRexTypeCase()) {
      case SELECTION:
        int index = fieldIndex(expression, inputType);
        return rexBuilder.makeInputRef(inputType.getFieldList().get(index).getType(), index);
      case LITERAL:
        return literalConverter.toRexLiteral(expression.getLiteral(), rexBuilder);
      case SCALAR_FUNCTION:
        Expression.ScalarFunction function = expression.getScalarFunction();
        List<RexNode> operands = new ArrayList<>();
        for (FunctionArgument argument : function.getArgumentsList()) {
          operands.add(toRexNode(argument, inputType));
        }
        return rexBuilder.makeCall(
            typeConverter.toRelDataType(function.getOutputType()),
            FunctionMappings.toScalarOperator(functionName(function.getFunctionReference())),
            operands);
      case IF_THEN:
        return toCase(expression.getIfThen(), inputType);
      case CAST:
        return rexBuilder.makeCast(
            typeConverter.toRelDataType(expression.getCast().getType()),
            toRexNode(expression.getCast().getInput(), inputType));
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported expression kind %s", expression.getRexTypeCase()));
    }
  }

  public RexNode toRexNode(FunctionArgument argument, RelDataType inputType) {
    if (argument.getArgTypeCase() != FunctionArgument.ArgTypeCase.VALUE) {
      throw new UnsupportedConstructException(
          String.format("Unsupported function argument kind %s", argument.getArgTypeCase()));
    }
    return toRexNode(argument.getValue(), inputType);
  }

  /**
   * Index of the input column a plain field reference points at.
   *
   * @throws UnsupportedConstructException if the expression is not a direct struct field
   *     reference
   */
  public static int fieldIndex(Expression expression, RelDataType inputType) {
    if (!expression.hasSelection()
        || !expression.getSelection().hasDirectReference()
        || !expression.getSelection().getDirectReference().hasStructField()) {
      throw new UnsupportedConstructException(
          String.format("Expected a field reference but got %s", expression.getRexTypeCase()));
    }
    int index = expression.getSelection().getDirectReference().getStructField().getField();
    if (index < 0 || index >= inputType.getFieldCount()) {
      throw new PlanStructureException(
          String.format(
              "Field reference $%d is out of range for input with %d columns",
              index, inputType.getFieldCount()));
    }
    return index;
  }

  public String functionName(int anchor) {
    String name = functionNames.get(anchor);
    if (name == null) {
      throw new PlanStructureException(
          String.format("Function anchor %d is not declared in the plan extensions", anchor));
    }
    return name;
  }

  private RexNode toCase(Expression.IfThen ifThen, RelDataType inputType) {
    List<RexNode> operands = new ArrayList<>();
    List<RelDataType> resultTypes = new ArrayList<>();
    for (Expression.IfThen.IfClause clause : ifThen.getIfsList()) {
      operands.add(toRexNode(clause.getIf(), inputType));
      RexNode then = toRexNode(clause.getThen(), inputType);
      operands.add(then);
      resultTypes.add(then.getType());
    }
    if (!ifThen.hasElse()) {
      throw new PlanStructureException("If-then expression without else branch");
    }
    RexNode otherwise = toRexNode(ifThen.getElse(), inputType);
    operands.add(otherwise);
    resultTypes.add(otherwise.getType());
    RelDataType type = typeConverter.getTypeFactory().leastRestrictive(resultTypes);
    return rexBuilder.makeCall(
        type != null ? type : resultTypes.get(0), SqlStdOperatorTable.CASE, operands);
  }
}
