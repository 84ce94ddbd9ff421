/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import com.google.common.collect.ImmutableList;
import io.substrait.proto.Expression;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.function.FunctionCatalog;
import org.opensearch.substrait.function.FunctionReferenceCollector;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Converts Calcite row expressions to Substrait expressions. One instance serves one plan
 * conversion: the function anchors it hands out are recorded in its collector.
 */
@Getter
public class RexToSubstraitConverter {

  private final TypeConverter typeConverter;
  private final LiteralConverter literalConverter;
  private final FunctionCatalog functionCatalog;
  private final FunctionReferenceCollector functionCollector;
  private final List<CallConverter> callConverters;

  public RexToSubstraitConverter(
      TypeConverter typeConverter,
      FunctionCatalog functionCatalog,
      FunctionReferenceCollector functionCollector) {
    this(
        typeConverter,
        functionCatalog,
        functionCollector,
        ImmutableList.of(
            new IfThenCallConverter(), new CastCallConverter(), new ScalarFunctionCallConverter()));
  }

  public RexToSubstraitConverter(
      TypeConverter typeConverter,
      FunctionCatalog functionCatalog,
      FunctionReferenceCollector functionCollector,
      List<CallConverter> callConverters) {
    this.typeConverter = typeConverter;
    this.literalConverter = new LiteralConverter(typeConverter);
    this.functionCatalog = functionCatalog;
    this.functionCollector = functionCollector;
    this.callConverters = ImmutableList.copyOf(callConverters);
  }

  /**
   * Converts an expression whose field references point into {@code inputType}.
   *
   * @throws UnsupportedConstructException for expressions without a Substrait counterpart
   */
  public Expression toExpression(RexNode node, RelDataType inputType) {
    if (node instanceof RexInputRef) {
      return toFieldReference(((RexInputRef) node).getIndex(), inputType);
    }
    if (node instanceof RexLiteral) {
      return Expression.newBuilder()
          .setLiteral(literalConverter.toLiteral((RexLiteral) node))
          .build();
    }
    if (node instanceof RexCall) {
      RexCall call = (RexCall) node;
      for (CallConverter converter : callConverters) {
        Optional<Expression> expression = converter.convert(call, inputType, this);
        if (expression.isPresent()) {
          return expression.get();
        }
      }
      throw new UnsupportedConstructException(
          String.format("Unsupported function %s", call.getOperator().getName()));
    }
    throw new UnsupportedConstructException(
        String.format("Unsupported expression %s of kind %s", node, node.getKind()));
  }

  /** Direct reference to the column at {@code index} of the input row. */
  public Expression toFieldReference(int index, RelDataType inputType) {
    if (index < 0 || index >= inputType.getFieldCount()) {
      throw new PlanStructureException(
          String.format(
              "Field reference $%d is out of range for input with %d columns",
              index, inputType.getFieldCount()));
    }
    return fieldReference(index);
  }

  public static Expression fieldReference(int index) {
    return Expression.newBuilder()
        .setSelection(
            Expression.FieldReference.newBuilder()
                .setDirectReference(
                    Expression.ReferenceSegment.newBuilder()
                        .setStructField(
                            Expression.ReferenceSegment.StructField.newBuilder().setField(index)))
                .setRootReference(Expression.FieldReference.RootReference.getDefaultInstance()))
        .build();
  }
}
