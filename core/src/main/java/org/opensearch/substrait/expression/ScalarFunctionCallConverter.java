/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import io.substrait.proto.Expression;
import io.substrait.proto.FunctionArgument;
import io.substrait.proto.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlAggFunction;
import org.opensearch.substrait.exception.FunctionNotFoundException;
import org.opensearch.substrait.function.FunctionMappings;
import org.opensearch.substrait.function.FunctionSignature;
import org.opensearch.substrait.function.FunctionVariant;

/**
 * Converts any scalar call by resolving its name and argument types against the function catalog.
 * Calls without a matching variant fail with {@link FunctionNotFoundException}.
 */
@Log4j2
public class ScalarFunctionCallConverter implements CallConverter {

  @Override
  public Optional<Expression> convert(
      RexCall call, RelDataType inputType, RexToSubstraitConverter topLevelConverter) {
    if (call.getOperator() instanceof SqlAggFunction) {
      return Optional.empty();
    }
    String name = FunctionMappings.toFunctionName(call.getOperator());
    List<FunctionArgument> arguments = new ArrayList<>();
    List<Type> argumentTypes = new ArrayList<>();
    for (RexNode operand : call.getOperands()) {
      arguments.add(
          FunctionArgument.newBuilder()
              .setValue(topLevelConverter.toExpression(operand, inputType))
              .build());
      argumentTypes.add(topLevelConverter.getTypeConverter().toSubstrait(operand.getType()));
    }
    FunctionSignature signature = FunctionSignature.of(name, argumentTypes, false);
    FunctionVariant variant =
        topLevelConverter
            .getFunctionCatalog()
            .lookup(signature)
            .orElseThrow(() -> new FunctionNotFoundException(signature.toString()));
    int reference = topLevelConverter.getFunctionCollector().getReference(variant);
    log.debug("Call {} resolved to {} with anchor {}", call, variant, reference);
    return Optional.of(
        Expression.newBuilder()
            .setScalarFunction(
                Expression.ScalarFunction.newBuilder()
                    .setFunctionReference(reference)
                    .addAllArguments(arguments)
                    .setOutputType(
                        topLevelConverter.getTypeConverter().toSubstrait(call.getType())))
            .build());
  }
}
