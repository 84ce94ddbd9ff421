/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import io.substrait.proto.Expression;
import java.util.List;
import java.util.Optional;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlKind;
import org.opensearch.substrait.exception.UnsupportedConstructException;

/** Converts {@code CASE WHEN c1 THEN v1 ... ELSE d END} into a Substrait if-then expression. */
public class IfThenCallConverter implements CallConverter {

  @Override
  public Optional<Expression> convert(
      RexCall call, RelDataType inputType, RexToSubstraitConverter topLevelConverter) {
    if (call.getKind() != SqlKind.CASE) {
      return Optional.empty();
    }
    List<RexNode> operands = call.getOperands();
    if (operands.size() % 2 == 0) {
      throw new UnsupportedConstructException(
          String.format(
              "Conditional expression needs condition/result pairs and a default, got %d arguments",
              operands.size()));
    }
    Expression.IfThen.Builder ifThen = Expression.IfThen.newBuilder();
    for (int i = 0; i + 1 < operands.size(); i += 2) {
      ifThen.addIfs(
          Expression.IfThen.IfClause.newBuilder()
              .setIf(topLevelConverter.toExpression(operands.get(i), inputType))
              .setThen(topLevelConverter.toExpression(operands.get(i + 1), inputType)));
    }
    ifThen.setElse(topLevelConverter.toExpression(operands.get(operands.size() - 1), inputType));
    return Optional.of(Expression.newBuilder().setIfThen(ifThen).build());
  }
}
