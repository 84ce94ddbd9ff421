/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import io.substrait.proto.Expression;
import java.util.Optional;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.sql.SqlKind;

/** Converts {@code CAST(x AS type)}. */
public class CastCallConverter implements CallConverter {

  @Override
  public Optional<Expression> convert(
      RexCall call, RelDataType inputType, RexToSubstraitConverter topLevelConverter) {
    if (call.getKind() != SqlKind.CAST) {
      return Optional.empty();
    }
    return Optional.of(
        Expression.newBuilder()
            .setCast(
                Expression.Cast.newBuilder()
                    .setType(topLevelConverter.getTypeConverter().toSubstrait(call.getType()))
                    .setInput(topLevelConverter.toExpression(call.getOperands().get(0), inputType)))
            .build());
  }
}
