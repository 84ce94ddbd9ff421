/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import io.substrait.proto.Expression;
import java.util.Optional;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexCall;

/**
 * Converts one family of Calcite calls to Substrait. Converters are tried in order and the first
 * non-empty result wins.
 */
public interface CallConverter {

  /**
   * Converts the call, or returns empty when the call is not one this converter handles.
   *
   * @param call call to convert
   * @param inputType row type the call's field references point into
   * @param topLevelConverter converter for the call's operands
   */
  Optional<Expression> convert(
      RexCall call, RelDataType inputType, RexToSubstraitConverter topLevelConverter);
}
