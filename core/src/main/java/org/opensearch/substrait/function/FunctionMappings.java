/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.google.common.collect.ImmutableBiMap;
import java.util.Locale;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.apache.calcite.sql.SqlAggFunction;
import org.apache.calcite.sql.SqlFunction;
import org.apache.calcite.sql.SqlFunctionCategory;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlOperator;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.OperandTypes;

/** Maps Calcite operators to the function names used by Substrait extension catalogs. */
@UtilityClass
public class FunctionMappings {

  private static final ImmutableBiMap<SqlOperator, String> SCALAR_FUNCTIONS =
      ImmutableBiMap.<SqlOperator, String>builder()
          .put(SqlStdOperatorTable.EQUALS, "equal")
          .put(SqlStdOperatorTable.NOT_EQUALS, "not_equal")
          .put(SqlStdOperatorTable.GREATER_THAN, "gt")
          .put(SqlStdOperatorTable.GREATER_THAN_OR_EQUAL, "gte")
          .put(SqlStdOperatorTable.LESS_THAN, "lt")
          .put(SqlStdOperatorTable.LESS_THAN_OR_EQUAL, "lte")
          .put(SqlStdOperatorTable.AND, "and")
          .put(SqlStdOperatorTable.OR, "or")
          .put(SqlStdOperatorTable.NOT, "not")
          .put(SqlStdOperatorTable.IS_NULL, "is_null")
          .put(SqlStdOperatorTable.IS_NOT_NULL, "is_not_null")
          .put(SqlStdOperatorTable.PLUS, "add")
          .put(SqlStdOperatorTable.MINUS, "subtract")
          .put(SqlStdOperatorTable.MULTIPLY, "multiply")
          .put(SqlStdOperatorTable.DIVIDE, "divide")
          .put(SqlStdOperatorTable.MOD, "modulus")
          .put(SqlStdOperatorTable.UNARY_MINUS, "negate")
          .put(SqlStdOperatorTable.ABS, "abs")
          .put(SqlStdOperatorTable.UPPER, "upper")
          .put(SqlStdOperatorTable.LOWER, "lower")
          .build();

  private static final ImmutableBiMap<SqlAggFunction, String> AGGREGATE_FUNCTIONS =
      ImmutableBiMap.<SqlAggFunction, String>builder()
          .put(SqlStdOperatorTable.SUM, "sum")
          .put(SqlStdOperatorTable.COUNT, "count")
          .put(SqlStdOperatorTable.MIN, "min")
          .put(SqlStdOperatorTable.MAX, "max")
          .put(SqlStdOperatorTable.AVG, "avg")
          .put(SqlStdOperatorTable.ANY_VALUE, "any_value")
          .build();

  /** Catalog name of an operator. Unmapped operators use their lower-cased name. */
  public static String toFunctionName(SqlOperator operator) {
    String name =
        operator instanceof SqlAggFunction
            ? AGGREGATE_FUNCTIONS.get(operator)
            : SCALAR_FUNCTIONS.get(operator);
    return name != null ? name : operator.getName().toLowerCase(Locale.ROOT);
  }

  /**
   * Operator for a scalar catalog name. Unmapped names become user-defined functions; callers
   * supply the return type explicitly when building the call.
   */
  public static SqlOperator toScalarOperator(String functionName) {
    SqlOperator operator = SCALAR_FUNCTIONS.inverse().get(functionName);
    if (operator != null) {
      return operator;
    }
    return new SqlFunction(
        functionName.toUpperCase(Locale.ROOT),
        SqlKind.OTHER_FUNCTION,
        null,
        null,
        OperandTypes.VARIADIC,
        SqlFunctionCategory.USER_DEFINED_FUNCTION);
  }

  public static Optional<SqlAggFunction> toAggregateFunction(String functionName) {
    return Optional.ofNullable(AGGREGATE_FUNCTIONS.inverse().get(functionName));
  }
}
