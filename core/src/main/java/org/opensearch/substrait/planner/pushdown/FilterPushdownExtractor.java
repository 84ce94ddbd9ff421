/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.pushdown;

import io.substrait.proto.Expression;
import io.substrait.proto.FunctionArgument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.substrait.connector.DoubleRange;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.expression.SubstraitToRexConverter;

/**
 * Turns the filter of a Substrait read into per-column range filters for the table scan.
 *
 * <p>The filter must be a conjunction of comparisons between a column and a floating point
 * literal:
 *
 * <ul>
 *   <li>is_not_null(col)
 *   <li>gte / gt / lte / lt (col, literal), or with the operands swapped
 * </ul>
 *
 * <p>Repeated bounds on the same side of one column are not intersected: the last one wins.
 */
@Log4j2
@UtilityClass
public class FilterPushdownExtractor {

  /**
   * Extracts range filters keyed by column name.
   *
   * @param filter conjunctive filter expression
   * @param inputType columns the filter's field references point into
   * @param functionNames function names of the plan keyed by anchor
   * @throws UnsupportedConstructException if the filter is not a conjunction of supported
   *     comparisons
   */
  public static Map<String, DoubleRange> extract(
      Expression filter, RelDataType inputType, Map<Integer, String> functionNames) {
    List<Expression.ScalarFunction> comparisons = new ArrayList<>();
    flatten(filter, functionNames, comparisons);

    Map<String, DoubleRange> ranges = new LinkedHashMap<>();
    for (Expression.ScalarFunction comparison : comparisons) {
      String name = functionName(comparison, functionNames);
      if ("is_not_null".equals(name)) {
        String column = column(single(comparison, name), inputType);
        ranges.computeIfAbsent(column, c -> new DoubleRange()).setNullAllowed(false);
        continue;
      }
      if (comparison.getArgumentsCount() != 2) {
        throw new UnsupportedConstructException(
            String.format(
                "Unsupported pushdown filter %s with %d arguments",
                name, comparison.getArgumentsCount()));
      }
      Expression left = value(comparison.getArguments(0));
      Expression right = value(comparison.getArguments(1));
      if (left.hasLiteral() && right.hasSelection()) {
        Expression swap = left;
        left = right;
        right = swap;
        name = reverse(name);
      }
      String column = column(left, inputType);
      double bound = doubleLiteral(right);
      DoubleRange range = ranges.computeIfAbsent(column, c -> new DoubleRange());
      switch (name) {
        case "gte":
          setLower(column, range, bound, false);
          break;
        case "gt":
          setLower(column, range, bound, true);
          break;
        case "lte":
          setUpper(column, range, bound, false);
          break;
        case "lt":
          setUpper(column, range, bound, true);
          break;
        default:
          throw new UnsupportedConstructException(
              String.format("Unsupported pushdown filter function %s", name));
      }
    }
    log.debug("[Pushdown] Extracted ranges {}", ranges);
    return ranges;
  }

  private static void flatten(
      Expression expression,
      Map<Integer, String> functionNames,
      List<Expression.ScalarFunction> comparisons) {
    if (!expression.hasScalarFunction()) {
      throw new UnsupportedConstructException(
          String.format("Unsupported pushdown filter shape %s", expression.getRexTypeCase()));
    }
    Expression.ScalarFunction function = expression.getScalarFunction();
    if ("and".equals(functionName(function, functionNames))) {
      for (FunctionArgument argument : function.getArgumentsList()) {
        flatten(value(argument), functionNames, comparisons);
      }
    } else {
      comparisons.add(function);
    }
  }

  private static void setLower(String column, DoubleRange range, double bound, boolean exclusive) {
    if (!range.isLowerUnbounded()) {
      log.warn("[Pushdown] Lower bound {} of {} replaced by {}", range.getLower(), column, bound);
    }
    range.setLower(bound);
    range.setLowerUnbounded(false);
    range.setLowerExclusive(exclusive);
  }

  private static void setUpper(String column, DoubleRange range, double bound, boolean exclusive) {
    if (!range.isUpperUnbounded()) {
      log.warn("[Pushdown] Upper bound {} of {} replaced by {}", range.getUpper(), column, bound);
    }
    range.setUpper(bound);
    range.setUpperUnbounded(false);
    range.setUpperExclusive(exclusive);
  }

  private static String reverse(String name) {
    switch (name) {
      case "gte":
        return "lte";
      case "gt":
        return "lt";
      case "lte":
        return "gte";
      case "lt":
        return "gt";
      default:
        return name;
    }
  }

  private static String functionName(
      Expression.ScalarFunction function, Map<Integer, String> functionNames) {
    String name = functionNames.get(function.getFunctionReference());
    if (name == null) {
      throw new PlanStructureException(
          String.format(
              "Function anchor %d is not declared in the plan extensions",
              function.getFunctionReference()));
    }
    return name;
  }

  private static Expression single(Expression.ScalarFunction function, String name) {
    if (function.getArgumentsCount() != 1) {
      throw new UnsupportedConstructException(
          String.format("%s expects one argument, got %d", name, function.getArgumentsCount()));
    }
    return value(function.getArguments(0));
  }

  private static Expression value(FunctionArgument argument) {
    if (!argument.hasValue()) {
      throw new UnsupportedConstructException(
          String.format("Unsupported function argument kind %s", argument.getArgTypeCase()));
    }
    return argument.getValue();
  }

  private static String column(Expression expression, RelDataType inputType) {
    int index = SubstraitToRexConverter.fieldIndex(expression, inputType);
    return inputType.getFieldList().get(index).getName();
  }

  private static double doubleLiteral(Expression expression) {
    if (!expression.hasLiteral()) {
      throw new UnsupportedConstructException(
          String.format("Expected a literal bound but got %s", expression.getRexTypeCase()));
    }
    Expression.Literal literal = expression.getLiteral();
    switch (literal.getLiteralTypeCase()) {
      case FP64:
        return literal.getFp64();
      case FP32:
        return literal.getFp32();
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported pushdown literal kind %s", literal.getLiteralTypeCase()));
    }
  }
}
