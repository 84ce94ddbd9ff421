/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** One argument position of a {@link FunctionVariant}. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ArgumentSpec {

  private static final Pattern WILDCARD = Pattern.compile("any(\\d*)");

  public enum Kind {
    /** A fixed type such as i32 or varchar. */
    VALUE,
    /** A type parameter bound at each call site. */
    WILDCARD,
    /** An enumerated option. */
    ENUM
  }

  private final Kind kind;

  /** Short type name used in compound signatures. */
  private final String token;

  /** Wildcard symbol shared across positions, or null when the wildcard is unconstrained. */
  private final String symbol;

  private final List<String> options;

  public static ArgumentSpec value(String typeExpression) {
    String base = baseType(typeExpression);
    Matcher matcher = WILDCARD.matcher(base);
    if (matcher.matches()) {
      return new ArgumentSpec(
          Kind.WILDCARD, "any", matcher.group(1).isEmpty() ? null : base, ImmutableList.of());
    }
    return new ArgumentSpec(Kind.VALUE, shortName(base), null, ImmutableList.of());
  }

  public static ArgumentSpec enumeration(List<String> options, boolean required) {
    return new ArgumentSpec(
        Kind.ENUM, required ? "req" : "opt", null, ImmutableList.copyOf(options));
  }

  /**
   * Returns the short signature name of a type expression, ignoring nullability markers and type
   * parameters, e.g. {@code "varchar<L1>"} gives {@code vchar} and {@code "DECIMAL?<P,S>"} gives
   * {@code dec}.
   */
  public static String typeToken(String typeExpression) {
    String base = baseType(typeExpression);
    return WILDCARD.matcher(base).matches() ? "any" : shortName(base);
  }

  private static String baseType(String typeExpression) {
    String type = typeExpression.trim().toLowerCase(Locale.ROOT);
    int angle = type.indexOf('<');
    if (angle >= 0) {
      type = type.substring(0, angle);
    }
    return type.replace("?", "").trim();
  }

  private static String shortName(String base) {
    switch (base) {
      case "boolean":
        return "bool";
      case "string":
        return "str";
      case "binary":
        return "vbin";
      case "timestamp":
        return "ts";
      case "timestamp_tz":
        return "tstz";
      case "interval_year":
        return "iyear";
      case "interval_day":
        return "iday";
      case "fixedchar":
        return "fchar";
      case "varchar":
        return "vchar";
      case "fixedbinary":
        return "fbin";
      case "decimal":
        return "dec";
      case "precision_timestamp":
        return "pts";
      case "precision_timestamp_tz":
        return "ptstz";
      default:
        return base;
    }
  }

  @Override
  public String toString() {
    return kind == Kind.WILDCARD && symbol != null ? symbol : token;
  }
}
