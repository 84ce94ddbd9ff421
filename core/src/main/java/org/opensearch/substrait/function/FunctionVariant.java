/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One overload of a named function as declared by an extension source. The last argument of a
 * variadic variant may repeat between {@code variadicMin} and {@code variadicMax} times.
 */
@Getter
@EqualsAndHashCode(of = {"uri", "signature"})
public class FunctionVariant {

  private final String name;

  /** URI of the extension source declaring this variant. */
  private final String uri;

  private final List<ArgumentSpec> arguments;

  private final String returnType;

  /** Accumulator type of an aggregate variant, null for scalar variants. */
  private final String intermediateType;

  private final boolean aggregate;

  private final Integer variadicMin;

  private final Integer variadicMax;

  /** Compound signature, e.g. {@code add:i32_i32} or {@code equal:any_any}. */
  private final String signature;

  public FunctionVariant(
      String name,
      String uri,
      List<ArgumentSpec> arguments,
      String returnType,
      String intermediateType,
      boolean aggregate,
      Integer variadicMin,
      Integer variadicMax) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "function name is required");
    Preconditions.checkArgument(
        variadicMin == null || !arguments.isEmpty(), "variadic function %s has no arguments", name);
    this.name = name;
    this.uri = uri;
    this.arguments = ImmutableList.copyOf(arguments);
    this.returnType = returnType;
    this.intermediateType = intermediateType;
    this.aggregate = aggregate;
    this.variadicMin = variadicMin;
    this.variadicMax = variadicMax;
    this.signature =
        name
            + ":"
            + this.arguments.stream().map(ArgumentSpec::getToken).collect(Collectors.joining("_"));
  }

  public boolean isVariadic() {
    return variadicMin != null;
  }

  public boolean isWildcard() {
    return arguments.stream().anyMatch(arg -> arg.getKind() != ArgumentSpec.Kind.VALUE);
  }

  /** Signature keyed by the accumulator type, e.g. {@code avg:struct}; empty for scalars. */
  public Optional<String> getIntermediateSignature() {
    if (intermediateType == null) {
      return Optional.empty();
    }
    return Optional.of(name + ":" + ArgumentSpec.typeToken(intermediateType));
  }

  /**
   * Unifies the variant's argument positions with the argument types of a call site. Every fixed
   * position must match exactly, every occurrence of a wildcard symbol must bind to the same
   * type.
   *
   * @param argumentTypes short type names of the call-site arguments
   * @return symbol bindings, or empty when the call site does not match
   */
  public Optional<Map<String, String>> bind(List<String> argumentTypes) {
    if (!acceptsArity(argumentTypes.size())) {
      return Optional.empty();
    }
    Map<String, String> bindings = new HashMap<>();
    for (int i = 0; i < argumentTypes.size(); i++) {
      ArgumentSpec spec = arguments.get(Math.min(i, arguments.size() - 1));
      String actual = argumentTypes.get(i);
      switch (spec.getKind()) {
        case VALUE:
          if (!spec.getToken().equals(actual)) {
            return Optional.empty();
          }
          break;
        case WILDCARD:
          if (spec.getSymbol() != null) {
            String bound = bindings.putIfAbsent(spec.getSymbol(), actual);
            if (bound != null && !bound.equals(actual)) {
              return Optional.empty();
            }
          }
          break;
        default:
          // enum options are not carried by value arguments
          return Optional.empty();
      }
    }
    return Optional.of(bindings);
  }

  private boolean acceptsArity(int arity) {
    if (!isVariadic()) {
      return arity == arguments.size();
    }
    int fixed = arguments.size() - 1;
    int repeats = arity - fixed;
    return repeats >= variadicMin && (variadicMax == null || repeats <= variadicMax);
  }

  @Override
  public String toString() {
    return uri + "#" + signature;
  }
}
