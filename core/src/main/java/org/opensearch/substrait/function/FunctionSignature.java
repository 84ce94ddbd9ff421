/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.google.common.collect.ImmutableList;
import io.substrait.proto.Type;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.substrait.type.TypeConverter;

/** Call-site signature used to look up a {@link FunctionVariant}. */
@Getter
@EqualsAndHashCode
public class FunctionSignature {

  private final String name;

  /** Short type names of the arguments, see {@link TypeConverter#signatureName(Type)}. */
  private final List<String> argumentTypes;

  private final boolean aggregate;

  public FunctionSignature(String name, List<String> argumentTypes, boolean aggregate) {
    this.name = name;
    this.argumentTypes = ImmutableList.copyOf(argumentTypes);
    this.aggregate = aggregate;
  }

  public static FunctionSignature of(String name, List<Type> argumentTypes, boolean aggregate) {
    return new FunctionSignature(
        name,
        argumentTypes.stream().map(TypeConverter::signatureName).collect(Collectors.toList()),
        aggregate);
  }

  /** Renders the signature in compound form, e.g. {@code add:i32_i32}. */
  @Override
  public String toString() {
    return name + ":" + String.join("_", argumentTypes);
  }
}
