/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function.extension;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One Substrait simple extension document as read from YAML. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimpleExtension {

  @JsonProperty("types")
  private List<TypeDefinition> types = new ArrayList<>();

  @JsonProperty("scalar_functions")
  private List<FunctionDefinition> scalarFunctions = new ArrayList<>();

  @JsonProperty("aggregate_functions")
  private List<FunctionDefinition> aggregateFunctions = new ArrayList<>();

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TypeDefinition {
    @JsonProperty(required = true)
    private String name;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FunctionDefinition {
    private String name;
    private String description;
    private List<Implementation> impls = new ArrayList<>();
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Implementation {
    private List<Argument> args = new ArrayList<>();
    private Variadic variadic;

    @JsonProperty("return")
    private String returnType;

    private String intermediate;
  }

  /** A value argument carries {@code value}; an enum argument carries {@code options}. */
  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Argument {
    private String name;
    private String value;
    private List<String> options;
    private Boolean required;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Variadic {
    private Integer min;
    private Integer max;
  }
}
