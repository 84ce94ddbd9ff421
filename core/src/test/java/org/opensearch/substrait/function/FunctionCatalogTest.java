/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FunctionCatalogTest {

  private FunctionCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = FunctionCatalogLoader.fromResources(List.of("functions_test.yaml"));
  }

  @Test
  void concrete_variant_is_preferred_over_wildcard() {
    FunctionVariant variant = lookup("plus", List.of("i32", "i32"), false).get();

    assertEquals("plus:i32_i32", variant.getSignature());
    assertEquals("i32", variant.getReturnType());
  }

  @Test
  void wildcard_binds_same_symbol_to_one_type() {
    FunctionVariant variant = lookup("plus", List.of("fp64", "fp64"), false).get();

    assertEquals("plus:any_any", variant.getSignature());
    assertEquals("any1", variant.getReturnType());
  }

  @Test
  void wildcard_rejects_conflicting_bindings() {
    assertFalse(lookup("plus", List.of("i32", "str"), false).isPresent());
  }

  @Test
  void lookup_is_deterministic() {
    FunctionSignature signature = new FunctionSignature("plus", List.of("i64", "i64"), false);

    assertSame(catalog.lookup(signature).get(), catalog.lookup(signature).get());
  }

  @Test
  void variadic_variant_respects_bounds() {
    assertTrue(lookup("concat_all", List.of("str"), false).isPresent());
    assertTrue(lookup("concat_all", List.of("str", "str", "str"), false).isPresent());
    assertFalse(lookup("concat_all", List.of(), false).isPresent());
    assertFalse(lookup("concat_all", List.of("str", "str", "str", "str"), false).isPresent());
    assertFalse(lookup("concat_all", List.of("str", "i32"), false).isPresent());
  }

  @Test
  void enum_arguments_render_in_signature_and_never_match_values() {
    FunctionVariant variant = catalog.getVariants("round_to", false).get(0);

    assertEquals("round_to:fp64_req", variant.getSignature());
    assertThat(variant.getArguments().get(1).getOptions(), contains("FLOOR", "CEIL"));
    assertFalse(lookup("round_to", List.of("fp64", "str"), false).isPresent());
  }

  @Test
  void aggregate_is_found_by_argument_or_intermediate_type() {
    FunctionVariant byArgument = lookup("total", List.of("i32"), true).get();
    FunctionVariant byIntermediate = lookup("total", List.of("i64"), true).get();

    assertSame(byArgument, byIntermediate);
    assertEquals("i64", byArgument.getReturnType());
    assertEquals("i64", byArgument.getIntermediateType());
  }

  @Test
  void scalars_and_aggregates_are_separate() {
    assertFalse(lookup("total", List.of("i32"), false).isPresent());
    assertFalse(lookup("plus", List.of("i32", "i32"), true).isPresent());
  }

  @Test
  void unknown_function_is_empty() {
    assertFalse(lookup("minus", List.of("i32", "i32"), false).isPresent());
  }

  @Test
  void bundled_extensions_resolve_common_functions() {
    FunctionCatalog bundled =
        FunctionCatalogLoader.fromResources(
            List.of(
                "functions_comparison.yaml",
                "functions_boolean.yaml",
                "functions_arithmetic.yaml",
                "functions_aggregate_generic.yaml"));

    assertTrue(
        bundled.lookup(new FunctionSignature("equal", List.of("i32", "i32"), false)).isPresent());
    assertTrue(
        bundled.lookup(new FunctionSignature("and", List.of("bool", "bool", "bool"), false))
            .isPresent());
    assertEquals(
        "add:i64_i64",
        bundled
            .lookup(new FunctionSignature("add", List.of("i64", "i64"), false))
            .get()
            .getSignature());
    assertTrue(bundled.lookup(new FunctionSignature("count", List.of(), true)).isPresent());
    assertEquals("/functions_comparison.yaml", bundled.getVariants("gte", false).get(0).getUri());
  }

  private Optional<FunctionVariant> lookup(String name, List<String> types, boolean aggregate) {
    return catalog.lookup(new FunctionSignature(name, types, aggregate));
  }
}
