/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import io.substrait.proto.Plan;
import io.substrait.proto.SimpleExtensionDeclaration;
import io.substrait.proto.SimpleExtensionURI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns anchors to the function variants referenced by one plan. A variant used several times
 * gets a single anchor. Not thread-safe; one instance per conversion.
 */
public class FunctionReferenceCollector {

  private static final int FIRST_FUNCTION_ANCHOR = 0;
  private static final int FIRST_URI_ANCHOR = 1;

  private final Map<FunctionVariant, Integer> functions = new LinkedHashMap<>();

  public int getReference(FunctionVariant variant) {
    return functions.computeIfAbsent(variant, v -> FIRST_FUNCTION_ANCHOR + functions.size());
  }

  public int size() {
    return functions.size();
  }

  /** Writes extension URIs and function declarations in assignment order. */
  public void addExtensionsToPlan(Plan.Builder plan) {
    Map<String, Integer> uris = new LinkedHashMap<>();
    for (FunctionVariant variant : functions.keySet()) {
      uris.computeIfAbsent(variant.getUri(), uri -> FIRST_URI_ANCHOR + uris.size());
    }
    uris.forEach(
        (uri, anchor) ->
            plan.addExtensionUris(
                SimpleExtensionURI.newBuilder().setExtensionUriAnchor(anchor).setUri(uri)));
    functions.forEach(
        (variant, anchor) ->
            plan.addExtensions(
                SimpleExtensionDeclaration.newBuilder()
                    .setExtensionFunction(
                        SimpleExtensionDeclaration.ExtensionFunction.newBuilder()
                            .setExtensionUriReference(uris.get(variant.getUri()))
                            .setFunctionAnchor(anchor)
                            .setName(variant.getSignature()))));
  }
}
