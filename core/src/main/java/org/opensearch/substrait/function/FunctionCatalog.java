/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Index of every function variant known to the converters. Built once and read-only afterwards,
 * so one instance can be shared by concurrent conversions.
 *
 * <p>Lookup for a function name tries, in order: variants whose signature is fully concrete,
 * aggregate variants keyed by their accumulator type, and finally wildcard and variadic variants
 * in declaration order. The first match wins.
 */
@Log4j2
public class FunctionCatalog {

  private final Tier scalars;
  private final Tier aggregates;

  public FunctionCatalog(List<FunctionVariant> variants) {
    this.scalars = new Tier(variants, false);
    this.aggregates = new Tier(variants, true);
  }

  public Optional<FunctionVariant> lookup(FunctionSignature signature) {
    Optional<FunctionVariant> variant =
        (signature.isAggregate() ? aggregates : scalars).lookup(signature);
    log.debug("Resolved {} to {}", signature, variant.orElse(null));
    return variant;
  }

  /** Returns all variants declared under the given name. */
  public List<FunctionVariant> getVariants(String name, boolean aggregate) {
    return (aggregate ? aggregates : scalars).patterns.get(name);
  }

  public int size() {
    return scalars.size + aggregates.size;
  }

  private static class Tier {
    private final Map<String, FunctionVariant> direct;
    private final Map<String, FunctionVariant> intermediate;
    private final ListMultimap<String, FunctionVariant> patterns;
    private final int size;

    Tier(List<FunctionVariant> variants, boolean aggregate) {
      Map<String, FunctionVariant> directs = new HashMap<>();
      Map<String, FunctionVariant> intermediates = new HashMap<>();
      ImmutableListMultimap.Builder<String, FunctionVariant> all = ImmutableListMultimap.builder();
      int count = 0;
      for (FunctionVariant variant : variants) {
        if (variant.isAggregate() != aggregate) {
          continue;
        }
        count++;
        all.put(variant.getName(), variant);
        if (!variant.isWildcard()) {
          directs.putIfAbsent(variant.getSignature(), variant);
        }
        variant
            .getIntermediateSignature()
            .ifPresent(key -> intermediates.putIfAbsent(key, variant));
      }
      this.direct = ImmutableMap.copyOf(directs);
      this.intermediate = ImmutableMap.copyOf(intermediates);
      this.patterns = all.build();
      this.size = count;
    }

    Optional<FunctionVariant> lookup(FunctionSignature signature) {
      String key = signature.toString();
      FunctionVariant variant = direct.get(key);
      if (variant == null) {
        variant = intermediate.get(key);
      }
      if (variant != null) {
        return Optional.of(variant);
      }
      for (FunctionVariant candidate : patterns.get(signature.getName())) {
        if ((candidate.isWildcard() || candidate.isVariadic())
            && candidate.bind(signature.getArgumentTypes()).isPresent()) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }
}
