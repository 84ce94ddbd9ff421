/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

/** Kinds of physical operators that can be exchanged as Substrait relations. */
public enum PhysicalOperatorType {

  /** Table scan operator - reads from storage. */
  SCAN,

  /** In-memory rows. */
  VALUES,

  /** Filter operator - applies predicates to rows. */
  FILTER,

  /** Projection operator - computes output columns. */
  PROJECTION,

  /** Aggregation, possibly one phase of a distributed aggregation. */
  AGGREGATION,

  /** Two-input join on equality keys. */
  JOIN,

  /** Sort operator. */
  SORT,

  /** Limit operator - skips and caps rows. */
  LIMIT
}
