/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

/**
 * Visitor over every physical operator kind. A new operator kind adds a method here, so each
 * converter has to handle it.
 *
 * @param <R> result type
 * @param <C> context type
 */
public interface PhysicalOperatorVisitor<R, C> {

  R visitScan(ScanPhysicalOperator node, C context);

  R visitValues(ValuesPhysicalOperator node, C context);

  R visitFilter(FilterPhysicalOperator node, C context);

  R visitProjection(ProjectionPhysicalOperator node, C context);

  R visitAggregation(AggregationPhysicalOperator node, C context);

  R visitJoin(JoinPhysicalOperator node, C context);

  R visitSort(SortPhysicalOperator node, C context);

  R visitLimit(LimitPhysicalOperator node, C context);
}
