/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import com.google.common.collect.ImmutableBiMap;
import io.substrait.proto.AggregationPhase;
import lombok.experimental.UtilityClass;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.planner.physical.AggregationPhysicalOperator.Step;

/** One-to-one mapping between aggregation steps and Substrait aggregation phases. */
@UtilityClass
public class AggregationPhases {

  private static final ImmutableBiMap<Step, AggregationPhase> PHASES =
      ImmutableBiMap.of(
          Step.PARTIAL, AggregationPhase.AGGREGATION_PHASE_INITIAL_TO_INTERMEDIATE,
          Step.INTERMEDIATE, AggregationPhase.AGGREGATION_PHASE_INTERMEDIATE_TO_INTERMEDIATE,
          Step.SINGLE, AggregationPhase.AGGREGATION_PHASE_INITIAL_TO_RESULT,
          Step.FINAL, AggregationPhase.AGGREGATION_PHASE_INTERMEDIATE_TO_RESULT);

  public static AggregationPhase toPhase(Step step) {
    AggregationPhase phase = PHASES.get(step);
    if (phase == null) {
      throw new UnsupportedConstructException(
          String.format("Unsupported aggregation step %s", step));
    }
    return phase;
  }

  public static Step toStep(AggregationPhase phase) {
    Step step = PHASES.inverse().get(phase);
    if (step == null) {
      throw new UnsupportedConstructException(
          String.format("Unsupported aggregation phase %s", phase));
    }
    return step;
  }
}
