/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.service;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import io.substrait.proto.Plan;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.RelNode;
import org.opensearch.substrait.exception.SubstraitConversionException;
import org.opensearch.substrait.planner.calcite.CalciteRelImporter;
import org.opensearch.substrait.planner.converter.PhysicalToSubstraitPlanConverter;
import org.opensearch.substrait.planner.converter.SubstraitPlanConversion;
import org.opensearch.substrait.planner.converter.SubstraitToPhysicalPlanConverter;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;

/** Converts plans between physical operator trees and Substrait, and (de)serializes them. */
@Log4j2
@RequiredArgsConstructor
public class SubstraitPlanService {

  private final PhysicalToSubstraitPlanConverter physicalToSubstrait;

  private final SubstraitToPhysicalPlanConverter substraitToPhysical;

  private final CalciteRelImporter calciteImporter;

  public Plan toSubstrait(PhysicalOperatorNode root) {
    return physicalToSubstrait.toSubstrait(root);
  }

  /** Exports a Calcite logical plan. */
  public Plan toSubstrait(RelNode root) {
    return physicalToSubstrait.toSubstrait(calciteImporter.importPlan(root));
  }

  public SubstraitPlanConversion toPhysicalPlan(Plan plan) {
    return substraitToPhysical.toPhysicalPlan(plan);
  }

  public byte[] serialize(Plan plan) {
    return plan.toByteArray();
  }

  public Plan deserialize(byte[] bytes) {
    try {
      return Plan.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new SubstraitConversionException("Malformed Substrait plan", e);
    }
  }

  public String toJson(Plan plan) {
    try {
      return JsonFormat.printer().print(plan);
    } catch (InvalidProtocolBufferException e) {
      throw new SubstraitConversionException("Failed to print Substrait plan as JSON", e);
    }
  }

  public Plan fromJson(String json) {
    Plan.Builder plan = Plan.newBuilder();
    try {
      JsonFormat.parser().merge(json, plan);
    } catch (InvalidProtocolBufferException e) {
      log.error("Invalid Substrait plan JSON", e);
      throw new SubstraitConversionException("Malformed Substrait plan JSON", e);
    }
    return plan.build();
  }
}
