/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Getter;
import org.opensearch.substrait.planner.physical.PhysicalOperatorNode;
import org.opensearch.substrait.split.SplitInfo;

/** Physical plan converted from Substrait, with the split info of its file scans. */
@Getter
public class SubstraitPlanConversion {

  private final PhysicalOperatorNode root;

  /** Split info keyed by the id of the scan node that reads the files. */
  private final Map<String, SplitInfo> splitInfos;

  public SubstraitPlanConversion(PhysicalOperatorNode root, Map<String, SplitInfo> splitInfos) {
    this.root = root;
    this.splitInfos = ImmutableMap.copyOf(splitInfos);
  }
}
