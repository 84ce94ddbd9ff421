/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.physical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Direction and null placement of one sort key. */
@Getter
@RequiredArgsConstructor
public enum SortOrder {
  ASC_NULLS_FIRST(true, true),
  ASC_NULLS_LAST(true, false),
  DESC_NULLS_FIRST(false, true),
  DESC_NULLS_LAST(false, false);

  private final boolean ascending;
  private final boolean nullsFirst;
}
