/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.planner.converter;

import com.google.common.collect.ImmutableBiMap;
import io.substrait.proto.SortField.SortDirection;
import lombok.experimental.UtilityClass;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.planner.physical.SortOrder;

/** Maps sort orders to Substrait sort directions and back. */
@UtilityClass
public class SortDirections {

  private static final ImmutableBiMap<SortOrder, SortDirection> DIRECTIONS =
      ImmutableBiMap.of(
          SortOrder.ASC_NULLS_FIRST, SortDirection.SORT_DIRECTION_ASC_NULLS_FIRST,
          SortOrder.ASC_NULLS_LAST, SortDirection.SORT_DIRECTION_ASC_NULLS_LAST,
          SortOrder.DESC_NULLS_FIRST, SortDirection.SORT_DIRECTION_DESC_NULLS_FIRST,
          SortOrder.DESC_NULLS_LAST, SortDirection.SORT_DIRECTION_DESC_NULLS_LAST);

  public static SortDirection toDirection(SortOrder order) {
    return DIRECTIONS.get(order);
  }

  public static SortOrder toSortOrder(SortDirection direction) {
    SortOrder order = DIRECTIONS.inverse().get(direction);
    if (order == null) {
      throw new UnsupportedConstructException(
          String.format("Unsupported sort direction %s", direction));
    }
    return order;
  }
}
