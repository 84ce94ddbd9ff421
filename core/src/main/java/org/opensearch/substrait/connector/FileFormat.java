/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.connector;

/** File formats a scan split can point at. */
public enum FileFormat {
  DWRF,
  PARQUET,
  UNKNOWN
}
