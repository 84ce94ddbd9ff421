/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.split;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.substrait.connector.FileFormat;

/**
 * File locations discovered while converting a Substrait read of local files. The scan operator
 * does not carry them; they are returned next to the converted plan, keyed by the scan's node id.
 */
@Getter
public class SplitInfo {

  /** Partition the files belong to. */
  private final long partitionIndex;

  private final List<String> paths;

  /** Byte offsets at which reading starts, one per path. */
  private final List<Long> starts;

  /** Number of bytes to read, one per path. */
  private final List<Long> lengths;

  private final FileFormat format;

  public SplitInfo(
      long partitionIndex,
      List<String> paths,
      List<Long> starts,
      List<Long> lengths,
      FileFormat format) {
    if (paths.size() != starts.size() || paths.size() != lengths.size()) {
      throw new IllegalArgumentException(
          "Split info needs one start and one length per path, got "
              + paths.size()
              + " paths, "
              + starts.size()
              + " starts, "
              + lengths.size()
              + " lengths");
    }
    this.partitionIndex = partitionIndex;
    this.paths = ImmutableList.copyOf(paths);
    this.starts = ImmutableList.copyOf(starts);
    this.lengths = ImmutableList.copyOf(lengths);
    this.format = format;
  }

  @Override
  public String toString() {
    return "SplitInfo{partition="
        + partitionIndex
        + ", paths="
        + paths
        + ", starts="
        + starts
        + ", lengths="
        + lengths
        + ", format="
        + format
        + '}';
  }
}
