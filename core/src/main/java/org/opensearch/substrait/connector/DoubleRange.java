/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.connector;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Range constraint on one column pushed into a table scan. An unbounded side ignores its value
 * and exclusivity flag.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DoubleRange {

  private double lower;
  private boolean lowerUnbounded = true;
  private boolean lowerExclusive;
  private double upper;
  private boolean upperUnbounded = true;
  private boolean upperExclusive;
  private boolean nullAllowed = true;

  /** Range accepting every non-null value. */
  public static DoubleRange notNull() {
    return new DoubleRange(0, true, false, 0, true, false, false);
  }

  /** Returns whether {@code value} satisfies the range; null satisfies it iff nulls are allowed. */
  public boolean test(Double value) {
    if (value == null) {
      return nullAllowed;
    }
    if (!lowerUnbounded && (lowerExclusive ? value <= lower : value < lower)) {
      return false;
    }
    return upperUnbounded || (upperExclusive ? value < upper : value <= upper);
  }

  @Override
  public String toString() {
    return (lowerUnbounded ? "(-inf" : (lowerExclusive ? "(" : "[") + lower)
        + ", "
        + (upperUnbounded ? "+inf)" : upper + (upperExclusive ? ")" : "]"))
        + (nullAllowed ? " or null" : "");
  }
}
