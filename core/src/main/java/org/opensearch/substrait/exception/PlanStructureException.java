/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.exception;

/** A required field is missing or a cardinality invariant of an operator is broken. */
public class PlanStructureException extends SubstraitConversionException {

  private static final long serialVersionUID = 1L;

  public PlanStructureException(String message) {
    super(message);
  }
}
