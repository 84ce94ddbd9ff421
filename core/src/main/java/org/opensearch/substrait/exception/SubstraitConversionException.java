/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.exception;

/** Base exception for failures while converting between physical plans and Substrait plans. */
public class SubstraitConversionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SubstraitConversionException(String message) {
    super(message);
  }

  public SubstraitConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
