/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.exception;

/** Function extension sources could not be read or are malformed. */
public class FunctionCatalogException extends SubstraitConversionException {

  private static final long serialVersionUID = 1L;

  public FunctionCatalogException(String message) {
    super(message);
  }

  public FunctionCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
