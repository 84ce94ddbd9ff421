/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.exception;

import lombok.Getter;

/** No function variant in the catalog matches the signature of a call. */
public class FunctionNotFoundException extends SubstraitConversionException {

  private static final long serialVersionUID = 1L;

  @Getter private final String signature;

  public FunctionNotFoundException(String signature) {
    super(String.format("Function not found for signature %s", signature));
    this.signature = signature;
  }
}
