/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.exception;

/** A plan or expression shape that has no mapping in the target representation. */
public class UnsupportedConstructException extends SubstraitConversionException {

  private static final long serialVersionUID = 1L;

  public UnsupportedConstructException(String message) {
    super(message);
  }

  public UnsupportedConstructException(String message, Throwable cause) {
    super(message, cause);
  }
}
