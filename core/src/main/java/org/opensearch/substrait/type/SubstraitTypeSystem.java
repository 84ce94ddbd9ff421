/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.type;

import org.apache.calcite.rel.type.RelDataTypeSystem;
import org.apache.calcite.rel.type.RelDataTypeSystemImpl;
import org.apache.calcite.sql.type.SqlTypeName;

/**
 * Calcite type system matching Substrait's value domain. Substrait timestamps count microseconds,
 * so TIMESTAMP types default to and allow precision 6.
 */
public class SubstraitTypeSystem extends RelDataTypeSystemImpl {

  public static final RelDataTypeSystem INSTANCE = new SubstraitTypeSystem();

  static final int TIMESTAMP_PRECISION = 6;

  @Override
  public int getMaxPrecision(SqlTypeName typeName) {
    if (typeName == SqlTypeName.TIMESTAMP) {
      return TIMESTAMP_PRECISION;
    }
    return super.getMaxPrecision(typeName);
  }

  @Override
  public int getDefaultPrecision(SqlTypeName typeName) {
    if (typeName == SqlTypeName.TIMESTAMP) {
      return TIMESTAMP_PRECISION;
    }
    return super.getDefaultPrecision(typeName);
  }
}
