/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.type;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.substrait.proto.NamedStruct;
import io.substrait.proto.Type;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TypeConverterTest {

  private RelDataTypeFactory typeFactory;
  private TypeConverter converter;

  @BeforeEach
  void setUp() {
    typeFactory = new SqlTypeFactoryImpl(SubstraitTypeSystem.INSTANCE);
    converter = new TypeConverter(typeFactory);
  }

  @Test
  void scalar_types_carry_nullability() {
    Type required = converter.toSubstrait(typeFactory.createSqlType(SqlTypeName.INTEGER));
    Type nullable =
        converter.toSubstrait(
            typeFactory.createTypeWithNullability(
                typeFactory.createSqlType(SqlTypeName.DOUBLE), true));

    assertEquals(Type.KindCase.I32, required.getKindCase());
    assertEquals(Type.Nullability.NULLABILITY_REQUIRED, required.getI32().getNullability());
    assertEquals(Type.KindCase.FP64, nullable.getKindCase());
    assertEquals(Type.Nullability.NULLABILITY_NULLABLE, nullable.getFp64().getNullability());
  }

  @Test
  void scalar_types_map_back() {
    for (SqlTypeName typeName :
        List.of(
            SqlTypeName.BOOLEAN,
            SqlTypeName.TINYINT,
            SqlTypeName.SMALLINT,
            SqlTypeName.INTEGER,
            SqlTypeName.BIGINT,
            SqlTypeName.REAL,
            SqlTypeName.DOUBLE,
            SqlTypeName.VARCHAR,
            SqlTypeName.VARBINARY,
            SqlTypeName.DATE,
            SqlTypeName.TIMESTAMP)) {
      RelDataType type = typeFactory.createSqlType(typeName);
      RelDataType back = converter.toRelDataType(converter.toSubstrait(type));

      assertEquals(typeName, back.getSqlTypeName());
      assertFalse(back.isNullable());
    }
  }

  @Test
  void decimal_keeps_precision_and_scale() {
    Type decimal = converter.toSubstrait(typeFactory.createSqlType(SqlTypeName.DECIMAL, 12, 3));

    assertEquals(12, decimal.getDecimal().getPrecision());
    assertEquals(3, decimal.getDecimal().getScale());
    RelDataType back = converter.toRelDataType(decimal);
    assertEquals(12, back.getPrecision());
    assertEquals(3, back.getScale());
  }

  @Test
  void unspecified_nullability_is_nullable() {
    Type type = Type.newBuilder().setI64(Type.I64.getDefaultInstance()).build();

    assertTrue(converter.toRelDataType(type).isNullable());
  }

  @Test
  void unsupported_type_fails() {
    RelDataType time = typeFactory.createSqlType(SqlTypeName.TIME);

    UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class, () -> converter.toSubstrait(time));
    assertTrue(e.getMessage().startsWith("Unsupported type"));
  }

  @Test
  void named_struct_lists_nested_names_depth_first() {
    RelDataType point =
        typeFactory
            .builder()
            .add("x", SqlTypeName.DOUBLE)
            .add("y", SqlTypeName.DOUBLE)
            .build();
    RelDataType rowType =
        typeFactory.builder().add("id", SqlTypeName.BIGINT).add("location", point).build();

    NamedStruct struct = converter.toNamedStruct(rowType);

    assertEquals(List.of("id", "location", "x", "y"), struct.getNamesList());
    assertEquals(2, struct.getStruct().getTypesCount());
    RelDataType back = converter.toRowType(struct);
    assertEquals(List.of("id", "location"), back.getFieldNames());
    assertEquals(List.of("x", "y"), back.getFieldList().get(1).getType().getFieldNames());
  }

  @Test
  void named_struct_with_extra_names_fails() {
    NamedStruct struct =
        NamedStruct.newBuilder()
            .addAllNames(List.of("a", "b"))
            .setStruct(
                Type.Struct.newBuilder()
                    .addTypes(Type.newBuilder().setBool(Type.Boolean.getDefaultInstance())))
            .build();

    assertThrows(PlanStructureException.class, () -> converter.toRowType(struct));
  }

  @Test
  void signature_names_are_short() {
    assertEquals("str", signatureName(typeFactory.createSqlType(SqlTypeName.VARCHAR)));
    assertEquals("dec", signatureName(typeFactory.createSqlType(SqlTypeName.DECIMAL, 10, 2)));
    assertEquals(
        "list",
        signatureName(
            typeFactory.createArrayType(typeFactory.createSqlType(SqlTypeName.INTEGER), -1)));
  }

  private String signatureName(RelDataType type) {
    return TypeConverter.signatureName(converter.toSubstrait(type));
  }
}
