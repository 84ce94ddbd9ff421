/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.substrait.proto.Expression;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.util.DateString;
import org.apache.calcite.util.TimestampString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.type.SubstraitTypeSystem;
import org.opensearch.substrait.type.TypeConverter;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LiteralConverterTest {

  private RelDataTypeFactory typeFactory;
  private RexBuilder rexBuilder;
  private LiteralConverter converter;

  @BeforeEach
  void setUp() {
    typeFactory = new SqlTypeFactoryImpl(SubstraitTypeSystem.INSTANCE);
    rexBuilder = new RexBuilder(typeFactory);
    converter = new LiteralConverter(new TypeConverter(typeFactory));
  }

  @Test
  void null_value_is_typed_null() {
    Expression.Literal literal = converter.toLiteral(null, type(SqlTypeName.BIGINT));

    assertTrue(literal.hasNull());
    assertTrue(literal.getNull().hasI64());
    assertTrue(literal.getNullable());
    assertNull(converter.toJavaValue(literal));
  }

  @Test
  void decimal_is_sixteen_bytes_little_endian() {
    RelDataType decimalType = typeFactory.createSqlType(SqlTypeName.DECIMAL, 10, 2);

    Expression.Literal literal = converter.toLiteral(new BigDecimal("-1.50"), decimalType);

    assertEquals(16, literal.getDecimal().getValue().size());
    // -150 in two's complement
    assertEquals((byte) 0x6A, literal.getDecimal().getValue().byteAt(0));
    assertEquals((byte) 0xFF, literal.getDecimal().getValue().byteAt(15));
    assertEquals(new BigDecimal("-1.50"), converter.toJavaValue(literal));
  }

  @Test
  void rex_literals_are_encoded() {
    assertEquals(7L, converter.toLiteral(exact(7, SqlTypeName.BIGINT)).getI64());
    assertEquals(2.5, converter.toLiteral(approx(2.5)).getFp64());
    assertEquals("abc", converter.toLiteral(rexBuilder.makeLiteral("abc")).getString());
    assertEquals(
        19000,
        converter
            .toLiteral(rexBuilder.makeDateLiteral(DateString.fromDaysSinceEpoch(19000)))
            .getDate());
  }

  @Test
  void nested_values_recurse() {
    RelDataType arrayType = typeFactory.createArrayType(type(SqlTypeName.INTEGER), -1);
    RelDataType mapType =
        typeFactory.createMapType(type(SqlTypeName.VARCHAR), type(SqlTypeName.DOUBLE));
    RelDataType rowType =
        typeFactory.builder().add("ids", arrayType).add("scores", mapType).build();

    Expression.Literal literal =
        converter.toLiteral(List.of(List.of(1, 2), Map.of("x", 0.5)), rowType);

    assertEquals(2, literal.getStruct().getFieldsCount());
    assertEquals(2, literal.getStruct().getFields(0).getList().getValuesCount());
    assertEquals(
        "x", literal.getStruct().getFields(1).getMap().getKeyValues(0).getKey().getString());
    assertEquals(List.of(List.of(1, 2), Map.of("x", 0.5)), converter.toJavaValue(literal));
  }

  @Test
  void empty_collections_use_empty_literals() {
    RelDataType arrayType = typeFactory.createArrayType(type(SqlTypeName.INTEGER), -1);

    Expression.Literal literal = converter.toLiteral(List.of(), arrayType);

    assertTrue(literal.hasEmptyList());
    assertEquals(SqlTypeName.ARRAY, converter.toRelDataType(literal).getSqlTypeName());
  }

  @Test
  void wire_literal_becomes_rex_literal() {
    RexNode node =
        converter.toRexLiteral(
            Expression.Literal.newBuilder().setFp64(10.0).build(), rexBuilder);

    assertEquals(SqlTypeName.DOUBLE, node.getType().getSqlTypeName());
    assertEquals(10.0, ((RexLiteral) node).getValueAs(Double.class));
  }

  @Test
  void binary_survives_both_directions() {
    byte[] bytes = {1, 2, 3};

    Expression.Literal literal = converter.toLiteral(bytes, type(SqlTypeName.VARBINARY));

    assertArrayEquals(bytes, (byte[]) converter.toJavaValue(literal));
  }

  @Test
  void struct_literal_is_not_an_expression() {
    Expression.Literal struct =
        Expression.Literal.newBuilder()
            .setStruct(
                Expression.Literal.Struct.newBuilder()
                    .addFields(Expression.Literal.newBuilder().setI32(1)))
            .build();

    assertThrows(
        UnsupportedConstructException.class, () -> converter.toRexLiteral(struct, rexBuilder));
  }

  @Test
  void timestamp_keeps_microseconds_both_ways() {
    Expression.Literal wire =
        Expression.Literal.newBuilder().setTimestamp(1700000000123456L).build();

    RexLiteral rex = (RexLiteral) converter.toRexLiteral(wire, rexBuilder);

    assertEquals(6, rex.getType().getPrecision());
    assertEquals(1700000000123456L, converter.toJavaValue(rex));
    assertEquals(1700000000123456L, converter.toLiteral(rex).getTimestamp());
  }

  @Test
  void timestamp_before_epoch_keeps_microseconds() {
    Expression.Literal wire = Expression.Literal.newBuilder().setTimestamp(-1L).build();

    RexLiteral rex = (RexLiteral) converter.toRexLiteral(wire, rexBuilder);

    assertEquals("1969-12-31 23:59:59.999999", rex.getValueAs(TimestampString.class).toString());
    assertEquals(-1L, converter.toLiteral(rex).getTimestamp());
  }

  @Test
  void non_finite_floats_are_unsupported() {
    Expression.Literal nan = Expression.Literal.newBuilder().setFp64(Double.NaN).build();
    Expression.Literal infinity =
        Expression.Literal.newBuilder().setFp32(Float.POSITIVE_INFINITY).build();

    UnsupportedConstructException e =
        assertThrows(
            UnsupportedConstructException.class, () -> converter.toRexLiteral(nan, rexBuilder));
    assertEquals("Non-finite fp64 literal NaN is not supported", e.getMessage());
    assertThrows(
        UnsupportedConstructException.class, () -> converter.toRexLiteral(infinity, rexBuilder));
  }

  @Test
  void decimal_wider_than_column_scale_is_unsupported() {
    RelDataType decimalType = typeFactory.createSqlType(SqlTypeName.DECIMAL, 10, 2);

    UnsupportedConstructException e =
        assertThrows(
            UnsupportedConstructException.class,
            () -> converter.toLiteral(new BigDecimal("1.234"), decimalType));
    assertTrue(e.getMessage().contains("1.234"));
    assertTrue(e.getMessage().contains("DECIMAL(10, 2)"));
  }

  private RelDataType type(SqlTypeName typeName) {
    return typeFactory.createSqlType(typeName);
  }

  private RexLiteral exact(long value, SqlTypeName typeName) {
    return rexBuilder.makeExactLiteral(BigDecimal.valueOf(value), type(typeName));
  }

  private RexLiteral approx(double value) {
    return rexBuilder.makeApproxLiteral(BigDecimal.valueOf(value));
  }
}
