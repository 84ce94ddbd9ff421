/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.expression;

import com.google.protobuf.ByteString;
import io.substrait.proto.Expression;
import io.substrait.proto.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.util.DateString;
import org.apache.calcite.util.TimestampString;
import org.opensearch.substrait.exception.UnsupportedConstructException;
import org.opensearch.substrait.type.TypeConverter;

/**
 * Encodes and decodes Substrait literals. Engine values are plain Java objects: dates are days
 * since the epoch as Integer, timestamps are microseconds since the epoch as Long, rows and
 * arrays are Lists, maps are Maps.
 */
@RequiredArgsConstructor
public class LiteralConverter {

  private static final int DECIMAL_BYTES = 16;

  private static final int MICROS_PRECISION = 6;

  private final TypeConverter typeConverter;

  /** Encodes a Calcite literal. */
  public Expression.Literal toLiteral(RexLiteral literal) {
    return toLiteral(toJavaValue(literal), literal.getType());
  }

  /** Encodes an in-memory value of the given type; null values become typed nulls. */
  public Expression.Literal toLiteral(Object value, RelDataType type) {
    Expression.Literal.Builder builder = Expression.Literal.newBuilder();
    if (value == null) {
      RelDataType nullable = typeFactory().createTypeWithNullability(type, true);
      return builder.setNull(typeConverter.toSubstrait(nullable)).setNullable(true).build();
    }
    builder.setNullable(type.isNullable());
    switch (type.getSqlTypeName()) {
      case BOOLEAN:
        return builder.setBoolean((Boolean) value).build();
      case TINYINT:
        return builder.setI8(((Number) value).intValue()).build();
      case SMALLINT:
        return builder.setI16(((Number) value).intValue()).build();
      case INTEGER:
        return builder.setI32(((Number) value).intValue()).build();
      case BIGINT:
        return builder.setI64(((Number) value).longValue()).build();
      case REAL:
        return builder.setFp32(((Number) value).floatValue()).build();
      case FLOAT:
      case DOUBLE:
        return builder.setFp64(((Number) value).doubleValue()).build();
      case CHAR:
      case VARCHAR:
        return builder.setString(value.toString()).build();
      case BINARY:
      case VARBINARY:
        return builder.setBinary(ByteString.copyFrom((byte[]) value)).build();
      case DATE:
        return builder.setDate(((Number) value).intValue()).build();
      case TIMESTAMP:
        return builder.setTimestamp(((Number) value).longValue()).build();
      case DECIMAL:
        return builder
            .setDecimal(
                Expression.Literal.Decimal.newBuilder()
                    .setValue(encodeDecimal((BigDecimal) value, type))
                    .setPrecision(type.getPrecision())
                    .setScale(type.getScale()))
            .build();
      case ROW:
        List<?> fields = (List<?>) value;
        Expression.Literal.Struct.Builder struct = Expression.Literal.Struct.newBuilder();
        for (int i = 0; i < fields.size(); i++) {
          struct.addFields(toLiteral(fields.get(i), type.getFieldList().get(i).getType()));
        }
        return builder.setStruct(struct).build();
      case ARRAY:
        List<?> elements = (List<?>) value;
        if (elements.isEmpty()) {
          return builder.setEmptyList(typeConverter.toSubstrait(type).getList()).build();
        }
        Expression.Literal.List.Builder list = Expression.Literal.List.newBuilder();
        for (Object element : elements) {
          list.addValues(toLiteral(element, type.getComponentType()));
        }
        return builder.setList(list).build();
      case MAP:
        Map<?, ?> entries = (Map<?, ?>) value;
        if (entries.isEmpty()) {
          return builder.setEmptyMap(typeConverter.toSubstrait(type).getMap()).build();
        }
        Expression.Literal.Map.Builder map = Expression.Literal.Map.newBuilder();
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
          map.addKeyValues(
              Expression.Literal.Map.KeyValue.newBuilder()
                  .setKey(toLiteral(entry.getKey(), type.getKeyType()))
                  .setValue(toLiteral(entry.getValue(), type.getValueType())));
        }
        return builder.setMap(map).build();
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported literal of type %s", type.getFullTypeString()));
    }
  }

  /** Extracts the in-memory value of a Calcite literal. */
  public Object toJavaValue(RexLiteral literal) {
    if (literal.isNull()) {
      return null;
    }
    SqlTypeName typeName = literal.getType().getSqlTypeName();
    switch (typeName) {
      case BOOLEAN:
        return literal.getValueAs(Boolean.class);
      case TINYINT:
        return literal.getValueAs(BigDecimal.class).byteValue();
      case SMALLINT:
        return literal.getValueAs(BigDecimal.class).shortValue();
      case INTEGER:
        return literal.getValueAs(BigDecimal.class).intValue();
      case BIGINT:
        return literal.getValueAs(BigDecimal.class).longValue();
      case REAL:
        return literal.getValueAs(BigDecimal.class).floatValue();
      case FLOAT:
      case DOUBLE:
        return literal.getValueAs(BigDecimal.class).doubleValue();
      case DECIMAL:
        return literal.getValueAs(BigDecimal.class);
      case CHAR:
      case VARCHAR:
        return literal.getValueAs(String.class);
      case BINARY:
      case VARBINARY:
        return literal.getValueAs(byte[].class);
      case DATE:
        return literal.getValueAs(Integer.class);
      case TIMESTAMP:
        return toMicros(literal.getValueAs(TimestampString.class));
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported literal of type %s", literal.getType().getFullTypeString()));
    }
  }

  /** Decodes a Substrait literal into its in-memory value. */
  public Object toJavaValue(Expression.Literal literal) {
    switch (literal.getLiteralTypeCase()) {
      case BOOLEAN:
        return literal.getBoolean();
      case I8:
        return (byte) literal.getI8();
      case I16:
        return (short) literal.getI16();
      case I32:
        return literal.getI32();
      case I64:
        return literal.getI64();
      case FP32:
        return literal.getFp32();
      case FP64:
        return literal.getFp64();
      case STRING:
        return literal.getString();
      case VAR_CHAR:
        return literal.getVarChar().getValue();
      case FIXED_CHAR:
        return literal.getFixedChar();
      case BINARY:
        return literal.getBinary().toByteArray();
      case DATE:
        return literal.getDate();
      case TIMESTAMP:
        return literal.getTimestamp();
      case DECIMAL:
        return decodeDecimal(literal.getDecimal());
      case STRUCT:
        List<Object> fields = new ArrayList<>();
        for (Expression.Literal field : literal.getStruct().getFieldsList()) {
          fields.add(toJavaValue(field));
        }
        return fields;
      case LIST:
        List<Object> elements = new ArrayList<>();
        for (Expression.Literal element : literal.getList().getValuesList()) {
          elements.add(toJavaValue(element));
        }
        return elements;
      case EMPTY_LIST:
        return Collections.emptyList();
      case MAP:
        Map<Object, Object> map = new LinkedHashMap<>();
        for (Expression.Literal.Map.KeyValue entry : literal.getMap().getKeyValuesList()) {
          map.put(toJavaValue(entry.getKey()), toJavaValue(entry.getValue()));
        }
        return map;
      case EMPTY_MAP:
        return Collections.emptyMap();
      case NULL:
        return null;
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported literal kind %s", literal.getLiteralTypeCase()));
    }
  }

  /** Engine type of a Substrait literal. */
  public RelDataType toRelDataType(Expression.Literal literal) {
    switch (literal.getLiteralTypeCase()) {
      case NULL:
        return typeFactory()
            .createTypeWithNullability(typeConverter.toRelDataType(literal.getNull()), true);
      case BOOLEAN:
        return sqlType(SqlTypeName.BOOLEAN, literal);
      case I8:
        return sqlType(SqlTypeName.TINYINT, literal);
      case I16:
        return sqlType(SqlTypeName.SMALLINT, literal);
      case I32:
        return sqlType(SqlTypeName.INTEGER, literal);
      case I64:
        return sqlType(SqlTypeName.BIGINT, literal);
      case FP32:
        return sqlType(SqlTypeName.REAL, literal);
      case FP64:
        return sqlType(SqlTypeName.DOUBLE, literal);
      case STRING:
      case FIXED_CHAR:
        return sqlType(SqlTypeName.VARCHAR, literal);
      case VAR_CHAR:
        return nullable(
            typeFactory().createSqlType(SqlTypeName.VARCHAR, literal.getVarChar().getLength()),
            literal);
      case BINARY:
        return sqlType(SqlTypeName.VARBINARY, literal);
      case DATE:
        return sqlType(SqlTypeName.DATE, literal);
      case TIMESTAMP:
        return sqlType(SqlTypeName.TIMESTAMP, literal);
      case DECIMAL:
        return nullable(
            typeFactory()
                .createSqlType(
                    SqlTypeName.DECIMAL,
                    literal.getDecimal().getPrecision(),
                    literal.getDecimal().getScale()),
            literal);
      case STRUCT:
        List<RelDataType> types = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (Expression.Literal field : literal.getStruct().getFieldsList()) {
          names.add("f" + names.size());
          types.add(toRelDataType(field));
        }
        return nullable(typeFactory().createStructType(types, names), literal);
      case LIST:
        if (literal.getList().getValuesCount() == 0) {
          throw new UnsupportedConstructException("List literal without elements");
        }
        return nullable(
            typeFactory().createArrayType(toRelDataType(literal.getList().getValues(0)), -1),
            literal);
      case EMPTY_LIST:
        return typeConverter.toRelDataType(
            Type.newBuilder().setList(literal.getEmptyList()).build());
      case EMPTY_MAP:
        return typeConverter.toRelDataType(Type.newBuilder().setMap(literal.getEmptyMap()).build());
      case MAP:
        if (literal.getMap().getKeyValuesCount() == 0) {
          throw new UnsupportedConstructException("Map literal without entries");
        }
        Expression.Literal.Map.KeyValue first = literal.getMap().getKeyValues(0);
        return nullable(
            typeFactory()
                .createMapType(toRelDataType(first.getKey()), toRelDataType(first.getValue())),
            literal);
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported literal kind %s", literal.getLiteralTypeCase()));
    }
  }

  /** Builds a Calcite literal from a scalar Substrait literal. */
  public RexNode toRexLiteral(Expression.Literal literal, RexBuilder rexBuilder) {
    RelDataType type = toRelDataType(literal);
    Object value = toJavaValue(literal);
    if (value == null) {
      return rexBuilder.makeNullLiteral(type);
    }
    RelDataType notNull = typeFactory().createTypeWithNullability(type, false);
    switch (type.getSqlTypeName()) {
      case BOOLEAN:
        return rexBuilder.makeLiteral((Boolean) value);
      case TINYINT:
      case SMALLINT:
      case INTEGER:
      case BIGINT:
        return rexBuilder.makeExactLiteral(
            BigDecimal.valueOf(((Number) value).longValue()), notNull);
      case DECIMAL:
        return rexBuilder.makeExactLiteral((BigDecimal) value, notNull);
      case REAL:
        finite((Float) value, "fp32");
        return rexBuilder.makeApproxLiteral(new BigDecimal(value.toString()), notNull);
      case DOUBLE:
        return rexBuilder.makeApproxLiteral(
            BigDecimal.valueOf(finite((Double) value, "fp64")), notNull);
      case VARCHAR:
        return rexBuilder.makeLiteral((String) value);
      case VARBINARY:
        return rexBuilder.makeBinaryLiteral(
            new org.apache.calcite.avatica.util.ByteString((byte[]) value));
      case DATE:
        return rexBuilder.makeDateLiteral(DateString.fromDaysSinceEpoch((Integer) value));
      case TIMESTAMP:
        long micros = (Long) value;
        TimestampString timestamp =
            TimestampString.fromMillisSinceEpoch(Math.floorDiv(micros, 1000L))
                .withNanos((int) (Math.floorMod(micros, 1_000_000L) * 1000L));
        return rexBuilder.makeTimestampLiteral(timestamp, MICROS_PRECISION);
      default:
        throw new UnsupportedConstructException(
            String.format(
                "Literal of kind %s is not supported in expressions",
                literal.getLiteralTypeCase()));
    }
  }

  /** Rejects NaN and infinities, which Calcite literals cannot hold. */
  static double finite(double value, String kind) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new UnsupportedConstructException(
          String.format("Non-finite %s literal %s is not supported", kind, value));
    }
    return value;
  }

  /** Microseconds since the epoch; sub-microsecond digits are truncated. */
  static long toMicros(TimestampString timestamp) {
    String text = timestamp.toString(MICROS_PRECISION);
    long seconds = Math.floorDiv(timestamp.getMillisSinceEpoch(), 1000L);
    return seconds * 1_000_000L + Long.parseLong(text.substring(text.length() - 6));
  }

  static ByteString encodeDecimal(BigDecimal value, RelDataType type) {
    BigDecimal scaled;
    try {
      scaled = value.setScale(type.getScale(), RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      throw new UnsupportedConstructException(
          String.format(
              "Decimal value %s does not fit column type %s without rounding",
              value, type.getFullTypeString()),
          e);
    }
    byte[] bigEndian = scaled.unscaledValue().toByteArray();
    if (bigEndian.length > DECIMAL_BYTES) {
      throw new UnsupportedConstructException("Decimal literal " + value + " exceeds 128 bits");
    }
    byte[] littleEndian = new byte[DECIMAL_BYTES];
    Arrays.fill(littleEndian, bigEndian[0] < 0 ? (byte) 0xFF : 0);
    for (int i = 0; i < bigEndian.length; i++) {
      littleEndian[i] = bigEndian[bigEndian.length - 1 - i];
    }
    return ByteString.copyFrom(littleEndian);
  }

  static BigDecimal decodeDecimal(Expression.Literal.Decimal decimal) {
    byte[] littleEndian = decimal.getValue().toByteArray();
    if (littleEndian.length == 0) {
      return BigDecimal.ZERO.setScale(decimal.getScale());
    }
    byte[] bigEndian = new byte[littleEndian.length];
    for (int i = 0; i < littleEndian.length; i++) {
      bigEndian[i] = littleEndian[littleEndian.length - 1 - i];
    }
    return new BigDecimal(new BigInteger(bigEndian), decimal.getScale());
  }

  private RelDataType sqlType(SqlTypeName typeName, Expression.Literal literal) {
    return nullable(typeFactory().createSqlType(typeName), literal);
  }

  private RelDataType nullable(RelDataType type, Expression.Literal literal) {
    return typeFactory().createTypeWithNullability(type, literal.getNullable());
  }

  private RelDataTypeFactory typeFactory() {
    return typeConverter.getTypeFactory();
  }
}
