/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.type;

import io.substrait.proto.NamedStruct;
import io.substrait.proto.Type;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rel.type.RelDataTypeField;
import org.apache.calcite.sql.type.SqlTypeName;
import org.opensearch.substrait.exception.PlanStructureException;
import org.opensearch.substrait.exception.UnsupportedConstructException;

/**
 * Converts between Calcite {@link RelDataType}s and Substrait {@link Type} messages.
 *
 * <p>Row types map to {@link NamedStruct}s. Substrait lists the field names of a named struct
 * depth-first, so the names of nested struct fields follow the name of the field holding them.
 */
@RequiredArgsConstructor
public class TypeConverter {

  @Getter private final RelDataTypeFactory typeFactory;

  /** Converts a Calcite type to a Substrait type, carrying its nullability. */
  public Type toSubstrait(RelDataType type) {
    Type.Nullability n = nullability(type.isNullable());
    SqlTypeName typeName = type.getSqlTypeName();
    switch (typeName) {
      case BOOLEAN:
        return Type.newBuilder().setBool(Type.Boolean.newBuilder().setNullability(n)).build();
      case TINYINT:
        return Type.newBuilder().setI8(Type.I8.newBuilder().setNullability(n)).build();
      case SMALLINT:
        return Type.newBuilder().setI16(Type.I16.newBuilder().setNullability(n)).build();
      case INTEGER:
        return Type.newBuilder().setI32(Type.I32.newBuilder().setNullability(n)).build();
      case BIGINT:
        return Type.newBuilder().setI64(Type.I64.newBuilder().setNullability(n)).build();
      case REAL:
        return Type.newBuilder().setFp32(Type.FP32.newBuilder().setNullability(n)).build();
      case FLOAT:
      case DOUBLE:
        return Type.newBuilder().setFp64(Type.FP64.newBuilder().setNullability(n)).build();
      case CHAR:
      case VARCHAR:
        return Type.newBuilder().setString(Type.String.newBuilder().setNullability(n)).build();
      case BINARY:
      case VARBINARY:
        return Type.newBuilder().setBinary(Type.Binary.newBuilder().setNullability(n)).build();
      case DATE:
        return Type.newBuilder().setDate(Type.Date.newBuilder().setNullability(n)).build();
      case TIMESTAMP:
        return Type.newBuilder()
            .setTimestamp(Type.Timestamp.newBuilder().setNullability(n))
            .build();
      case DECIMAL:
        return Type.newBuilder()
            .setDecimal(
                Type.Decimal.newBuilder()
                    .setPrecision(type.getPrecision())
                    .setScale(type.getScale())
                    .setNullability(n))
            .build();
      case ARRAY:
        return Type.newBuilder()
            .setList(
                Type.List.newBuilder()
                    .setType(toSubstrait(type.getComponentType()))
                    .setNullability(n))
            .build();
      case MAP:
        return Type.newBuilder()
            .setMap(
                Type.Map.newBuilder()
                    .setKey(toSubstrait(type.getKeyType()))
                    .setValue(toSubstrait(type.getValueType()))
                    .setNullability(n))
            .build();
      case ROW:
        return Type.newBuilder().setStruct(toStruct(type, n)).build();
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported type %s", type.getFullTypeString()));
    }
  }

  /** Converts a Substrait type to a Calcite type. Anonymous struct fields are named f0, f1, .. */
  public RelDataType toRelDataType(Type type) {
    return toRelDataType(type, null);
  }

  /** Converts a Calcite row type to a Substrait named struct. */
  public NamedStruct toNamedStruct(RelDataType rowType) {
    if (!rowType.isStruct()) {
      throw new UnsupportedConstructException(
          String.format("Expected a row type but got %s", rowType.getFullTypeString()));
    }
    List<String> names = new ArrayList<>();
    collectNames(rowType, names);
    return NamedStruct.newBuilder()
        .addAllNames(names)
        .setStruct(toStruct(rowType, Type.Nullability.NULLABILITY_REQUIRED))
        .build();
  }

  /** Converts a Substrait named struct to a Calcite row type. */
  public RelDataType toRowType(NamedStruct namedStruct) {
    Iterator<String> names = namedStruct.getNamesList().iterator();
    RelDataType rowType =
        toRelDataType(Type.newBuilder().setStruct(namedStruct.getStruct()).build(), names);
    if (names.hasNext()) {
      throw new PlanStructureException(
          String.format(
              "Named struct declares %d names but its struct has fewer fields",
              namedStruct.getNamesCount()));
    }
    return typeFactory.createTypeWithNullability(rowType, false);
  }

  /** Returns the short name of a type as used in compound function signatures. */
  public static String signatureName(Type type) {
    switch (type.getKindCase()) {
      case BOOL:
        return "bool";
      case I8:
        return "i8";
      case I16:
        return "i16";
      case I32:
        return "i32";
      case I64:
        return "i64";
      case FP32:
        return "fp32";
      case FP64:
        return "fp64";
      case STRING:
        return "str";
      case BINARY:
        return "vbin";
      case TIMESTAMP:
        return "ts";
      case TIMESTAMP_TZ:
        return "tstz";
      case DATE:
        return "date";
      case TIME:
        return "time";
      case INTERVAL_YEAR:
        return "iyear";
      case INTERVAL_DAY:
        return "iday";
      case UUID:
        return "uuid";
      case FIXED_CHAR:
        return "fchar";
      case VARCHAR:
        return "vchar";
      case FIXED_BINARY:
        return "fbin";
      case DECIMAL:
        return "dec";
      case PRECISION_TIMESTAMP:
        return "pts";
      case PRECISION_TIMESTAMP_TZ:
        return "ptstz";
      case STRUCT:
        return "struct";
      case LIST:
        return "list";
      case MAP:
        return "map";
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported type %s", type.getKindCase()));
    }
  }

  private RelDataType toRelDataType(Type type, Iterator<String> names) {
    switch (type.getKindCase()) {
      case BOOL:
        return sqlType(SqlTypeName.BOOLEAN, type.getBool().getNullability());
      case I8:
        return sqlType(SqlTypeName.TINYINT, type.getI8().getNullability());
      case I16:
        return sqlType(SqlTypeName.SMALLINT, type.getI16().getNullability());
      case I32:
        return sqlType(SqlTypeName.INTEGER, type.getI32().getNullability());
      case I64:
        return sqlType(SqlTypeName.BIGINT, type.getI64().getNullability());
      case FP32:
        return sqlType(SqlTypeName.REAL, type.getFp32().getNullability());
      case FP64:
        return sqlType(SqlTypeName.DOUBLE, type.getFp64().getNullability());
      case STRING:
        return sqlType(SqlTypeName.VARCHAR, type.getString().getNullability());
      case VARCHAR:
        return withNullability(
            typeFactory.createSqlType(SqlTypeName.VARCHAR, type.getVarchar().getLength()),
            type.getVarchar().getNullability());
      case BINARY:
        return sqlType(SqlTypeName.VARBINARY, type.getBinary().getNullability());
      case DATE:
        return sqlType(SqlTypeName.DATE, type.getDate().getNullability());
      case TIMESTAMP:
        return sqlType(SqlTypeName.TIMESTAMP, type.getTimestamp().getNullability());
      case DECIMAL:
        Type.Decimal decimal = type.getDecimal();
        return withNullability(
            typeFactory.createSqlType(
                SqlTypeName.DECIMAL, decimal.getPrecision(), decimal.getScale()),
            decimal.getNullability());
      case LIST:
        return withNullability(
            typeFactory.createArrayType(toRelDataType(type.getList().getType(), null), -1),
            type.getList().getNullability());
      case MAP:
        return withNullability(
            typeFactory.createMapType(
                toRelDataType(type.getMap().getKey(), null),
                toRelDataType(type.getMap().getValue(), null)),
            type.getMap().getNullability());
      case STRUCT:
        return withNullability(
            toStructType(type.getStruct(), names), type.getStruct().getNullability());
      default:
        throw new UnsupportedConstructException(
            String.format("Unsupported type %s", type.getKindCase()));
    }
  }

  private RelDataType toStructType(Type.Struct struct, Iterator<String> names) {
    List<String> fieldNames = new ArrayList<>();
    List<RelDataType> fieldTypes = new ArrayList<>();
    for (int i = 0; i < struct.getTypesCount(); i++) {
      if (names == null) {
        fieldNames.add("f" + i);
      } else if (names.hasNext()) {
        fieldNames.add(names.next());
      } else {
        throw new PlanStructureException("Named struct has fewer names than struct fields");
      }
      Type fieldType = struct.getTypes(i);
      fieldTypes.add(
          toRelDataType(fieldType, fieldType.getKindCase() == Type.KindCase.STRUCT ? names : null));
    }
    return typeFactory.createStructType(fieldTypes, fieldNames);
  }

  private Type.Struct toStruct(RelDataType rowType, Type.Nullability nullability) {
    Type.Struct.Builder struct = Type.Struct.newBuilder().setNullability(nullability);
    for (RelDataTypeField field : rowType.getFieldList()) {
      struct.addTypes(toSubstrait(field.getType()));
    }
    return struct.build();
  }

  private static void collectNames(RelDataType rowType, List<String> names) {
    for (RelDataTypeField field : rowType.getFieldList()) {
      names.add(field.getName());
      if (field.getType().isStruct()) {
        collectNames(field.getType(), names);
      }
    }
  }

  private RelDataType sqlType(SqlTypeName typeName, Type.Nullability nullability) {
    return withNullability(typeFactory.createSqlType(typeName), nullability);
  }

  private RelDataType withNullability(RelDataType type, Type.Nullability nullability) {
    return typeFactory.createTypeWithNullability(
        type, nullability != Type.Nullability.NULLABILITY_REQUIRED);
  }

  private static Type.Nullability nullability(boolean nullable) {
    return nullable
        ? Type.Nullability.NULLABILITY_NULLABLE
        : Type.Nullability.NULLABILITY_REQUIRED;
  }
}
