/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.data.type;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rel.type.RelDataTypeSystem;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.apache.calcite.sql.type.SqlTypeName;
import org.tributary.sql.exception.PlanConstructionException;

/** Shared Calcite type factory and helpers for field types. */
@UtilityClass
public class SqlTypes {

  public static final RelDataTypeFactory TYPE_FACTORY =
      new SqlTypeFactoryImpl(RelDataTypeSystem.DEFAULT);

  /** Non-nullable type of the given SQL type name. */
  public static RelDataType of(SqlTypeName typeName) {
    return TYPE_FACTORY.createSqlType(typeName);
  }

  /** Nullable type of the given SQL type name. */
  public static RelDataType nullable(SqlTypeName typeName) {
    return withNullability(of(typeName), true);
  }

  public static RelDataType withNullability(RelDataType type, boolean nullable) {
    if (type.isNullable() == nullable) {
      return type;
    }
    return TYPE_FACTORY.createTypeWithNullability(type, nullable);
  }

  public static RelDataType booleanType(boolean nullable) {
    return withNullability(of(SqlTypeName.BOOLEAN), nullable);
  }

  /**
   * The type all of the given types can be converted to. The result is nullable if any input is.
   *
   * @throws PlanConstructionException if the types have no common type
   */
  public static RelDataType leastRestrictive(List<RelDataType> types) {
    RelDataType type = TYPE_FACTORY.leastRestrictive(types);
    if (type == null) {
      throw new PlanConstructionException("No common type for " + types);
    }
    return type;
  }
}
