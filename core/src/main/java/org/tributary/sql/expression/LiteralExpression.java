/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.calcite.rel.type.RelDataType;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.expression.env.Environment;

/** Literal Expression. A null value is the typed SQL NULL. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class LiteralExpression implements Expression {

  private final Object value;

  private final RelDataType type;

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    return value;
  }

  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    return new QualifiedField(null, toString(), type);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "NULL";
    }
    return value instanceof String ? "'" + value + "'" : String.valueOf(value);
  }
}
