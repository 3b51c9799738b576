/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.expression.env.Environment;

/** Reference to a column of the input plan. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ReferenceExpression implements Expression {

  private final Column column;

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    return valueEnv.resolve(column);
  }

  /** The referenced field itself, keeping qualifier, type and metadata. */
  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    return inputSchema.fieldFor(column);
  }

  @Override
  public String toString() {
    return column.flatName();
  }
}
