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

/**
 * Named expression that represents expression with name, optionally under a relation qualifier.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class NamedExpression implements Expression {

  /** Relation qualifier of the output field, may be null. */
  private final String relation;

  /** Expression name. */
  private final String name;

  /** Expression that being named. */
  private final Expression delegated;

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    return delegated.valueOf(valueEnv);
  }

  /** The delegated field renamed; type and metadata are kept. */
  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    QualifiedField field = delegated.toField(inputSchema);
    return new QualifiedField(relation, name, field.getType(), field.getMetadata());
  }

  public Column getColumn() {
    return new Column(relation, name);
  }

  @Override
  public String toString() {
    return delegated + " AS " + getColumn().flatName();
  }
}
