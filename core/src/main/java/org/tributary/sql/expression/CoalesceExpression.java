/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.expression.env.Environment;

/** COALESCE: the first non-NULL argument, or NULL if all arguments are NULL. */
@Getter
@EqualsAndHashCode
public class CoalesceExpression implements Expression {

  private final List<Expression> arguments;

  public CoalesceExpression(List<Expression> arguments) {
    Preconditions.checkArgument(!arguments.isEmpty(), "coalesce requires at least one argument");
    this.arguments = ImmutableList.copyOf(arguments);
  }

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    for (Expression argument : arguments) {
      Object value = argument.valueOf(valueEnv);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Nullable only when every argument is. */
  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    List<QualifiedField> fields =
        arguments.stream().map(arg -> arg.toField(inputSchema)).collect(Collectors.toList());
    RelDataType type =
        SqlTypes.leastRestrictive(
            fields.stream().map(QualifiedField::getType).collect(Collectors.toList()));
    boolean nullable = fields.stream().allMatch(QualifiedField::isNullable);
    return new QualifiedField(null, toString(), SqlTypes.withNullability(type, nullable));
  }

  @Override
  public String toString() {
    return arguments.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", "coalesce(", ")"));
  }
}
