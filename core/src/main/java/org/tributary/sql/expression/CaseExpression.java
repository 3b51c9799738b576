/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.commons.lang3.tuple.Pair;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.expression.env.Environment;

/**
 * CASE expression. With an operand, each WHEN value is compared to the operand by equality, so a
 * NULL operand matches no branch. Without one, each WHEN is a condition that matches when TRUE.
 * When nothing matches the ELSE result is returned, or NULL if there is none.
 */
@Getter
@EqualsAndHashCode
public class CaseExpression implements Expression {

  private final Expression operand;

  private final List<Pair<Expression, Expression>> whenThens;

  private final Expression elseResult;

  /**
   * Constructor of CaseExpression.
   *
   * @param operand value compared to each WHEN, or null for the searched form
   * @param whenThens WHEN/THEN pairs, at least one
   * @param elseResult ELSE result, may be null
   */
  public CaseExpression(
      Expression operand, List<Pair<Expression, Expression>> whenThens, Expression elseResult) {
    Preconditions.checkArgument(!whenThens.isEmpty(), "CASE requires at least one WHEN");
    this.operand = operand;
    this.whenThens = ImmutableList.copyOf(whenThens);
    this.elseResult = elseResult;
  }

  public Optional<Expression> getOperand() {
    return Optional.ofNullable(operand);
  }

  public Optional<Expression> getElseResult() {
    return Optional.ofNullable(elseResult);
  }

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    Object operandValue = operand == null ? null : operand.valueOf(valueEnv);
    for (Pair<Expression, Expression> whenThen : whenThens) {
      Object whenValue = whenThen.getLeft().valueOf(valueEnv);
      if (matches(operandValue, whenValue)) {
        return whenThen.getRight().valueOf(valueEnv);
      }
    }
    return elseResult == null ? null : elseResult.valueOf(valueEnv);
  }

  private boolean matches(Object operandValue, Object whenValue) {
    if (operand == null) {
      return Boolean.TRUE.equals(whenValue);
    }
    return operandValue != null
        && whenValue != null
        && ComparisonExpression.compare(operandValue, whenValue) == 0;
  }

  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    List<RelDataType> resultTypes = new ArrayList<>();
    for (Pair<Expression, Expression> whenThen : whenThens) {
      resultTypes.add(whenThen.getRight().toField(inputSchema).getType());
    }
    if (elseResult != null) {
      resultTypes.add(elseResult.toField(inputSchema).getType());
    }
    RelDataType type = SqlTypes.leastRestrictive(resultTypes);
    if (elseResult == null) {
      type = SqlTypes.withNullability(type, true);
    }
    return new QualifiedField(null, toString(), type);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("CASE");
    if (operand != null) {
      builder.append(' ').append(operand);
    }
    whenThens.forEach(
        whenThen ->
            builder
                .append(" WHEN ")
                .append(whenThen.getLeft())
                .append(" THEN ")
                .append(whenThen.getRight()));
    if (elseResult != null) {
      builder.append(" ELSE ").append(elseResult);
    }
    return builder.append(" END").toString();
  }
}
