/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import java.math.BigDecimal;
import java.util.function.IntPredicate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.exception.ExpressionEvaluationException;
import org.tributary.sql.expression.env.Environment;

/** Binary comparison. Evaluates to NULL when either operand is NULL. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ComparisonExpression implements Expression {

  /** Comparison operator. */
  @RequiredArgsConstructor
  public enum Operator {
    EQUAL("=", cmp -> cmp == 0),
    NOT_EQUAL("<>", cmp -> cmp != 0),
    LESS_THAN("<", cmp -> cmp < 0),
    LESS_THAN_OR_EQUAL("<=", cmp -> cmp <= 0),
    GREATER_THAN(">", cmp -> cmp > 0),
    GREATER_THAN_OR_EQUAL(">=", cmp -> cmp >= 0);

    @Getter private final String symbol;

    private final IntPredicate predicate;

    boolean test(int comparison) {
      return predicate.test(comparison);
    }
  }

  private final Expression left;

  private final Operator operator;

  private final Expression right;

  @Override
  public Object valueOf(Environment<Column, Object> valueEnv) {
    Object leftValue = left.valueOf(valueEnv);
    Object rightValue = right.valueOf(valueEnv);
    if (leftValue == null || rightValue == null) {
      return null;
    }
    return operator.test(compare(leftValue, rightValue));
  }

  @Override
  public QualifiedField toField(PlanSchema inputSchema) {
    boolean nullable =
        left.toField(inputSchema).isNullable() || right.toField(inputSchema).isNullable();
    return new QualifiedField(null, toString(), SqlTypes.booleanType(nullable));
  }

  /**
   * Compare two non-null values. Numbers of different classes are compared by value, anything
   * else must be mutually {@link Comparable}.
   */
  @SuppressWarnings("unchecked")
  static int compare(Object left, Object right) {
    if (left instanceof Number
        && right instanceof Number
        && !left.getClass().equals(right.getClass())) {
      return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    throw new ExpressionEvaluationException(
        String.format(
            "can't compare %s of type %s with %s of type %s",
            left, left.getClass().getSimpleName(), right, right.getClass().getSimpleName()));
  }

  @Override
  public String toString() {
    return left + " " + operator.getSymbol() + " " + right;
  }
}
