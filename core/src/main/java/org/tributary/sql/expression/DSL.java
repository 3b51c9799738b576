/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.commons.lang3.tuple.Pair;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.expression.ComparisonExpression.Operator;

/** Static factories for resolved expressions. */
@UtilityClass
public class DSL {

  public static ReferenceExpression ref(String relation, String name) {
    return new ReferenceExpression(Column.of(relation, name));
  }

  public static ReferenceExpression ref(String name) {
    return new ReferenceExpression(Column.unqualified(name));
  }

  public static ReferenceExpression ref(Column column) {
    return new ReferenceExpression(column);
  }

  public static LiteralExpression literal(Object value, RelDataType type) {
    return new LiteralExpression(value, type);
  }

  public static LiteralExpression literal(boolean value) {
    return new LiteralExpression(value, SqlTypes.of(SqlTypeName.BOOLEAN));
  }

  public static LiteralExpression literal(long value) {
    return new LiteralExpression(value, SqlTypes.of(SqlTypeName.BIGINT));
  }

  public static NamedExpression named(String relation, String name, Expression expression) {
    return new NamedExpression(relation, name, expression);
  }

  public static NamedExpression named(String name, Expression expression) {
    return new NamedExpression(null, name, expression);
  }

  public static ComparisonExpression equal(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.EQUAL, right);
  }

  public static ComparisonExpression notEqual(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.NOT_EQUAL, right);
  }

  public static ComparisonExpression less(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.LESS_THAN, right);
  }

  public static ComparisonExpression lte(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.LESS_THAN_OR_EQUAL, right);
  }

  public static ComparisonExpression greater(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.GREATER_THAN, right);
  }

  public static ComparisonExpression gte(Expression left, Expression right) {
    return new ComparisonExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
  }

  public static Pair<Expression, Expression> when(Expression when, Expression then) {
    return Pair.of(when, then);
  }

  /** CASE operand WHEN ... THEN ... ELSE elseResult END; operand and elseResult may be null. */
  public static CaseExpression caseWhen(
      Expression operand, List<Pair<Expression, Expression>> whenThens, Expression elseResult) {
    return new CaseExpression(operand, whenThens, elseResult);
  }

  public static CoalesceExpression coalesce(Expression... arguments) {
    return new CoalesceExpression(Arrays.asList(arguments));
  }
}
