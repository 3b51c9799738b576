/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.tuple.Pair;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.expression.Expression;

/**
 * Logical join of two inputs on a list of equality pairs plus an optional residual filter. The
 * left expression of each {@code on} pair is evaluated against the left input and the right one
 * against the right input.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalJoin extends LogicalPlan {

  @Getter private final List<Pair<Expression, Expression>> on;

  private final Expression filter;

  @Getter private final JoinType joinType;

  @Getter private final JoinConstraint joinConstraint;

  @Getter private final boolean nullEqualsNull;

  private final PlanSchema schema;

  private LogicalJoin(
      LogicalPlan left,
      LogicalPlan right,
      List<Pair<Expression, Expression>> on,
      Expression filter,
      JoinType joinType,
      JoinConstraint joinConstraint,
      boolean nullEqualsNull,
      PlanSchema schema) {
    super(ImmutableList.of(left, right));
    this.on = ImmutableList.copyOf(on);
    this.filter = filter;
    this.joinType = joinType;
    this.joinConstraint = joinConstraint;
    this.nullEqualsNull = nullEqualsNull;
    this.schema = schema;
  }

  /**
   * Create a join whose schema is derived from its inputs and join type.
   *
   * @param filter residual predicate, may be null
   * @throws org.tributary.sql.exception.PlanConstructionException if the joined schema has
   *     duplicate or ambiguous field names
   */
  public static LogicalJoin create(
      LogicalPlan left,
      LogicalPlan right,
      List<Pair<Expression, Expression>> on,
      Expression filter,
      JoinType joinType,
      JoinConstraint joinConstraint,
      boolean nullEqualsNull) {
    return new LogicalJoin(
        left,
        right,
        on,
        filter,
        joinType,
        joinConstraint,
        nullEqualsNull,
        deriveSchema(left.getSchema(), right.getSchema(), joinType));
  }

  /**
   * Schema of a join of the two input schemas. Outer joins make the fields of the side that may
   * be missing nullable; semi and anti joins keep only one side. Metadata of the right schema
   * overrides the left on conflicting keys.
   */
  public static PlanSchema deriveSchema(PlanSchema left, PlanSchema right, JoinType joinType) {
    List<QualifiedField> fields = new ArrayList<>();
    switch (joinType) {
      case INNER:
        fields.addAll(left.getFields());
        fields.addAll(right.getFields());
        break;
      case LEFT_OUTER:
        fields.addAll(left.getFields());
        addNullable(fields, right);
        break;
      case RIGHT_OUTER:
        addNullable(fields, left);
        fields.addAll(right.getFields());
        break;
      case FULL_OUTER:
        addNullable(fields, left);
        addNullable(fields, right);
        break;
      case LEFT_SEMI:
      case LEFT_ANTI:
        fields.addAll(left.getFields());
        break;
      case RIGHT_SEMI:
      case RIGHT_ANTI:
        fields.addAll(right.getFields());
        break;
      default:
        throw new IllegalStateException("Unexpected join type: " + joinType);
    }
    Map<String, String> metadata = new HashMap<>(left.getMetadata());
    metadata.putAll(right.getMetadata());
    return new PlanSchema(fields, metadata);
  }

  private static void addNullable(List<QualifiedField> fields, PlanSchema schema) {
    schema.getFields().forEach(field -> fields.add(field.withNullable(true)));
  }

  public LogicalPlan getLeft() {
    return child.get(0);
  }

  public LogicalPlan getRight() {
    return child.get(1);
  }

  public Optional<Expression> getFilter() {
    return Optional.ofNullable(filter);
  }

  @Override
  public PlanSchema getSchema() {
    return schema;
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    if (sameChildren(childPlans)) {
      return this;
    }
    return create(
        childPlans.get(0),
        childPlans.get(1),
        on,
        filter,
        joinType,
        joinConstraint,
        nullEqualsNull);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitJoin(this, context);
  }
}
