/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.expression.Expression;

/** Logical Filter represent the filter relation. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalFilter extends LogicalPlan {

  @Getter private final Expression condition;

  /**
   * Constructor of LogicalFilter.
   *
   * @throws org.tributary.sql.exception.PlanConstructionException if the condition does not
   *     resolve against the input
   */
  public LogicalFilter(LogicalPlan input, Expression condition) {
    super(ImmutableList.of(input));
    condition.toField(input.getSchema());
    this.condition = condition;
  }

  public LogicalPlan getInput() {
    return child.get(0);
  }

  @Override
  public PlanSchema getSchema() {
    return getInput().getSchema();
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    return sameChildren(childPlans) ? this : new LogicalFilter(childPlans.get(0), condition);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFilter(this, context);
  }
}
