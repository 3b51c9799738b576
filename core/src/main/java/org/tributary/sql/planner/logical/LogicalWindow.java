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
import org.tributary.sql.planner.streaming.window.WindowType;

/** Assigns the rows of its input to a time window. The schema is the input's. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalWindow extends LogicalPlan {

  @Getter private final WindowType window;

  public LogicalWindow(LogicalPlan input, WindowType window) {
    super(ImmutableList.of(input));
    this.window = window;
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
    return sameChildren(childPlans) ? this : new LogicalWindow(childPlans.get(0), window);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitWindow(this, context);
  }
}
