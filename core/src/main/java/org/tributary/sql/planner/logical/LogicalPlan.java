/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.tributary.sql.data.schema.PlanSchema;

/**
 * The abstract base class for all the Logical Plan node. Nodes are immutable and exclusively own
 * their children; rewrites build new nodes instead of mutating existing ones.
 */
@EqualsAndHashCode
public abstract class LogicalPlan {

  @Getter protected final List<LogicalPlan> child;

  protected LogicalPlan(List<LogicalPlan> child) {
    this.child = ImmutableList.copyOf(child);
  }

  /** Output schema of this node. */
  public abstract PlanSchema getSchema();

  /**
   * Rebuild this node on top of the given children. Returns this node when the children are the
   * same instances it already has.
   */
  public abstract LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans);

  /**
   * Accept the {@link LogicalPlanNodeVisitor}.
   *
   * @param visitor visitor.
   * @param context visitor context.
   * @param <R> returned object type.
   * @param <C> context type.
   * @return returned object.
   */
  public abstract <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context);

  protected boolean sameChildren(List<LogicalPlan> childPlans) {
    if (childPlans.size() != child.size()) {
      return false;
    }
    for (int i = 0; i < child.size(); i++) {
      if (childPlans.get(i) != child.get(i)) {
        return false;
      }
    }
    return true;
  }
}
