/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;

/**
 * Planner-defined node wrapping a single input. Passes other than the one that created it treat
 * an extension as opaque and only look at its name and schema.
 */
@EqualsAndHashCode(callSuper = true)
public abstract class LogicalExtension extends LogicalPlan {

  protected LogicalExtension(LogicalPlan input) {
    super(ImmutableList.of(input));
  }

  /** Stable name used in plan explanations and diagnostics. */
  public abstract String getName();

  public LogicalPlan getInput() {
    return child.get(0);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitExtension(this, context);
  }
}
