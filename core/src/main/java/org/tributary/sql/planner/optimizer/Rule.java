/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.optimizer;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import org.tributary.sql.planner.logical.LogicalPlan;

/** Optimization Rule. */
public interface Rule<T extends LogicalPlan> {

  /** Get the {@link Pattern}. */
  Pattern<T> pattern();

  /**
   * Apply the Rule to the LogicalPlan.
   *
   * @param plan LogicalPlan which match the Pattern.
   * @param captures A list of LogicalPlan which are captured by the Pattern.
   * @return the transformed LogicalPlan.
   */
  LogicalPlan apply(T plan, Captures captures);
}
