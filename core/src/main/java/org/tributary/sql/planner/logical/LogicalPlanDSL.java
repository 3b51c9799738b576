/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.tuple.Pair;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.planner.streaming.window.WindowType;

/** Logical Plan DSL. */
@UtilityClass
public class LogicalPlanDSL {

  public static LogicalPlan relation(String tableName, PlanSchema schema) {
    return new LogicalRelation(tableName, schema);
  }

  public static LogicalPlan filter(LogicalPlan input, Expression condition) {
    return new LogicalFilter(input, condition);
  }

  public static LogicalPlan project(LogicalPlan input, Expression... projectList) {
    return LogicalProject.create(input, Arrays.asList(projectList));
  }

  public static LogicalPlan window(LogicalPlan input, WindowType window) {
    return new LogicalWindow(input, window);
  }

  /** {@code JOIN ... ON} with SQL null semantics and no residual filter. */
  public static LogicalJoin join(
      LogicalPlan left,
      LogicalPlan right,
      JoinType joinType,
      List<Pair<Expression, Expression>> on) {
    return LogicalJoin.create(left, right, on, null, joinType, JoinConstraint.ON, false);
  }
}
