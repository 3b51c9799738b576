/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import lombok.extern.log4j.Log4j2;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.optimizer.LogicalPlanOptimizer;
import org.tributary.sql.planner.streaming.window.WindowDetectingVisitor;
import org.tributary.sql.planner.streaming.window.WindowDetector;

/**
 * Rewrites every join of a logical plan into a streaming join, bottom up. Plans without joins are
 * returned unchanged, and so are plans that were already rewritten.
 */
@Log4j2
public class StreamingJoinPlanner {

  private final LogicalPlanOptimizer optimizer;

  public StreamingJoinPlanner(SchemaProvider schemaProvider) {
    this(schemaProvider, new WindowDetectingVisitor());
  }

  public StreamingJoinPlanner(SchemaProvider schemaProvider, WindowDetector windowDetector) {
    this.optimizer = StreamingLogicalPlanOptimizerFactory.create(schemaProvider, windowDetector);
  }

  /**
   * Rewrite the plan.
   *
   * @param plan logical plan produced by the analyzer
   * @return the rewritten plan
   * @throws org.tributary.sql.exception.PlanningException if any join cannot be rewritten; no
   *     part of the plan is rewritten in that case
   */
  public LogicalPlan rewrite(LogicalPlan plan) {
    LogicalPlan rewritten = optimizer.optimize(plan);
    if (rewritten != plan) {
      log.info("Rewrote joins for streaming execution");
    }
    return rewritten;
  }
}
