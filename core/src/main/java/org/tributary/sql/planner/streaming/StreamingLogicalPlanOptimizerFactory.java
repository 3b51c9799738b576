/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.tributary.sql.planner.optimizer.LogicalPlanOptimizer;
import org.tributary.sql.planner.optimizer.rule.RewriteStreamingJoin;
import org.tributary.sql.planner.streaming.join.JoinCompatibilityChecker;
import org.tributary.sql.planner.streaming.window.WindowDetector;

/** Streaming specified logical plan optimizer. */
@UtilityClass
public class StreamingLogicalPlanOptimizerFactory {

  /** Create the optimizer rewriting plans for the streaming executor. */
  public static LogicalPlanOptimizer create(
      SchemaProvider schemaProvider, WindowDetector windowDetector) {
    return new LogicalPlanOptimizer(
        List.of(
            new RewriteStreamingJoin(
                new JoinCompatibilityChecker(windowDetector), schemaProvider)));
  }
}
