/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.window;

import java.util.Optional;
import org.tributary.sql.planner.logical.LogicalPlan;

/** Reports the window a plan's rows are grouped by. */
public interface WindowDetector {

  /**
   * Window of the plan's output.
   *
   * @param plan plan to inspect, possibly containing already rewritten streaming joins
   * @return the window, or empty if the output is not windowed
   */
  Optional<WindowType> windowOf(LogicalPlan plan);
}
