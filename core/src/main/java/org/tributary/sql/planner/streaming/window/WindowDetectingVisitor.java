/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.window;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tributary.sql.planner.logical.LogicalJoin;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalPlanNodeVisitor;
import org.tributary.sql.planner.logical.LogicalRelation;
import org.tributary.sql.planner.logical.LogicalStreamingJoin;
import org.tributary.sql.planner.logical.LogicalWindow;

/**
 * Detects the window of a plan by walking down to the nearest window assignment.
 *
 * <p>Rows keep their window through filters, projections and key calculations. A join is
 * windowed when both inputs share the same window, and a rewritten streaming join reports the
 * window of the join it wraps.
 */
public class WindowDetectingVisitor extends LogicalPlanNodeVisitor<Optional<WindowType>, Void>
    implements WindowDetector {

  @Override
  public Optional<WindowType> windowOf(LogicalPlan plan) {
    return plan.accept(this, null);
  }

  @Override
  public Optional<WindowType> visitRelation(LogicalRelation plan, Void context) {
    return Optional.empty();
  }

  @Override
  public Optional<WindowType> visitWindow(LogicalWindow plan, Void context) {
    return Optional.of(plan.getWindow());
  }

  @Override
  public Optional<WindowType> visitJoin(LogicalJoin plan, Void context) {
    return commonWindow(plan.getChild());
  }

  @Override
  public Optional<WindowType> visitStreamingJoin(LogicalStreamingJoin plan, Void context) {
    return plan.getRewrittenJoin().accept(this, context);
  }

  @Override
  public Optional<WindowType> visitNode(LogicalPlan plan, Void context) {
    return commonWindow(plan.getChild());
  }

  /** The window all inputs share, empty for a leaf or when the inputs disagree. */
  private Optional<WindowType> commonWindow(List<LogicalPlan> inputs) {
    if (inputs.isEmpty()) {
      return Optional.empty();
    }
    List<Optional<WindowType>> windows =
        inputs.stream().map(input -> input.accept(this, null)).collect(Collectors.toList());
    Optional<WindowType> first = windows.get(0);
    return windows.stream().allMatch(first::equals) ? first : Optional.empty();
  }
}
