/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.join;

import static org.tributary.sql.planner.streaming.StreamingFields.UPDATING_META_FIELD;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.tributary.sql.exception.MissingEquiJoinException;
import org.tributary.sql.exception.UnsupportedJoinException;
import org.tributary.sql.exception.UnsupportedUpdatingInputException;
import org.tributary.sql.planner.logical.JoinConstraint;
import org.tributary.sql.planner.logical.JoinType;
import org.tributary.sql.planner.logical.LogicalJoin;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.streaming.window.WindowDetector;
import org.tributary.sql.planner.streaming.window.WindowType;

/**
 * Decides whether a join can run on the streaming executor, and if so whether it is an instant
 * join (both inputs share a non-session window) or an updating join (neither input is windowed).
 */
@Log4j2
@RequiredArgsConstructor
public class JoinCompatibilityChecker {

  private final WindowDetector windowDetector;

  /**
   * Run every check in order: windowing, join constraint, updating inputs, equijoin condition.
   *
   * @return true for an instant join, false for an updating join
   * @throws org.tributary.sql.exception.PlanningException naming the first failed check
   */
  public boolean check(LogicalJoin join) {
    boolean instant = checkWindowing(join);
    checkConstraint(join);
    checkUpdating(join.getLeft(), join.getRight());
    checkEquiJoin(join, instant);
    log.debug("Join classified as {}", instant ? "instant" : "updating");
    return instant;
  }

  /**
   * Compare the windows of both inputs.
   *
   * @return true when both inputs share a non-session window, false when neither is windowed
   * @throws UnsupportedJoinException for mixed, mismatched or session windows, and for non-inner
   *     joins without windows
   */
  public boolean checkWindowing(LogicalJoin join) {
    Optional<WindowType> leftWindow = windowDetector.windowOf(join.getLeft());
    Optional<WindowType> rightWindow = windowDetector.windowOf(join.getRight());

    if (leftWindow.isEmpty() && rightWindow.isEmpty()) {
      if (join.getJoinType() != JoinType.INNER) {
        throw new UnsupportedJoinException("can't handle non-inner joins without windows");
      }
      return false;
    }
    if (leftWindow.isEmpty()) {
      throw new UnsupportedJoinException(
          "can't handle mixed windowing between left (non-windowed) and right (windowed)");
    }
    if (rightWindow.isEmpty()) {
      throw new UnsupportedJoinException(
          "can't handle mixed windowing between left (windowed) and right (non-windowed)");
    }
    if (!leftWindow.get().equals(rightWindow.get())) {
      throw new UnsupportedJoinException(
          String.format(
              "can't handle mixed windowing between left and right: %s vs %s",
              leftWindow.get(), rightWindow.get()));
    }
    if (leftWindow.get().isSession()) {
      throw new UnsupportedJoinException("can't handle session windows in joins");
    }
    return true;
  }

  /** Only {@code ON} joins with SQL null semantics are supported. */
  public void checkConstraint(LogicalJoin join) {
    if (join.getJoinConstraint() != JoinConstraint.ON) {
      throw new UnsupportedJoinException("can't handle join constraint other than ON");
    }
    if (join.isNullEqualsNull()) {
      throw new UnsupportedJoinException("can't handle joins where null equals null");
    }
  }

  /** Neither input may emit updates. */
  public void checkUpdating(LogicalPlan left, LogicalPlan right) {
    if (left.getSchema().hasColumnWithUnqualifiedName(UPDATING_META_FIELD)) {
      throw new UnsupportedUpdatingInputException("can't handle updating left side of join");
    }
    if (right.getSchema().hasColumnWithUnqualifiedName(UPDATING_META_FIELD)) {
      throw new UnsupportedUpdatingInputException("can't handle updating right side of join");
    }
  }

  /** Updating joins keep state per key, so they need at least one equality condition. */
  public void checkEquiJoin(LogicalJoin join, boolean instant) {
    if (!instant && join.getOn().isEmpty()) {
      throw new MissingEquiJoinException("updating joins must include an equijoin condition");
    }
  }
}
