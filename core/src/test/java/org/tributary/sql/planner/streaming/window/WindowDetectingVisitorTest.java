/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.tributary.sql.planner.streaming.StreamingTestPlans.joinOnKey;
import static org.tributary.sql.planner.streaming.StreamingTestPlans.source;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.tributary.sql.expression.DSL;
import org.tributary.sql.planner.logical.JoinType;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalPlanDSL;
import org.tributary.sql.planner.logical.LogicalStreamingJoin;
import org.tributary.sql.planner.streaming.join.KeyProjectionBuilder;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WindowDetectingVisitorTest {

  private static final WindowType TUMBLING = WindowType.tumbling(Duration.ofMinutes(1));

  private final WindowDetectingVisitor detector = new WindowDetectingVisitor();

  @Test
  void relation_has_no_window() {
    assertEquals(Optional.empty(), detector.windowOf(source("a")));
  }

  @Test
  void window_propagates_through_filter_and_project() {
    LogicalPlan plan =
        LogicalPlanDSL.project(
            LogicalPlanDSL.filter(
                LogicalPlanDSL.window(source("a"), TUMBLING),
                DSL.less(DSL.ref("a", "k"), DSL.literal(5L))),
            DSL.ref("a", "k"));

    assertEquals(Optional.of(TUMBLING), detector.windowOf(plan));
  }

  @Test
  void window_propagates_through_key_calculation() {
    LogicalPlan keyed =
        KeyProjectionBuilder.build(
            LogicalPlanDSL.window(source("a"), TUMBLING), List.of(DSL.ref("a", "k")), "left");

    assertEquals(Optional.of(TUMBLING), detector.windowOf(keyed));
  }

  @Test
  void join_reports_window_shared_by_both_sides() {
    LogicalPlan join =
        joinOnKey(
            LogicalPlanDSL.window(source("a"), TUMBLING),
            "a",
            LogicalPlanDSL.window(source("b"), TUMBLING),
            "b",
            JoinType.INNER);

    assertEquals(Optional.of(TUMBLING), detector.windowOf(join));
  }

  @Test
  void join_of_different_windows_has_no_window() {
    LogicalPlan join =
        joinOnKey(
            LogicalPlanDSL.window(source("a"), TUMBLING),
            "a",
            LogicalPlanDSL.window(source("b"), WindowType.tumbling(Duration.ofMinutes(2))),
            "b",
            JoinType.INNER);

    assertEquals(Optional.empty(), detector.windowOf(join));
  }

  @Test
  void streaming_join_reports_window_of_rewritten_join() {
    LogicalPlan join =
        joinOnKey(
            LogicalPlanDSL.window(source("a"), TUMBLING),
            "a",
            LogicalPlanDSL.window(source("b"), TUMBLING),
            "b",
            JoinType.INNER);

    assertEquals(
        Optional.of(TUMBLING), detector.windowOf(new LogicalStreamingJoin(join, true, null)));
  }

  @Test
  void window_closest_to_output_wins() {
    WindowType sliding = WindowType.sliding(Duration.ofMinutes(5), Duration.ofMinutes(1));
    LogicalPlan plan =
        LogicalPlanDSL.window(LogicalPlanDSL.window(source("a"), TUMBLING), sliding);

    assertEquals(Optional.of(sliding), detector.windowOf(plan));
  }
}
