/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.optimizer;

import static com.facebook.presto.matching.Pattern.typeOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.tributary.sql.planner.streaming.StreamingTestPlans.source;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.tributary.sql.expression.DSL;
import org.tributary.sql.planner.logical.LogicalFilter;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalPlanDSL;
import org.tributary.sql.planner.logical.LogicalProject;
import org.tributary.sql.planner.logical.LogicalRelation;
import org.tributary.sql.planner.logical.LogicalWindow;
import org.tributary.sql.planner.streaming.window.WindowType;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LogicalPlanOptimizerTest {

  private static final WindowType TUMBLING = WindowType.tumbling(Duration.ofMinutes(1));

  @Test
  void children_are_optimized_before_parent() {
    List<String> visited = new ArrayList<>();
    Rule<LogicalPlan> recorder =
        new Rule<>() {
          private final Pattern<LogicalPlan> pattern =
              typeOf(LogicalPlan.class).matching(plan -> !visited.contains(name(plan)));

          @Override
          public Pattern<LogicalPlan> pattern() {
            return pattern;
          }

          @Override
          public LogicalPlan apply(LogicalPlan plan, Captures captures) {
            visited.add(name(plan));
            return plan;
          }
        };
    LogicalPlan plan =
        LogicalPlanDSL.project(
            LogicalPlanDSL.filter(source("a"), DSL.literal(true)), DSL.ref("a", "k"));

    new LogicalPlanOptimizer(List.of(recorder)).optimize(plan);

    assertEquals(List.of("LogicalRelation", "LogicalFilter", "LogicalProject"), visited);
  }

  @Test
  void parent_is_rebuilt_on_rewritten_child() {
    Rule<LogicalFilter> dropFilter =
        new Rule<>() {
          @Override
          public Pattern<LogicalFilter> pattern() {
            return typeOf(LogicalFilter.class);
          }

          @Override
          public LogicalPlan apply(LogicalFilter plan, Captures captures) {
            return plan.getInput();
          }
        };
    LogicalPlan relation = source("a");
    LogicalPlan plan =
        LogicalPlanDSL.project(
            LogicalPlanDSL.filter(
                LogicalPlanDSL.filter(relation, DSL.literal(true)), DSL.literal(false)),
            DSL.ref("a", "k"));

    LogicalProject optimized =
        assertInstanceOf(
            LogicalProject.class,
            new LogicalPlanOptimizer(List.of(dropFilter)).optimize(plan));

    assertSame(relation, optimized.getInput());
    assertEquals(LogicalPlanDSL.project(relation, DSL.ref("a", "k")), optimized);
  }

  @Test
  void rules_apply_until_no_rule_matches() {
    Rule<LogicalWindow> unwrap =
        new Rule<>() {
          @Override
          public Pattern<LogicalWindow> pattern() {
            return typeOf(LogicalWindow.class);
          }

          @Override
          public LogicalPlan apply(LogicalWindow plan, Captures captures) {
            return plan.getInput();
          }
        };
    LogicalPlan plan =
        LogicalPlanDSL.window(LogicalPlanDSL.window(source("a"), TUMBLING), TUMBLING);

    assertInstanceOf(
        LogicalRelation.class, new LogicalPlanOptimizer(List.of(unwrap)).optimize(plan));
  }

  @Test
  void plan_is_returned_as_is_when_no_rule_matches() {
    LogicalPlan plan = LogicalPlanDSL.filter(source("a"), DSL.literal(true));

    assertSame(plan, new LogicalPlanOptimizer(List.of()).optimize(plan));
  }

  private static String name(LogicalPlan plan) {
    return plan.getClass().getSimpleName();
  }
}
