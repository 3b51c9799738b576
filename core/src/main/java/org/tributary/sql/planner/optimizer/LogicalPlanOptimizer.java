/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.optimizer;

import static com.facebook.presto.matching.DefaultMatcher.DEFAULT_MATCHER;

import com.facebook.presto.matching.Match;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tributary.sql.planner.logical.LogicalPlan;

/**
 * {@link LogicalPlan} Optimizer. The Optimizer will run in the TopDown manner.
 *
 * <ol>
 *   <li>Optimize the children of the current node first.
 *   <li>Rebuild the current node on top of the optimized children.
 *   <li>Apply the rules to the current node until none of them matches.
 * </ol>
 *
 * <p>A node is therefore only rewritten after its whole subtree is final.
 */
public class LogicalPlanOptimizer {

  private final List<Rule<?>> rules;

  /** Create {@link LogicalPlanOptimizer} with customized rules. */
  public LogicalPlanOptimizer(List<Rule<?>> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  /** Optimize {@link LogicalPlan}. */
  public LogicalPlan optimize(LogicalPlan plan) {
    List<LogicalPlan> children =
        plan.getChild().stream().map(this::optimize).collect(Collectors.toList());
    return internalOptimize(plan.replaceChildPlans(children));
  }

  private LogicalPlan internalOptimize(LogicalPlan plan) {
    LogicalPlan node = plan;
    boolean done = false;
    while (!done) {
      done = true;
      for (Rule<?> rule : rules) {
        Optional<LogicalPlan> transformed = tryApply(rule, node);
        if (transformed.isPresent()) {
          node = transformed.get();
          done = false;
        }
      }
    }
    return node;
  }

  private <T extends LogicalPlan> Optional<LogicalPlan> tryApply(Rule<T> rule, LogicalPlan node) {
    Match<T> match = DEFAULT_MATCHER.match(rule.pattern(), node);
    if (match.isPresent()) {
      return Optional.of(rule.apply(match.value(), match.captures()));
    }
    return Optional.empty();
  }
}
