/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.data.schema.PlanSchema;

/**
 * A join rewritten for streaming execution. The wrapped plan is the keyed join followed by the
 * projection that merges the two event-time columns.
 *
 * <p>An instant join joins inputs sharing a window and releases its state when the window closes.
 * An updating join runs over unwindowed inputs and keeps its state for {@link #getTtl()}.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalStreamingJoin extends LogicalExtension {

  @Getter private final boolean instant;

  private final Duration ttl;

  /**
   * Constructor of LogicalStreamingJoin.
   *
   * @param rewrittenJoin the rewritten join subtree
   * @param instant whether both inputs share a window
   * @param ttl state retention, required for updating joins and absent for instant ones
   */
  public LogicalStreamingJoin(LogicalPlan rewrittenJoin, boolean instant, Duration ttl) {
    super(rewrittenJoin);
    Preconditions.checkArgument(
        instant == (ttl == null), "a join has a ttl if and only if it is updating");
    this.instant = instant;
    this.ttl = ttl;
  }

  public LogicalPlan getRewrittenJoin() {
    return getInput();
  }

  public Optional<Duration> getTtl() {
    return Optional.ofNullable(ttl);
  }

  @Override
  public String getName() {
    return "JoinExtension";
  }

  @Override
  public PlanSchema getSchema() {
    return getInput().getSchema();
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    return sameChildren(childPlans)
        ? this
        : new LogicalStreamingJoin(childPlans.get(0), instant, ttl);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitStreamingJoin(this, context);
  }
}
