/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.optimizer.rule;

import static com.facebook.presto.matching.Pattern.typeOf;

import com.facebook.presto.matching.Captures;
import com.facebook.presto.matching.Pattern;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.tuple.Pair;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.planner.logical.JoinConstraint;
import org.tributary.sql.planner.logical.LogicalJoin;
import org.tributary.sql.planner.logical.LogicalKeyCalculation;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalProject;
import org.tributary.sql.planner.logical.LogicalStreamingJoin;
import org.tributary.sql.planner.optimizer.Rule;
import org.tributary.sql.planner.streaming.SchemaProvider;
import org.tributary.sql.planner.streaming.join.JoinCompatibilityChecker;
import org.tributary.sql.planner.streaming.join.KeyProjectionBuilder;
import org.tributary.sql.planner.streaming.join.TimestampMergeProjectionBuilder;

/**
 * Rewrite a {@link LogicalJoin} into a {@link LogicalStreamingJoin}: both inputs get their join
 * keys as leading columns, the join is rebuilt over the keyed inputs, the two event-time columns
 * are merged into one and the result is tagged as an instant or updating join.
 */
@Log4j2
public class RewriteStreamingJoin implements Rule<LogicalJoin> {

  @Accessors(fluent = true)
  @Getter
  private final Pattern<LogicalJoin> pattern =
      typeOf(LogicalJoin.class).matching(join -> !isKeyed(join));

  private final JoinCompatibilityChecker compatibilityChecker;

  private final SchemaProvider schemaProvider;

  public RewriteStreamingJoin(
      JoinCompatibilityChecker compatibilityChecker, SchemaProvider schemaProvider) {
    this.compatibilityChecker = compatibilityChecker;
    this.schemaProvider = schemaProvider;
  }

  @Override
  public LogicalPlan apply(LogicalJoin join, Captures captures) {
    boolean instant = compatibilityChecker.check(join);

    List<Expression> leftKeys =
        join.getOn().stream().map(Pair::getLeft).collect(Collectors.toList());
    List<Expression> rightKeys =
        join.getOn().stream().map(Pair::getRight).collect(Collectors.toList());
    LogicalKeyCalculation leftInput = KeyProjectionBuilder.build(join.getLeft(), leftKeys, "left");
    LogicalKeyCalculation rightInput =
        KeyProjectionBuilder.build(join.getRight(), rightKeys, "right");

    LogicalJoin keyedJoin =
        LogicalJoin.create(
            leftInput,
            rightInput,
            join.getOn(),
            join.getFilter().orElse(null),
            join.getJoinType(),
            JoinConstraint.ON,
            false);
    LogicalProject merged = TimestampMergeProjectionBuilder.build(keyedJoin);

    Duration ttl = instant ? null : schemaProvider.getPlanningOptions().getTtl();
    log.debug(
        "Rewrote {} join on {} key(s) as {} join, ttl={}",
        join.getJoinType(),
        join.getOn().size(),
        instant ? "instant" : "updating",
        ttl);
    return new LogicalStreamingJoin(merged, instant, ttl);
  }

  /** A join over key calculations is the inner join of a streaming join rewritten earlier. */
  private static boolean isKeyed(LogicalJoin join) {
    return join.getLeft() instanceof LogicalKeyCalculation
        && join.getRight() instanceof LogicalKeyCalculation;
  }
}
