/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

/**
 * The visitor of {@link LogicalPlan}.
 *
 * @param <R> return type
 * @param <C> context type
 */
public abstract class LogicalPlanNodeVisitor<R, C> {

  public R visitNode(LogicalPlan plan, C context) {
    return null;
  }

  public R visitRelation(LogicalRelation plan, C context) {
    return visitNode(plan, context);
  }

  public R visitFilter(LogicalFilter plan, C context) {
    return visitNode(plan, context);
  }

  public R visitProject(LogicalProject plan, C context) {
    return visitNode(plan, context);
  }

  public R visitWindow(LogicalWindow plan, C context) {
    return visitNode(plan, context);
  }

  public R visitJoin(LogicalJoin plan, C context) {
    return visitNode(plan, context);
  }

  public R visitExtension(LogicalExtension plan, C context) {
    return visitNode(plan, context);
  }

  public R visitKeyCalculation(LogicalKeyCalculation plan, C context) {
    return visitExtension(plan, context);
  }

  public R visitStreamingJoin(LogicalStreamingJoin plan, C context) {
    return visitExtension(plan, context);
  }
}
