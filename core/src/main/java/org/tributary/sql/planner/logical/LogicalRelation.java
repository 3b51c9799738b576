/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.data.schema.PlanSchema;

/** Logical Relation represent the data source. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalRelation extends LogicalPlan {

  @Getter private final String relationName;

  private final PlanSchema schema;

  /** Constructor of LogicalRelation. */
  public LogicalRelation(String relationName, PlanSchema schema) {
    super(ImmutableList.of());
    this.relationName = relationName;
    this.schema = schema;
  }

  @Override
  public PlanSchema getSchema() {
    return schema;
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    Preconditions.checkArgument(childPlans.isEmpty(), "relation has no children");
    return this;
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitRelation(this, context);
  }
}
