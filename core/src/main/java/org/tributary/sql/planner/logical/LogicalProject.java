/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.exception.PlanConstructionException;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.expression.env.Environment;
import org.tributary.sql.expression.env.RowEnvironment;

/** Project field specified by the {@link LogicalProject#projectList}. */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalProject extends LogicalPlan {

  @Getter private final List<Expression> projectList;

  private final PlanSchema schema;

  /** Whether the schema was given explicitly rather than derived from the expressions. */
  @EqualsAndHashCode.Exclude @ToString.Exclude private final boolean explicitSchema;

  private LogicalProject(
      LogicalPlan input, List<Expression> projectList, PlanSchema schema, boolean explicitSchema) {
    super(ImmutableList.of(input));
    this.projectList = ImmutableList.copyOf(projectList);
    this.schema = schema;
    this.explicitSchema = explicitSchema;
  }

  /**
   * Project the expressions over the input, deriving each output field from its expression.
   *
   * @throws PlanConstructionException if an expression does not resolve against the input or the
   *     derived fields clash
   */
  public static LogicalProject create(LogicalPlan input, List<Expression> projectList) {
    PlanSchema inputSchema = input.getSchema();
    List<QualifiedField> fields =
        projectList.stream().map(expr -> expr.toField(inputSchema)).collect(Collectors.toList());
    return new LogicalProject(
        input, projectList, new PlanSchema(fields, inputSchema.getMetadata()), false);
  }

  /**
   * Project the expressions over the input with an explicitly given output schema.
   *
   * @throws PlanConstructionException if the expressions and the schema fields do not line up or
   *     an expression does not resolve against the input
   */
  public static LogicalProject withSchema(
      LogicalPlan input, List<Expression> projectList, PlanSchema schema) {
    if (projectList.size() != schema.size()) {
      throw new PlanConstructionException(
          String.format(
              "Projection has %d expressions but its schema has %d fields",
              projectList.size(), schema.size()));
    }
    PlanSchema inputSchema = input.getSchema();
    projectList.forEach(expr -> expr.toField(inputSchema));
    return new LogicalProject(input, projectList, schema, true);
  }

  public LogicalPlan getInput() {
    return child.get(0);
  }

  @Override
  public PlanSchema getSchema() {
    return schema;
  }

  /** Evaluate the projection over a single input row. Values may be null. */
  public List<Object> evaluate(List<Object> inputRow) {
    Environment<Column, Object> env = new RowEnvironment(getInput().getSchema(), inputRow);
    return projectList.stream().map(expr -> expr.valueOf(env)).collect(Collectors.toList());
  }

  /** Re-resolves the expressions against the new input. */
  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    if (sameChildren(childPlans)) {
      return this;
    }
    return explicitSchema
        ? withSchema(childPlans.get(0), projectList, schema)
        : create(childPlans.get(0), projectList);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitProject(this, context);
  }
}
