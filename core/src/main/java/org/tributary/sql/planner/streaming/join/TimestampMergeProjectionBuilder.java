/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.join;

import static org.tributary.sql.planner.streaming.StreamingFields.TIMESTAMP_FIELD;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.exception.MalformedTimestampsException;
import org.tributary.sql.expression.DSL;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.planner.logical.LogicalJoin;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalProject;

/** Collapses the event-time columns inherited from both join inputs into one. */
@UtilityClass
public class TimestampMergeProjectionBuilder {

  /**
   * Project every non-timestamp column of the joined plan, followed by a single {@code
   * _timestamp} column holding the later of the two input timestamps. The output column takes the
   * qualifier, type and metadata of the left timestamp.
   *
   * <p>The merged value is the greater timestamp when both are set, the one that is set when only
   * one is, and NULL when neither is.
   *
   * @throws MalformedTimestampsException unless the joined schema has exactly two timestamp
   *     columns, one from each side
   */
  public static LogicalProject build(LogicalPlan joined) {
    PlanSchema schema = joined.getSchema();
    List<QualifiedField> timestampFields = schema.fieldsWithUnqualifiedName(TIMESTAMP_FIELD);
    if (timestampFields.size() != 2) {
      throw new MalformedTimestampsException(
          "join must have two timestamp fields, found " + timestampFields.size());
    }
    if (joined instanceof LogicalJoin) {
      checkOnePerSide((LogicalJoin) joined);
    }
    QualifiedField leftField = timestampFields.get(0);
    QualifiedField rightField = timestampFields.get(1);

    List<QualifiedField> outputFields = new ArrayList<>();
    List<Expression> projectList = new ArrayList<>();
    for (QualifiedField field : schema.getFields()) {
      if (!field.getName().equals(TIMESTAMP_FIELD)) {
        outputFields.add(field);
        projectList.add(DSL.ref(field.qualifiedColumn()));
      }
    }
    Expression merged =
        maxTimestamp(DSL.ref(leftField.qualifiedColumn()), DSL.ref(rightField.qualifiedColumn()));
    outputFields.add(leftField);
    projectList.add(DSL.named(leftField.getQualifier(), leftField.getName(), merged));

    return LogicalProject.withSchema(
        joined, projectList, new PlanSchema(outputFields, schema.getMetadata()));
  }

  /**
   * {@code CASE left >= right WHEN TRUE THEN left WHEN FALSE THEN right ELSE coalesce(left, right)
   * END}. The comparison is NULL when either side is, which falls through to the coalesce.
   */
  static Expression maxTimestamp(Expression left, Expression right) {
    return DSL.caseWhen(
        DSL.gte(left, right),
        List.of(DSL.when(DSL.literal(true), left), DSL.when(DSL.literal(false), right)),
        DSL.coalesce(left, right));
  }

  private static void checkOnePerSide(LogicalJoin join) {
    if (join.getLeft().getSchema().fieldsWithUnqualifiedName(TIMESTAMP_FIELD).size() != 1
        || join.getRight().getSchema().fieldsWithUnqualifiedName(TIMESTAMP_FIELD).size() != 1) {
      throw new MalformedTimestampsException(
          "join must have one timestamp field from each side");
    }
  }
}
