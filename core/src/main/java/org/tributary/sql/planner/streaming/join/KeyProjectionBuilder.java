/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.join;

import static org.tributary.sql.planner.streaming.StreamingFields.INTERNAL_RELATION;
import static org.tributary.sql.planner.streaming.StreamingFields.keyField;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.expression.DSL;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.planner.logical.LogicalKeyCalculation;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalProject;

/** Materializes join keys as leading columns of a join input. */
@UtilityClass
public class KeyProjectionBuilder {

  /**
   * Wrap the input in a projection computing {@code _arroyo._key_0 .. _arroyo._key_{k-1}} from the
   * key expressions, followed by every input column under its original qualifier and name, and
   * mark the projection as a trimmed key calculation.
   *
   * @param input join input
   * @param keyExpressions key expressions for this side, in {@code on} order
   * @param sideName "left" or "right"
   * @return key calculation over the projection
   * @throws org.tributary.sql.exception.PlanConstructionException if a key expression does not
   *     resolve against the input
   */
  public static LogicalKeyCalculation build(
      LogicalPlan input, List<Expression> keyExpressions, String sideName) {
    List<Expression> projectList = new ArrayList<>();
    for (int i = 0; i < keyExpressions.size(); i++) {
      projectList.add(DSL.named(INTERNAL_RELATION, keyField(i), keyExpressions.get(i)));
    }
    for (QualifiedField field : input.getSchema().getFields()) {
      projectList.add(DSL.ref(field.qualifiedColumn()));
    }
    LogicalProject projection = LogicalProject.create(input, projectList);
    return LogicalKeyCalculation.trimmed(
        projection, LogicalKeyCalculation.prefix(keyExpressions.size()), sideName);
  }
}
