/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression;

import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.expression.env.Environment;

/** The definition of the resolved expression. */
public interface Expression {

  /**
   * Evaluate the value of expression in the value environment. SQL NULL is represented by {@code
   * null}.
   */
  Object valueOf(Environment<Column, Object> valueEnv);

  /**
   * The field this expression produces when projected over a plan with the given schema.
   *
   * @throws org.tributary.sql.exception.PlanConstructionException if a column does not resolve
   */
  QualifiedField toField(PlanSchema inputSchema);
}
