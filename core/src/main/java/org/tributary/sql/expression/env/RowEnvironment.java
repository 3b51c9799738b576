/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.expression.env;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;

/** Resolves column references against one row laid out according to a plan schema. */
public class RowEnvironment implements Environment<Column, Object> {

  private final PlanSchema schema;

  private final List<Object> row;

  /** Constructor of RowEnvironment. Values may be null. */
  public RowEnvironment(PlanSchema schema, List<Object> row) {
    Preconditions.checkArgument(
        schema.size() == row.size(),
        "row has %s values but schema has %s fields",
        row.size(),
        schema.size());
    this.schema = schema;
    this.row = new ArrayList<>(row);
  }

  @Override
  public Object resolve(Column var) {
    return row.get(schema.indexOf(var));
  }
}
