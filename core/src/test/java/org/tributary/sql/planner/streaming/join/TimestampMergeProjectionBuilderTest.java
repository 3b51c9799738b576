/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.join;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.tributary.sql.planner.streaming.StreamingFields.TIMESTAMP_FIELD;
import static org.tributary.sql.planner.streaming.StreamingTestPlans.joinOnKey;
import static org.tributary.sql.planner.streaming.StreamingTestPlans.source;

import java.util.Arrays;
import java.util.List;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.tributary.sql.data.schema.Column;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.exception.MalformedTimestampsException;
import org.tributary.sql.expression.DSL;
import org.tributary.sql.expression.Expression;
import org.tributary.sql.expression.env.RowEnvironment;
import org.tributary.sql.planner.logical.JoinType;
import org.tributary.sql.planner.logical.LogicalPlan;
import org.tributary.sql.planner.logical.LogicalPlanDSL;
import org.tributary.sql.planner.logical.LogicalProject;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TimestampMergeProjectionBuilderTest {

  /** A plan exposing {@code id}, {@code l._timestamp} and {@code r._timestamp}, all nullable. */
  private final LogicalPlan joined =
      LogicalPlanDSL.relation(
          "joined",
          new PlanSchema(
              List.of(
                  new QualifiedField(null, "id", SqlTypes.nullable(SqlTypeName.BIGINT)),
                  new QualifiedField("l", TIMESTAMP_FIELD, SqlTypes.nullable(SqlTypeName.BIGINT)),
                  new QualifiedField(
                      "r", TIMESTAMP_FIELD, SqlTypes.nullable(SqlTypeName.BIGINT)))));

  @Test
  void merged_timestamp_is_the_later_non_null_value() {
    LogicalProject merge = TimestampMergeProjectionBuilder.build(joined);

    assertEquals(Arrays.asList(1L, 10L), merge.evaluate(Arrays.asList(1L, 10L, 7L)));
    assertEquals(Arrays.asList(2L, 5L), merge.evaluate(Arrays.asList(2L, null, 5L)));
    assertEquals(Arrays.asList(3L, 4L), merge.evaluate(Arrays.asList(3L, 4L, null)));
    assertEquals(Arrays.asList(4L, null), merge.evaluate(Arrays.asList(4L, null, null)));
  }

  @Test
  void merged_timestamp_takes_left_field_identity() {
    LogicalProject merge = TimestampMergeProjectionBuilder.build(joined);

    assertEquals(
        List.of(Column.unqualified("id"), Column.of("l", TIMESTAMP_FIELD)),
        merge.getSchema().columns());
    assertEquals(joined.getSchema().field(1), merge.getSchema().field(1));
  }

  @Test
  void max_timestamp_prefers_left_on_tie() {
    PlanSchema schema = joined.getSchema();
    Expression max =
        TimestampMergeProjectionBuilder.maxTimestamp(
            DSL.ref("l", TIMESTAMP_FIELD), DSL.ref("r", TIMESTAMP_FIELD));

    assertEquals(6L, max.valueOf(new RowEnvironment(schema, Arrays.asList(0L, 6L, 6L))));
    assertNull(max.valueOf(new RowEnvironment(schema, Arrays.asList(0L, null, null))));
  }

  @Test
  void single_timestamp_is_rejected() {
    MalformedTimestampsException exception =
        assertThrows(
            MalformedTimestampsException.class,
            () -> TimestampMergeProjectionBuilder.build(source("a")));
    assertEquals("join must have two timestamp fields, found 1", exception.getMessage());
  }

  @Test
  void join_with_both_timestamps_on_one_side_is_rejected() {
    LogicalPlan twoStamps =
        LogicalPlanDSL.relation(
            "twice",
            new PlanSchema(
                List.of(
                    new QualifiedField("x", "k", SqlTypes.of(SqlTypeName.BIGINT)),
                    new QualifiedField("x", TIMESTAMP_FIELD, SqlTypes.of(SqlTypeName.BIGINT)),
                    new QualifiedField("y", TIMESTAMP_FIELD, SqlTypes.of(SqlTypeName.BIGINT)))));
    LogicalPlan noStamp =
        LogicalPlanDSL.relation(
            "plain",
            new PlanSchema(
                List.of(new QualifiedField("z", "k", SqlTypes.of(SqlTypeName.BIGINT)))));

    MalformedTimestampsException exception =
        assertThrows(
            MalformedTimestampsException.class,
            () ->
                TimestampMergeProjectionBuilder.build(
                    joinOnKey(twoStamps, "x", noStamp, "z", JoinType.INNER)));
    assertEquals("join must have one timestamp field from each side", exception.getMessage());
  }
}
