/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.data.schema.PlanSchema;
import org.tributary.sql.data.schema.QualifiedField;
import org.tributary.sql.planner.streaming.PartitioningScheme;

/**
 * Key calculation: its input computes the key columns the executor partitions rows by, and this
 * node records their positions.
 *
 * <p>When trimmed, the key columns are still materialized by the input but are removed from
 * {@link #getSchema()}, so plans above this node see the same columns as before the keys were
 * added. {@link #getKeyedSchema()} is the physical layout including the keys.
 */
@ToString
@EqualsAndHashCode(callSuper = true)
public class LogicalKeyCalculation extends LogicalExtension {

  @Getter private final List<Integer> keyFields;

  @Getter private final String sideName;

  @Getter private final boolean trimmed;

  @ToString.Exclude @EqualsAndHashCode.Exclude private final PlanSchema schema;

  /**
   * Constructor of LogicalKeyCalculation.
   *
   * @param input plan materializing the key columns
   * @param keyFields positions of the key columns in the input schema
   * @param sideName name used in diagnostics, e.g. "left"
   * @param trimmed whether the key columns are hidden from {@link #getSchema()}
   */
  public LogicalKeyCalculation(
      LogicalPlan input, List<Integer> keyFields, String sideName, boolean trimmed) {
    super(input);
    for (Integer key : keyFields) {
      Preconditions.checkArgument(
          key >= 0 && key < input.getSchema().size(),
          "key index %s out of range for %s fields",
          key,
          input.getSchema().size());
    }
    this.keyFields = ImmutableList.copyOf(keyFields);
    this.sideName = sideName;
    this.trimmed = trimmed;
    this.schema = trimmed ? trim(input.getSchema(), keyFields) : input.getSchema();
  }

  /** Key calculation over the given input whose key columns are hidden from the schema. */
  public static LogicalKeyCalculation trimmed(
      LogicalPlan input, List<Integer> keyFields, String sideName) {
    return new LogicalKeyCalculation(input, keyFields, sideName, true);
  }

  /** Key positions {@code 0..keyCount-1}, i.e. the keys are a prefix of the input schema. */
  public static List<Integer> prefix(int keyCount) {
    return IntStream.range(0, keyCount).boxed().collect(Collectors.toList());
  }

  private static PlanSchema trim(PlanSchema schema, List<Integer> keyFields) {
    Set<Integer> keys = new HashSet<>(keyFields);
    List<QualifiedField> fields =
        IntStream.range(0, schema.size())
            .filter(i -> !keys.contains(i))
            .mapToObj(schema::field)
            .collect(Collectors.toList());
    return new PlanSchema(fields, schema.getMetadata());
  }

  @Override
  public String getName() {
    return "KeyCalculation(" + sideName + ")";
  }

  @Override
  public PlanSchema getSchema() {
    return schema;
  }

  /** Physical schema of the input, key columns included. */
  public PlanSchema getKeyedSchema() {
    return getInput().getSchema();
  }

  /** Partitioning the executor applies to this node's output. */
  public PartitioningScheme getPartitioningScheme() {
    return PartitioningScheme.byKeys(keyFields);
  }

  @Override
  public LogicalPlan replaceChildPlans(List<LogicalPlan> childPlans) {
    return sameChildren(childPlans)
        ? this
        : new LogicalKeyCalculation(childPlans.get(0), keyFields, sideName, trimmed);
  }

  @Override
  public <R, C> R accept(LogicalPlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitKeyCalculation(this, context);
  }
}
