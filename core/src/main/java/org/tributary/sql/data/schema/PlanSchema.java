/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.data.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.tributary.sql.exception.PlanConstructionException;

/**
 * Output schema of a logical plan node: an ordered list of {@link QualifiedField} plus
 * schema-level metadata.
 *
 * <p>Qualified names are unique within a schema, and an unqualified field may not share its name
 * with a qualified one, so every column reference resolves to at most one field.
 */
@Getter
@EqualsAndHashCode
public class PlanSchema {

  private final List<QualifiedField> fields;

  private final Map<String, String> metadata;

  public PlanSchema(List<QualifiedField> fields) {
    this(fields, ImmutableMap.of());
  }

  /**
   * Constructor of PlanSchema.
   *
   * @throws PlanConstructionException on duplicate or ambiguous field names
   */
  public PlanSchema(List<QualifiedField> fields, Map<String, String> metadata) {
    checkNames(fields);
    this.fields = ImmutableList.copyOf(fields);
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  public static PlanSchema empty() {
    return new PlanSchema(ImmutableList.of());
  }

  public int size() {
    return fields.size();
  }

  public QualifiedField field(int index) {
    return fields.get(index);
  }

  public List<Column> columns() {
    return fields.stream().map(QualifiedField::qualifiedColumn).collect(Collectors.toList());
  }

  /**
   * Position of the field a column reference resolves to. A qualified reference must match
   * qualifier and name; an unqualified one matches by name alone and must be unambiguous.
   *
   * @throws PlanConstructionException if the column is missing or ambiguous
   */
  public int indexOf(Column column) {
    List<Integer> matches =
        IntStream.range(0, fields.size())
            .filter(i -> matches(fields.get(i), column))
            .boxed()
            .collect(Collectors.toList());
    if (matches.isEmpty()) {
      throw new PlanConstructionException(
          String.format(
              "No field named %s. Valid fields are %s.", column.flatName(), validFieldNames()));
    }
    if (matches.size() > 1) {
      throw new PlanConstructionException(
          String.format("Ambiguous reference to unqualified field %s", column.getName()));
    }
    return matches.get(0);
  }

  /** The field a column reference resolves to, see {@link #indexOf(Column)}. */
  public QualifiedField fieldFor(Column column) {
    return fields.get(indexOf(column));
  }

  public boolean hasColumnWithUnqualifiedName(String name) {
    return fields.stream().anyMatch(field -> field.getName().equals(name));
  }

  /** All fields with the given name regardless of qualifier, in schema order. */
  public List<QualifiedField> fieldsWithUnqualifiedName(String name) {
    return fields.stream()
        .filter(field -> field.getName().equals(name))
        .collect(Collectors.toList());
  }

  private static boolean matches(QualifiedField field, Column column) {
    if (!field.getName().equals(column.getName())) {
      return false;
    }
    return !column.isQualified() || column.getRelation().equals(field.getQualifier());
  }

  private String validFieldNames() {
    return fields.stream()
        .map(field -> field.qualifiedColumn().flatName())
        .collect(Collectors.joining(", ", "[", "]"));
  }

  private static void checkNames(List<QualifiedField> fields) {
    Set<Column> qualifiedNames = new HashSet<>();
    Set<String> qualifiedBareNames = new HashSet<>();
    Set<String> unqualifiedNames = new HashSet<>();
    for (QualifiedField field : fields) {
      if (field.getQualifier() != null) {
        if (!qualifiedNames.add(field.qualifiedColumn())) {
          throw new PlanConstructionException(
              "Schema contains duplicate qualified field name "
                  + field.qualifiedColumn().flatName());
        }
        qualifiedBareNames.add(field.getName());
      } else if (!unqualifiedNames.add(field.getName())) {
        throw new PlanConstructionException(
            "Schema contains duplicate unqualified field name " + field.getName());
      }
    }
    for (String name : unqualifiedNames) {
      if (qualifiedBareNames.contains(name)) {
        throw new PlanConstructionException(
            String.format(
                "Schema contains qualified and unqualified fields named %s which would be"
                    + " ambiguous",
                name));
      }
    }
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
