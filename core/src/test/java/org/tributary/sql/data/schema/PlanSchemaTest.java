/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.data.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.tributary.sql.data.type.SqlTypes;
import org.tributary.sql.exception.PlanConstructionException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanSchemaTest {

  private final QualifiedField aId = field("a", "id");

  private final QualifiedField bId = field("b", "id");

  private final QualifiedField total = field(null, "total");

  @Test
  void qualified_reference_resolves_by_qualifier_and_name() {
    PlanSchema schema = new PlanSchema(List.of(aId, bId, total));

    assertEquals(1, schema.indexOf(Column.of("b", "id")));
    assertEquals(bId, schema.fieldFor(Column.of("b", "id")));
  }

  @Test
  void unqualified_reference_resolves_when_unique() {
    PlanSchema schema = new PlanSchema(List.of(aId, total));

    assertEquals(0, schema.indexOf(Column.unqualified("id")));
    assertEquals(1, schema.indexOf(Column.unqualified("total")));
  }

  @Test
  void unqualified_reference_to_shared_name_is_ambiguous() {
    PlanSchema schema = new PlanSchema(List.of(aId, bId));

    PlanConstructionException exception =
        assertThrows(
            PlanConstructionException.class, () -> schema.indexOf(Column.unqualified("id")));
    assertEquals("Ambiguous reference to unqualified field id", exception.getMessage());
  }

  @Test
  void missing_field_lists_valid_fields() {
    PlanSchema schema = new PlanSchema(List.of(aId, total));

    PlanConstructionException exception =
        assertThrows(PlanConstructionException.class, () -> schema.indexOf(Column.of("c", "id")));
    assertEquals(
        "No field named c.id. Valid fields are [a.id, total].", exception.getMessage());
  }

  @Test
  void duplicate_qualified_names_are_rejected() {
    assertThrows(
        PlanConstructionException.class, () -> new PlanSchema(List.of(aId, field("a", "id"))));
  }

  @Test
  void duplicate_unqualified_names_are_rejected() {
    assertThrows(
        PlanConstructionException.class,
        () -> new PlanSchema(List.of(total, field(null, "total"))));
  }

  @Test
  void unqualified_name_clashing_with_qualified_name_is_rejected() {
    assertThrows(
        PlanConstructionException.class, () -> new PlanSchema(List.of(aId, field(null, "id"))));
  }

  @Test
  void fields_are_found_by_unqualified_name() {
    PlanSchema schema = new PlanSchema(List.of(aId, total, bId));

    assertEquals(List.of(aId, bId), schema.fieldsWithUnqualifiedName("id"));
    assertTrue(schema.hasColumnWithUnqualifiedName("total"));
    assertFalse(schema.hasColumnWithUnqualifiedName("missing"));
  }

  @Test
  void nullability_can_be_changed_per_field() {
    QualifiedField nullable = aId.withNullable(true);

    assertFalse(aId.isNullable());
    assertTrue(nullable.isNullable());
    assertEquals(aId.qualifiedColumn(), nullable.qualifiedColumn());
  }

  private static QualifiedField field(String qualifier, String name) {
    return new QualifiedField(qualifier, name, SqlTypes.of(SqlTypeName.INTEGER));
  }
}
