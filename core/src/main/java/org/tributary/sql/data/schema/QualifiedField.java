/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.data.schema;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.calcite.rel.type.RelDataType;
import org.tributary.sql.data.type.SqlTypes;

/**
 * A field of a plan schema: qualifier, name, data type and metadata. Nullability is carried by the
 * data type.
 */
@Getter
@EqualsAndHashCode
public class QualifiedField {

  /** Relation qualifier, null for an unqualified field. */
  private final String qualifier;

  private final String name;

  private final RelDataType type;

  private final Map<String, String> metadata;

  public QualifiedField(String qualifier, String name, RelDataType type) {
    this(qualifier, name, type, ImmutableMap.of());
  }

  /** Constructor of QualifiedField. */
  public QualifiedField(
      String qualifier, String name, RelDataType type, Map<String, String> metadata) {
    this.qualifier = qualifier;
    this.name = name;
    this.type = type;
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  public boolean isNullable() {
    return type.isNullable();
  }

  public Column qualifiedColumn() {
    return new Column(qualifier, name);
  }

  /** Copy of this field with the given nullability. */
  public QualifiedField withNullable(boolean nullable) {
    if (nullable == isNullable()) {
      return this;
    }
    return new QualifiedField(
        qualifier, name, SqlTypes.withNullability(type, nullable), metadata);
  }

  @Override
  public String toString() {
    return qualifiedColumn().flatName() + ":" + type.getFullTypeString();
  }
}
