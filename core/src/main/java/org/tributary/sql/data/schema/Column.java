/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.data.schema;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A column reference, optionally qualified by the relation it comes from. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Column {

  /** Relation qualifier, null for an unqualified reference. */
  private final String relation;

  private final String name;

  public static Column of(String relation, String name) {
    return new Column(relation, name);
  }

  public static Column unqualified(String name) {
    return new Column(null, name);
  }

  public boolean isQualified() {
    return relation != null;
  }

  /** Name in {@code relation.name} form, or just the name when unqualified. */
  public String flatName() {
    return relation == null ? name : relation + "." + name;
  }

  @Override
  public String toString() {
    return flatName();
  }
}
