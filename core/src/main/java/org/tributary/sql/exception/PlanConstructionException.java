/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/**
 * A plan node or schema could not be built, e.g. an unresolvable column, duplicate qualified
 * field names or a projection whose expressions do not line up with its schema.
 */
public class PlanConstructionException extends PlanningException {

  public PlanConstructionException(String message) {
    super(message);
  }
}
