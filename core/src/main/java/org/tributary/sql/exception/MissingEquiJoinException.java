/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/** An updating join has no equality condition to key its state by. */
public class MissingEquiJoinException extends PlanningException {

  public MissingEquiJoinException(String message) {
    super(message);
  }
}
