/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/** The joined schema does not carry exactly one event-time column from each side. */
public class MalformedTimestampsException extends PlanningException {

  public MalformedTimestampsException(String message) {
    super(message);
  }
}
