/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/**
 * Raised when a logical plan cannot be rewritten for streaming execution. Planning errors are
 * fatal for the plan being rewritten and the message is what the user sees.
 */
public class PlanningException extends QueryEngineException {

  public PlanningException(String message) {
    super(message);
  }

  public PlanningException(String message, Throwable cause) {
    super(message, cause);
  }
}
