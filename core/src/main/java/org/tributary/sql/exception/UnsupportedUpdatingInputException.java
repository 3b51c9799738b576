/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/** One of the join inputs produces updating (change-stream) records. */
public class UnsupportedUpdatingInputException extends PlanningException {

  public UnsupportedUpdatingInputException(String message) {
    super(message);
  }
}
