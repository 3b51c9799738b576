/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.exception;

/**
 * The join has a shape the streaming runtime cannot execute: a constraint other than ON, null
 * equals null semantics, session windows, or incompatible windowing between its inputs.
 */
public class UnsupportedJoinException extends PlanningException {

  public UnsupportedJoinException(String message) {
    super(message);
  }
}
