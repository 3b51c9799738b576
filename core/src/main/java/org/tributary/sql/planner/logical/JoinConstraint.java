/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.logical;

/** How the join condition was written: {@code JOIN ... ON} or {@code JOIN ... USING}. */
public enum JoinConstraint {
  ON,
  USING
}
