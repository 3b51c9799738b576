/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

/** Read-only source of planning configuration for streaming rewrites. */
public interface SchemaProvider {

  PlanningOptions getPlanningOptions();
}
