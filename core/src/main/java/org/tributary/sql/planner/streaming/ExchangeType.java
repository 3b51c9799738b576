/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

/** How rows move between an operator and the operator consuming its output. */
public enum ExchangeType {
  /** All rows go to a single consumer. */
  GATHER,

  /** Rows are shuffled by a hash of the key columns. */
  HASH_REPARTITION
}
