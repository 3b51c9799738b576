/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import lombok.experimental.UtilityClass;

/** Reserved field names shared with the front end and the streaming executor. */
@UtilityClass
public class StreamingFields {

  /** Event-time column. Every streaming plan carries exactly one. */
  public static final String TIMESTAMP_FIELD = "_timestamp";

  /** Present in the schema of plans that emit updates and retractions. */
  public static final String UPDATING_META_FIELD = "_updating_meta";

  /** Relation qualifier of planner-generated columns. */
  public static final String INTERNAL_RELATION = "_arroyo";

  private static final String KEY_FIELD_PREFIX = "_key_";

  /** Name of the {@code index}-th key column of a key calculation. */
  public static String keyField(int index) {
    return KEY_FIELD_PREFIX + index;
  }
}
