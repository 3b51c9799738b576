/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import com.google.common.base.Preconditions;
import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.tributary.sql.common.setting.Settings;

/** Planning knobs read by the streaming rewrites. */
@Getter
@ToString
@EqualsAndHashCode
public class PlanningOptions {

  /** How long an updating join keeps rows it has not yet matched. */
  private final Duration ttl;

  public PlanningOptions(Duration ttl) {
    Preconditions.checkArgument(
        ttl != null && !ttl.isNegative() && !ttl.isZero(), "join ttl must be positive: %s", ttl);
    this.ttl = ttl;
  }

  /** Read the planning options from settings. */
  public static PlanningOptions from(Settings settings) {
    Duration ttl = settings.getSettingValue(Settings.Key.STREAMING_JOIN_TTL);
    return new PlanningOptions(ttl);
  }
}
