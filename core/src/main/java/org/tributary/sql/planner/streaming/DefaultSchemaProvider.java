/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import org.tributary.sql.common.setting.Settings;

/** {@link SchemaProvider} whose planning options come from {@link Settings}. */
public class DefaultSchemaProvider implements SchemaProvider {

  private final PlanningOptions planningOptions;

  public DefaultSchemaProvider(Settings settings) {
    this.planningOptions = PlanningOptions.from(settings);
  }

  @Override
  public PlanningOptions getPlanningOptions() {
    return planningOptions;
  }
}
