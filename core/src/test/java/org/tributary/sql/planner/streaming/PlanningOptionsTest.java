/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tributary.sql.common.setting.DefaultSettings;
import org.tributary.sql.common.setting.Settings;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanningOptionsTest {

  @Mock private Settings settings;

  @Test
  void ttl_is_read_from_settings() {
    when(settings.getSettingValue(Settings.Key.STREAMING_JOIN_TTL))
        .thenReturn(Duration.ofMinutes(10));

    assertEquals(Duration.ofMinutes(10), PlanningOptions.from(settings).getTtl());
    verify(settings).getSettingValue(Settings.Key.STREAMING_JOIN_TTL);
  }

  @Test
  void default_ttl_is_one_day() {
    SchemaProvider provider = new DefaultSchemaProvider(new DefaultSettings());

    assertEquals(Duration.ofHours(24), provider.getPlanningOptions().getTtl());
  }

  @Test
  void non_positive_ttl_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new PlanningOptions(Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class, () -> new PlanningOptions(Duration.ofSeconds(-1)));
    assertThrows(IllegalArgumentException.class, () -> new PlanningOptions(null));
  }
}
