/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.common.setting;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Setting. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Streaming planner settings. */
    STREAMING_JOIN_TTL("plugins.streaming.join.ttl", Duration.ofHours(24));

    @Getter private final String keyValue;

    @Getter private final Object defaultValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
