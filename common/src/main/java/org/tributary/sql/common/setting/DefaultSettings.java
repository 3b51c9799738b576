/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.common.setting;

import com.google.common.base.Preconditions;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.ToString;

/**
 * In-memory {@link Settings} backed by the default value of every {@link Settings.Key}, with
 * per-key overrides. Instances are read-only once built.
 */
@ToString
public class DefaultSettings extends Settings {

  private final Map<Key, Object> values;

  public DefaultSettings() {
    this(Map.of());
  }

  /**
   * Create settings with the given overrides applied on top of the defaults.
   *
   * @param overrides setting values keyed by {@link Settings.Key}
   */
  public DefaultSettings(Map<Key, Object> overrides) {
    Map<Key, Object> merged = new EnumMap<>(Key.class);
    for (Key key : Key.values()) {
      merged.put(key, key.getDefaultValue());
    }
    overrides.forEach(
        (key, value) -> {
          Preconditions.checkArgument(value != null, "setting %s must not be null", key);
          Preconditions.checkArgument(
              key.getDefaultValue().getClass().isInstance(value),
              "setting %s expects %s but got %s",
              key.getKeyValue(),
              key.getDefaultValue().getClass().getSimpleName(),
              value.getClass().getSimpleName());
          merged.put(key, value);
        });
    this.values = merged;
  }

  /**
   * Create settings from overrides keyed by their string names, e.g. {@code
   * plugins.streaming.join.ttl}.
   *
   * @param overrides setting values keyed by {@link Settings.Key#getKeyValue()}
   * @return settings
   * @throws IllegalArgumentException if a name is not a known setting
   */
  public static DefaultSettings fromKeyValues(Map<String, Object> overrides) {
    Map<Key, Object> byKey = new EnumMap<>(Key.class);
    overrides.forEach(
        (name, value) ->
            byKey.put(
                Key.of(name)
                    .orElseThrow(
                        () -> new IllegalArgumentException("Unknown setting: " + name)),
                value));
    return new DefaultSettings(byKey);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return values.entrySet().stream()
        .map(entry -> entry.getKey().getKeyValue() + "=" + entry.getValue())
        .collect(Collectors.toList());
  }
}
