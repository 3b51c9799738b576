/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.tributary.sql.planner.streaming.window;

import com.google.common.base.Preconditions;
import java.time.Duration;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Time window a streaming plan groups its rows by. Two window types are equal when they have the
 * same shape and the same durations.
 */
public abstract class WindowType {

  public static WindowType tumbling(Duration width) {
    return new Tumbling(width);
  }

  public static WindowType sliding(Duration width, Duration slide) {
    return new Sliding(width, slide);
  }

  public static WindowType session(Duration gap) {
    return new Session(gap);
  }

  public static WindowType instant() {
    return new Instant();
  }

  /** Session windows close on inactivity rather than at fixed times. */
  public boolean isSession() {
    return false;
  }

  private static Duration positive(Duration duration, String name) {
    Preconditions.checkArgument(
        duration != null && !duration.isNegative() && !duration.isZero(),
        "window %s must be positive",
        name);
    return duration;
  }

  /** Fixed-size, non-overlapping windows. */
  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Tumbling extends WindowType {
    private final Duration width;

    private Tumbling(Duration width) {
      this.width = positive(width, "width");
    }
  }

  /** Fixed-size windows that advance by {@code slide}. */
  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Sliding extends WindowType {
    private final Duration width;
    private final Duration slide;

    private Sliding(Duration width, Duration slide) {
      this.width = positive(width, "width");
      this.slide = positive(slide, "slide");
    }
  }

  /** Windows that stay open until no row arrives for {@code gap}. */
  @Getter
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Session extends WindowType {
    private final Duration gap;

    private Session(Duration gap) {
      this.gap = positive(gap, "gap");
    }

    @Override
    public boolean isSession() {
      return true;
    }
  }

  /** Every distinct timestamp is its own window. */
  @ToString
  @EqualsAndHashCode(callSuper = false)
  public static final class Instant extends WindowType {}
}
