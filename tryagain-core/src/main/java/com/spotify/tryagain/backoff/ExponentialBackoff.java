/*-
 * -\-\-
 * TryAgain Core
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.tryagain.backoff;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

/**
 * A backoff policy whose delay grows geometrically with the number of failed attempts.
 *
 * <p>delay(n) = 100ms * (base^n - 1), truncated to whole milliseconds. The first retry is
 * therefore immediate.
 */
public class ExponentialBackoff implements BackoffPolicy {

  public static final double DEFAULT_BASE = 1.25;

  private static final double SCALE_MILLIS = 100.0;

  private final double base;

  /**
   * Create an {@link ExponentialBackoff} growing by {@link #DEFAULT_BASE}.
   */
  public ExponentialBackoff() {
    this(DEFAULT_BASE);
  }

  /**
   * Create an {@link ExponentialBackoff} with a custom growth base.
   *
   * @param base The growth base, must be finite and at least 1.0.
   */
  public ExponentialBackoff(final double base) {
    checkArgument(!Double.isNaN(base) && !Double.isInfinite(base), "base must be finite");
    checkArgument(base >= 1.0, "base must be at least 1.0, was %s", base);
    this.base = base;
  }

  public double getBase() {
    return base;
  }

  @Override
  public long backoffPeriodMillis(final int attemptCount) {
    checkArgument(attemptCount >= 0, "attempt count must be non-negative");
    // Narrowing saturates at Long.MAX_VALUE once the power overflows
    return (long) (SCALE_MILLIS * (Math.pow(base, attemptCount) - 1.0));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("base", base)
        .toString();
  }
}
