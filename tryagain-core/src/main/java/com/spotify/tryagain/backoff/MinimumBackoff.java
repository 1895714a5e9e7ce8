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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.max;

import com.google.common.base.MoreObjects;

/**
 * Decorates a {@link BackoffPolicy} so that it never returns less than a given floor.
 */
public class MinimumBackoff implements BackoffPolicy {

  private final BackoffPolicy delegate;
  private final long minMillis;

  public MinimumBackoff(final BackoffPolicy delegate, final long minMillis) {
    checkArgument(minMillis >= 0, "minimum must be non-negative");
    this.delegate = checkNotNull(delegate, "delegate");
    this.minMillis = minMillis;
  }

  @Override
  public long backoffPeriodMillis(final int attemptCount) {
    return max(minMillis, delegate.backoffPeriodMillis(attemptCount));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("delegate", delegate)
        .add("minMillis", minMillis)
        .toString();
  }
}
