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
import static java.lang.Math.min;

import com.google.common.base.MoreObjects;

/**
 * Decorates a {@link BackoffPolicy} so that it never returns more than a given cap.
 */
public class MaximumBackoff implements BackoffPolicy {

  private final BackoffPolicy delegate;
  private final long maxMillis;

  public MaximumBackoff(final BackoffPolicy delegate, final long maxMillis) {
    checkArgument(maxMillis >= 0, "maximum must be non-negative");
    this.delegate = checkNotNull(delegate, "delegate");
    this.maxMillis = maxMillis;
  }

  @Override
  public long backoffPeriodMillis(final int attemptCount) {
    return min(maxMillis, delegate.backoffPeriodMillis(attemptCount));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("delegate", delegate)
        .add("maxMillis", maxMillis)
        .toString();
  }
}
