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

import java.util.concurrent.TimeUnit;

/**
 * Factory methods for the stock {@link BackoffPolicy} implementations.
 *
 * <pre>
 * // At least one second, growing after that, never more than a minute.
 * BackoffPolicy policy = atMost(atLeast(exponential(), 1, SECONDS), 1, MINUTES);
 * </pre>
 */
public final class Backoffs {

  private Backoffs() {
  }

  public static BackoffPolicy exponential() {
    return new ExponentialBackoff();
  }

  public static BackoffPolicy exponential(final double base) {
    return new ExponentialBackoff(base);
  }

  public static BackoffPolicy immediate() {
    return ImmediateBackoff.INSTANCE;
  }

  public static BackoffPolicy atLeast(final BackoffPolicy policy,
                                      final long minimum, final TimeUnit timeUnit) {
    return new MinimumBackoff(policy, timeUnit.toMillis(minimum));
  }

  public static BackoffPolicy atMost(final BackoffPolicy policy,
                                     final long maximum, final TimeUnit timeUnit) {
    return new MaximumBackoff(policy, timeUnit.toMillis(maximum));
  }
}
