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

/**
 * Computes how long to wait before the next attempt of a retried operation.
 *
 * <p>Implementations must not block and must be deterministic: the same attempt count on
 * equivalent instances yields the same delay. See {@link ExponentialBackoff}, {@link
 * ImmediateBackoff} and the decorators {@link MinimumBackoff} and {@link MaximumBackoff}.
 */
public interface BackoffPolicy {

  /**
   * Get the delay to wait before retrying.
   *
   * @param attemptCount The number of failed attempts observed so far, starting at zero.
   *
   * @return The delay in milliseconds, never negative.
   */
  long backoffPeriodMillis(int attemptCount);
}
