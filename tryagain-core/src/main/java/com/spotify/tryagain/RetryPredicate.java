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

package com.spotify.tryagain;

/**
 * Decides whether a failed attempt should be retried. Called exactly once per failure.
 */
public interface RetryPredicate {

  /**
   * @param error        The failure of the latest attempt, as thrown or as the cause of a failed
   *                     future.
   * @param attemptCount The attempt count as seen by the retrying loop or task.
   *
   * @return true to retry after the backoff period, false to give up and report {@code error}.
   */
  boolean shouldRetry(Throwable error, int attemptCount);
}
