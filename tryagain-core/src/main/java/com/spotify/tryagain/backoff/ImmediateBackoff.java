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
 * Never waits. Useful for busy retries, or as the inner policy of a {@link MinimumBackoff}.
 */
public class ImmediateBackoff implements BackoffPolicy {

  public static final ImmediateBackoff INSTANCE = new ImmediateBackoff();

  @Override
  public long backoffPeriodMillis(final int attemptCount) {
    return 0;
  }

  @Override
  public String toString() {
    return "ImmediateBackoff";
  }
}
