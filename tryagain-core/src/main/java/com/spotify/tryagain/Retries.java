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

import com.spotify.tryagain.backoff.BackoffPolicy;
import java.util.concurrent.Callable;

/**
 * Blocking retries on the calling thread. See {@link RetryLoop}.
 *
 * <pre>
 * String body = Retries.retryIf(Backoffs.exponential(), () -> fetch(uri),
 *     RetryPredicates.onlyOn(IOException.class));
 * </pre>
 */
public final class Retries {

  private static final RetryLoop LOOP = RetryLoop.create();

  private Retries() {
  }

  public static <T> T retry(final BackoffPolicy backoff, final Callable<T> operation) {
    return LOOP.retry(backoff, operation);
  }

  public static <T> T retryIf(final BackoffPolicy backoff,
                              final Callable<T> operation,
                              final RetryPredicate predicate) throws Exception {
    return LOOP.retryIf(backoff, operation, predicate);
  }
}
