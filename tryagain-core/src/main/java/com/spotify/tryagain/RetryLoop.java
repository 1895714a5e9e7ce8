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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.math.IntMath;
import com.spotify.tryagain.backoff.BackoffPolicy;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries an operation on the calling thread, sleeping between attempts.
 *
 * <p>Each call owns its own attempt count, so one instance can serve concurrent callers as long
 * as they do not share a {@link BackoffPolicy}.
 */
public class RetryLoop {

  private static final Logger log = LoggerFactory.getLogger(RetryLoop.class);

  private final Sleeper sleeper;

  private RetryLoop(final Sleeper sleeper) {
    this.sleeper = checkNotNull(sleeper, "sleeper");
  }

  public static RetryLoop create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Calls {@code operation} until it returns. Every exception is retried.
   *
   * @return The value of the first successful call.
   */
  public <T> T retry(final BackoffPolicy backoff, final Callable<T> operation) {
    try {
      return retryIf(backoff, operation, RetryPredicates.always());
    } catch (Exception e) {
      throw new AssertionError("unconditional retry gave up", e);
    }
  }

  /**
   * Calls {@code operation} until it returns or {@code predicate} rejects one of its exceptions.
   * The attempt count passed to the predicate and the backoff policy starts at zero for the first
   * failure and stops counting at {@link Integer#MAX_VALUE}. {@link Error}s are not retried.
   *
   * <p>If {@code operation} throws {@link InterruptedException}, the interrupt flag of the calling
   * thread is restored before {@code predicate} decides whether to retry.
   *
   * @return The value of the first successful call.
   *
   * @throws Exception The exception rejected by {@code predicate}, unchanged.
   */
  public <T> T retryIf(final BackoffPolicy backoff,
                       final Callable<T> operation,
                       final RetryPredicate predicate) throws Exception {
    return retryIf(backoff, operation, predicate, 0);
  }

  @VisibleForTesting
  <T> T retryIf(final BackoffPolicy backoff,
                final Callable<T> operation,
                final RetryPredicate predicate,
                final int firstAttemptCount) throws Exception {
    checkNotNull(backoff, "backoff");
    checkNotNull(operation, "operation");
    checkNotNull(predicate, "predicate");

    int attemptCount = firstAttemptCount;
    while (true) {
      try {
        return operation.call();
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        if (!predicate.shouldRetry(e, attemptCount)) {
          log.debug("Giving up on {} after {} retries", operation, attemptCount, e);
          throw e;
        }

        final long delayMillis = backoff.backoffPeriodMillis(attemptCount);
        log.debug("Attempt {} of {} failed, retrying in {} ms: {}",
            attemptCount, operation, delayMillis, e.toString());
        sleeper.sleep(delayMillis);
      }
      attemptCount = IntMath.saturatedAdd(attemptCount, 1);
    }
  }

  public static class Builder {

    private Sleeper sleeper = new ThreadSleeper();

    private Builder() {
    }

    /** Defaults to {@link ThreadSleeper}. */
    public Builder setSleeper(final Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryLoop build() {
      return new RetryLoop(sleeper);
    }
  }
}
