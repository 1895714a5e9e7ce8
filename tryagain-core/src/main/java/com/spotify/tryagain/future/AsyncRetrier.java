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

package com.spotify.tryagain.future;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.util.concurrent.AsyncCallable;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.spotify.tryagain.Clock;
import com.spotify.tryagain.RetryPredicate;
import com.spotify.tryagain.RetryPredicates;
import com.spotify.tryagain.SystemClock;
import com.spotify.tryagain.backoff.BackoffPolicy;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Retries asynchronous operations without blocking a thread during backoff delays. Delays are
 * handed to the executor as scheduled wakes.
 *
 * <pre>
 * AsyncRetrier retrier = AsyncRetrier.newBuilder()
 *     .setExecutor(scheduler)
 *     .build();
 * ListenableFuture&lt;Response&gt; response = retrier.retryIf(
 *     Backoffs.exponential(), () -&gt; client.send(request), RetryPredicates.maxAttempts(5));
 * </pre>
 */
public class AsyncRetrier {

  private final ScheduledExecutorService executor;
  private final Clock clock;

  private AsyncRetrier(final ScheduledExecutorService executor, final Clock clock) {
    this.executor = checkNotNull(executor, "executor");
    this.clock = checkNotNull(clock, "clock");
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Retry every failure of the attempts produced by {@code factory}.
   *
   * @return A future holding the value of the first successful attempt. It never fails with the
   *     error of an attempt. Cancelling it stops the retries.
   */
  public <T> ListenableFuture<T> retry(final BackoffPolicy backoff,
                                       final AsyncCallable<T> factory) {
    return Futures.catching(
        retryIf(backoff, factory, RetryPredicates.always()),
        Throwable.class,
        error -> {
          throw new AssertionError("unconditional retry gave up", error);
        },
        directExecutor());
  }

  /**
   * Retry failures of the attempts produced by {@code factory} for as long as {@code predicate}
   * allows. The first attempt is started before this method returns.
   *
   * @return A future holding the value of the first successful attempt, or failing with the
   *     unwrapped error that {@code predicate} rejected. Cancelling it stops the retries.
   */
  public <T> ListenableFuture<T> retryIf(final BackoffPolicy backoff,
                                         final AsyncCallable<T> factory,
                                         final RetryPredicate predicate) {
    return RetryFuture.drive(RetryTask.start(factory, backoff, predicate, executor, clock));
  }

  public static final class Builder {

    private ScheduledExecutorService executor;
    private Clock clock = new SystemClock();

    private Builder() {
    }

    /** The timer backoff delays are scheduled on. Required. */
    public Builder setExecutor(final ScheduledExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /** Defaults to SystemClock. */
    public Builder setClock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public AsyncRetrier build() {
      return new AsyncRetrier(executor, clock);
    }
  }
}
