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
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.math.IntMath;
import com.google.common.math.LongMath;
import com.google.common.util.concurrent.AsyncCallable;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.spotify.tryagain.Clock;
import com.spotify.tryagain.RetryPredicate;
import com.spotify.tryagain.backoff.BackoffPolicy;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A retried asynchronous operation, as a state machine that is driven one step at a time by
 * {@link #advance(Runnable)}. The task never blocks: while an attempt is in flight, or while a
 * backoff delay has not yet elapsed, it arranges for the waker to be run and reports {@link
 * Poll#pending()}.
 *
 * <pre>
 *   RUNNING --success--> DONE
 *   RUNNING --failure, predicate false--> DONE
 *   RUNNING --failure, predicate true--> PAUSED
 *   PAUSED --deadline elapsed--> RUNNING (fresh attempt)
 * </pre>
 *
 * <p>The first attempt is started when the task is created. Later attempts are started when their
 * backoff delay has elapsed, never earlier. The attempt count is incremented before the predicate
 * and the backoff policy see it, so the first failure is reported as attempt 1. The count stops
 * at {@link Integer#MAX_VALUE}.
 *
 * <p>Not thread-safe. The caller must not advance a task concurrently; {@link RetryFuture} takes
 * care of that.
 */
public class RetryTask<T> {

  private static final Logger log = LoggerFactory.getLogger(RetryTask.class);

  @VisibleForTesting
  enum State {
    RUNNING,
    PAUSED,
    DONE
  }

  private final AsyncCallable<T> factory;
  private final BackoffPolicy backoff;
  private final RetryPredicate predicate;
  private final ScheduledExecutorService executor;
  private final Clock clock;

  private State state;
  private ListenableFuture<T> attempt;
  private boolean listening;
  private long pausedUntilMillis;
  private TimerWake pendingWake;
  private int attemptCount;

  private RetryTask(final AsyncCallable<T> factory,
                    final BackoffPolicy backoff,
                    final RetryPredicate predicate,
                    final ScheduledExecutorService executor,
                    final Clock clock) {
    this.factory = checkNotNull(factory, "factory");
    this.backoff = checkNotNull(backoff, "backoff");
    this.predicate = checkNotNull(predicate, "predicate");
    this.executor = checkNotNull(executor, "executor");
    this.clock = checkNotNull(clock, "clock");
    this.attempt = startAttempt();
    this.state = State.RUNNING;
  }

  /**
   * Create a task and start its first attempt.
   *
   * @param factory   Produces a fresh attempt on every call.
   * @param backoff   The delay before each retry. Must not be shared with other tasks.
   * @param predicate Whether a failure should be retried.
   * @param executor  The timer used to wake the task once a backoff delay has elapsed.
   * @param clock     The clock deadlines are measured against.
   */
  public static <T> RetryTask<T> start(final AsyncCallable<T> factory,
                                       final BackoffPolicy backoff,
                                       final RetryPredicate predicate,
                                       final ScheduledExecutorService executor,
                                       final Clock clock) {
    return new RetryTask<>(factory, backoff, predicate, executor, clock);
  }

  /**
   * Make as much progress as possible without blocking.
   *
   * <p>If the result is pending, {@code waker} will be run once the task can make further
   * progress: when the in-flight attempt completes or when the backoff delay has elapsed. It may
   * run on the thread completing the attempt, on the executor, or before this method returns.
   *
   * @param waker Asks the caller to advance the task again.
   *
   * @return The value of the first successful attempt, the failure the predicate gave up on, or
   *     pending.
   *
   * @throws IllegalStateException If the task has already reported a result or was abandoned.
   */
  public Poll<T> advance(final Runnable waker) {
    checkNotNull(waker, "waker");
    checkState(state != State.DONE, "retry task advanced after completion");

    if (state == State.PAUSED) {
      final long now = clock.now().getMillis();
      if (now < pausedUntilMillis) {
        if (pendingWake == null || pendingWake.fired) {
          // The timer ran ahead of the clock. Wait out the rest.
          scheduleWake(waker, pausedUntilMillis - now);
        }
        return Poll.pending();
      }
      cancelPendingWake();
      attempt = startAttempt();
      listening = false;
      state = State.RUNNING;
    }

    if (!attempt.isDone()) {
      if (!listening) {
        listening = true;
        attempt.addListener(waker, directExecutor());
      }
      return Poll.pending();
    }

    final ListenableFuture<T> finished = attempt;
    attempt = null;
    state = State.DONE;

    final T value;
    try {
      value = Futures.getDone(finished);
    } catch (ExecutionException e) {
      return onFailure(e.getCause(), waker);
    } catch (CancellationException e) {
      return onFailure(e, waker);
    }
    return Poll.ready(value);
  }

  /**
   * Stop retrying: cancel the in-flight attempt and any pending wake. Safe to call in any state,
   * and more than once. A waker that still runs afterwards must be ignored by the caller.
   */
  public void abandon(final boolean mayInterruptIfRunning) {
    cancelPendingWake();
    if (attempt != null) {
      final ListenableFuture<T> inFlight = attempt;
      attempt = null;
      inFlight.cancel(mayInterruptIfRunning);
    }
    state = State.DONE;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  @VisibleForTesting
  void setAttemptCount(final int attemptCount) {
    this.attemptCount = attemptCount;
  }

  @VisibleForTesting
  State getState() {
    return state;
  }

  private Poll<T> onFailure(final Throwable error, final Runnable waker) {
    attemptCount = IntMath.saturatedAdd(attemptCount, 1);
    if (!predicate.shouldRetry(error, attemptCount)) {
      log.debug("Giving up on {} after attempt {}", factory, attemptCount, error);
      return Poll.failed(error);
    }

    final long delayMillis = backoff.backoffPeriodMillis(attemptCount);
    log.debug("Attempt {} of {} failed, retrying in {} ms: {}",
        attemptCount, factory, delayMillis, error.toString());
    pausedUntilMillis = LongMath.saturatedAdd(clock.now().getMillis(), delayMillis);
    state = State.PAUSED;
    scheduleWake(waker, delayMillis);
    return Poll.pending();
  }

  private ListenableFuture<T> startAttempt() {
    try {
      return checkNotNull(factory.call(), "attempt factory returned null");
    } catch (Exception e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  private void scheduleWake(final Runnable waker, final long delayMillis) {
    final TimerWake wake = new TimerWake(waker);
    wake.timer = executor.schedule(wake, delayMillis, MILLISECONDS);
    pendingWake = wake;
  }

  private void cancelPendingWake() {
    if (pendingWake != null) {
      pendingWake.cancel();
      pendingWake = null;
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("attemptCount", attemptCount)
        .add("factory", factory)
        .add("backoff", backoff)
        .toString();
  }

  private static class TimerWake implements Runnable {

    private final Runnable waker;
    private volatile boolean fired;
    private volatile ScheduledFuture<?> timer;

    private TimerWake(final Runnable waker) {
      this.waker = waker;
    }

    @Override
    public void run() {
      fired = true;
      waker.run();
    }

    void cancel() {
      final ScheduledFuture<?> scheduled = timer;
      if (scheduled != null) {
        scheduled.cancel(false);
      }
    }
  }
}
