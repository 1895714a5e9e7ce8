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

import com.google.common.util.concurrent.AbstractFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link RetryTask} to completion and exposes its result as a future.
 *
 * <p>Wakes may arrive from any thread. The first one to arrive advances the task; wakes that come
 * in while it does so are counted and handled by the same thread before it lets go, so the task is
 * never advanced concurrently and no wake is lost. Cancelling the future abandons the task.
 */
class RetryFuture<T> extends AbstractFuture<T> {

  private final AtomicInteger pendingWakes = new AtomicInteger();
  private final Runnable waker = this::wake;
  private final RetryTask<T> task;

  private RetryFuture(final RetryTask<T> task) {
    this.task = checkNotNull(task, "task");
  }

  static <T> RetryFuture<T> drive(final RetryTask<T> task) {
    final RetryFuture<T> future = new RetryFuture<>(task);
    future.wake();
    return future;
  }

  void wake() {
    if (pendingWakes.getAndIncrement() != 0) {
      return;
    }
    do {
      step();
    } while (pendingWakes.decrementAndGet() != 0);
  }

  private void step() {
    if (isDone()) {
      // Completed or cancelled, possibly with a timer or attempt still outstanding
      task.abandon(wasInterrupted());
      return;
    }

    final Poll<T> poll;
    try {
      poll = task.advance(waker);
    } catch (Throwable t) {
      setException(t);
      return;
    }

    if (!poll.isReady()) {
      return;
    }
    if (poll.isFailure()) {
      setException(poll.error());
    } else {
      set(poll.value());
    }
  }

  @Override
  protected void afterDone() {
    wake();
  }

  @Override
  protected String pendingToString() {
    return "task=[" + task + "]";
  }
}
