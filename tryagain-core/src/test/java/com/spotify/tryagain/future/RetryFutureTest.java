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

import static com.google.common.util.concurrent.Futures.immediateFailedFuture;
import static com.google.common.util.concurrent.Futures.immediateFuture;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.AsyncCallable;
import com.google.common.util.concurrent.SettableFuture;
import com.spotify.tryagain.FakeScheduler;
import com.spotify.tryagain.RetryPredicate;
import com.spotify.tryagain.RetryPredicates;
import com.spotify.tryagain.SystemClock;
import com.spotify.tryagain.backoff.Backoffs;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Test;

public class RetryFutureTest {

  private final FakeScheduler scheduler = new FakeScheduler();

  @SuppressWarnings("unchecked")
  private final AsyncCallable<String> factory = mock(AsyncCallable.class);

  private ExecutorService workers;
  private ScheduledExecutorService timer;

  @After
  public void tearDown() {
    if (workers != null) {
      workers.shutdownNow();
    }
    if (timer != null) {
      timer.shutdownNow();
    }
  }

  private RetryFuture<String> drive() {
    return RetryFuture.drive(RetryTask.start(factory, Backoffs.exponential(),
        RetryPredicates.always(), scheduler, scheduler));
  }

  @Test
  public void testWakeAfterCompletionIsIgnored() throws Exception {
    when(factory.call()).thenReturn(immediateFuture("hello"));

    final RetryFuture<String> future = drive();
    assertEquals("hello", future.get());

    future.wake();
    future.wake();

    assertEquals("hello", future.get());
    verify(factory, times(1)).call();
  }

  @Test
  public void testWakeAfterCancellationIsIgnored() throws Exception {
    when(factory.call()).thenReturn(immediateFailedFuture(new IOException()));

    final RetryFuture<String> future = drive();
    future.cancel(false);

    future.wake();
    scheduler.forwardMillis(1000);

    assertTrue(future.isCancelled());
    verify(factory, times(1)).call();
  }

  @Test
  public void testSpuriousWakeWhileAttemptInFlight() throws Exception {
    final SettableFuture<String> attempt = SettableFuture.create();
    when(factory.call()).thenReturn(attempt);

    final RetryFuture<String> future = drive();
    future.wake();
    future.wake();
    assertFalse(future.isDone());

    attempt.set("hello");
    assertEquals("hello", future.get());
    verify(factory, times(1)).call();
  }

  @Test
  public void testPendingDescriptionNamesTask() throws Exception {
    when(factory.call()).thenReturn(SettableFuture.<String>create());

    final RetryFuture<String> future = drive();

    assertTrue(future.toString().contains("RetryTask"));
    future.cancel(false);
  }

  @Test
  public void testAttemptsCompletingOnOtherThreadsNeverOverlap() throws Exception {
    workers = Executors.newFixedThreadPool(8);
    timer = Executors.newScheduledThreadPool(2);
    final AtomicInteger overlaps = new AtomicInteger();

    for (int run = 0; run < 200; run++) {
      final AtomicInteger calls = new AtomicInteger();
      final AtomicInteger inFlight = new AtomicInteger();
      final AtomicBoolean deciding = new AtomicBoolean();

      final AsyncCallable<Integer> flaky = () -> {
        if (inFlight.getAndIncrement() != 0) {
          overlaps.incrementAndGet();
        }
        final int call = calls.incrementAndGet();
        final SettableFuture<Integer> attempt = SettableFuture.create();
        workers.execute(() -> {
          inFlight.decrementAndGet();
          if (call < 5) {
            attempt.setException(new IOException("attempt " + call));
          } else {
            attempt.set(call);
          }
        });
        return attempt;
      };
      // Runs inside advance, so two threads deciding at once means two concurrent advances
      final RetryPredicate exclusive = (error, attemptCount) -> {
        if (!deciding.compareAndSet(false, true)) {
          overlaps.incrementAndGet();
        }
        Thread.yield();
        deciding.set(false);
        return true;
      };

      final RetryFuture<Integer> future = RetryFuture.drive(RetryTask.start(
          flaky, Backoffs.immediate(), exclusive, timer, new SystemClock()));

      assertEquals(5, (int) future.get(10, SECONDS));
      assertEquals(5, calls.get());
    }

    assertEquals(0, overlaps.get());
  }

  @Test
  public void testCancelRacingWakesStopsRetrying() throws Exception {
    for (int run = 0; run < 100; run++) {
      final ExecutorService attemptPool = Executors.newFixedThreadPool(4);
      final ScheduledExecutorService wakePool = Executors.newScheduledThreadPool(1);
      final AtomicInteger calls = new AtomicInteger();

      final AsyncCallable<Integer> failing = () -> {
        calls.incrementAndGet();
        final SettableFuture<Integer> attempt = SettableFuture.create();
        attemptPool.execute(() -> attempt.setException(new IOException("down")));
        return attempt;
      };

      final RetryFuture<Integer> future = RetryFuture.drive(RetryTask.start(
          failing, Backoffs.immediate(), RetryPredicates.always(), wakePool, new SystemClock()));

      final int cancelAfter = 1 + run % 4;
      while (calls.get() < cancelAfter) {
        Thread.yield();
      }
      assertTrue(future.cancel(true));
      final int callsAtCancel = calls.get();

      // Let every wake still in flight run out
      attemptPool.shutdown();
      assertTrue(attemptPool.awaitTermination(10, SECONDS));
      wakePool.shutdown();
      assertTrue(wakePool.awaitTermination(10, SECONDS));

      assertTrue(future.isCancelled());
      assertThat(calls.get() - callsAtCancel, lessThanOrEqualTo(1));
    }
  }
}
