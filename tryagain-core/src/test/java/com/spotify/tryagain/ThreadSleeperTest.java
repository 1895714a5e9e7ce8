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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.Assert.assertTrue;

import com.google.common.base.Stopwatch;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

public class ThreadSleeperTest {

  @Test
  public void testSleepsThroughInterrupt() {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    Thread.currentThread().interrupt();

    new ThreadSleeper().sleep(50);

    // Restore and clear the interrupt so it does not leak into other tests
    assertTrue(Thread.interrupted());
    assertThat(stopwatch.elapsed(TimeUnit.MILLISECONDS), greaterThanOrEqualTo(50L));
  }
}
