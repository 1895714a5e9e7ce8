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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Stock {@link RetryPredicate}s and ways to combine them.
 */
public final class RetryPredicates {

  private static final RetryPredicate ALWAYS = new RetryPredicate() {
    @Override
    public boolean shouldRetry(final Throwable error, final int attemptCount) {
      return true;
    }

    @Override
    public String toString() {
      return "always";
    }
  };

  private static final RetryPredicate NEVER = new RetryPredicate() {
    @Override
    public boolean shouldRetry(final Throwable error, final int attemptCount) {
      return false;
    }

    @Override
    public String toString() {
      return "never";
    }
  };

  private RetryPredicates() {
  }

  /**
   * Retries every failure. {@link RetryLoop#retry} and {@code AsyncRetrier#retry} rely on this
   * never returning false.
   */
  public static RetryPredicate always() {
    return ALWAYS;
  }

  public static RetryPredicate never() {
    return NEVER;
  }

  /**
   * Retries failures that are instances of any of the given types, and nothing else.
   */
  @SafeVarargs
  public static RetryPredicate onlyOn(final Class<? extends Throwable>... types) {
    final List<Class<? extends Throwable>> retryable = ImmutableList.copyOf(types);
    return new RetryPredicate() {
      @Override
      public boolean shouldRetry(final Throwable error, final int attemptCount) {
        for (final Class<? extends Throwable> type : retryable) {
          if (type.isInstance(error)) {
            return true;
          }
        }
        return false;
      }

      @Override
      public String toString() {
        return "onlyOn" + retryable;
      }
    };
  }

  /**
   * Retries while fewer than {@code maxAttemptCount} failures have been counted.
   */
  public static RetryPredicate maxAttempts(final int maxAttemptCount) {
    checkArgument(maxAttemptCount >= 0, "max attempt count must be non-negative");
    return new RetryPredicate() {
      @Override
      public boolean shouldRetry(final Throwable error, final int attemptCount) {
        return attemptCount < maxAttemptCount;
      }

      @Override
      public String toString() {
        return "maxAttempts(" + maxAttemptCount + ")";
      }
    };
  }

  /**
   * Retries only if both predicates agree. {@code second} is not consulted when {@code first}
   * gives up.
   */
  public static RetryPredicate both(final RetryPredicate first, final RetryPredicate second) {
    checkNotNull(first, "first");
    checkNotNull(second, "second");
    return (error, attemptCount) ->
        first.shouldRetry(error, attemptCount) && second.shouldRetry(error, attemptCount);
  }
}
