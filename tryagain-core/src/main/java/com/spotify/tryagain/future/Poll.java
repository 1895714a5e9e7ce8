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

import com.google.common.base.MoreObjects;

/**
 * The outcome of advancing a {@link RetryTask} by one step: still pending, or done with either a
 * value or the error that ended the retries.
 */
public final class Poll<T> {

  private static final Poll<Object> PENDING = new Poll<>(false, null, null);

  private final boolean ready;
  private final T value;
  private final Throwable error;

  private Poll(final boolean ready, final T value, final Throwable error) {
    this.ready = ready;
    this.value = value;
    this.error = error;
  }

  @SuppressWarnings("unchecked")
  public static <T> Poll<T> pending() {
    return (Poll<T>) PENDING;
  }

  public static <T> Poll<T> ready(final T value) {
    return new Poll<>(true, value, null);
  }

  public static <T> Poll<T> failed(final Throwable error) {
    return new Poll<>(true, null, checkNotNull(error, "error"));
  }

  public boolean isReady() {
    return ready;
  }

  public boolean isFailure() {
    return error != null;
  }

  public T value() {
    checkState(ready && error == null, "not a successful poll: %s", this);
    return value;
  }

  public Throwable error() {
    checkState(error != null, "not a failed poll: %s", this);
    return error;
  }

  @Override
  public String toString() {
    if (!ready) {
      return "Poll{pending}";
    }
    return MoreObjects.toStringHelper(this)
        .add("value", value)
        .add("error", error)
        .omitNullValues()
        .toString();
  }
}
