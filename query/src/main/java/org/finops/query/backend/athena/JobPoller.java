/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.finops.query.backend.athena;

import org.finops.query.QueryTimeoutException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;

/**
 * Polls a remote job at a fixed interval within a bounded budget.
 *
 * <p>The status is checked immediately, then after every interval. A poll
 * that would start after the budget is spent is not made; the job times out
 * instead. A budget of {@code n} intervals therefore sleeps exactly
 * {@code n} times.
 */
public final class JobPoller {
  private final Sleeper sleeper;
  private final Duration interval;
  private final Duration budget;

  public JobPoller(Sleeper sleeper, Duration interval, Duration budget) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Poll interval must be positive: " + interval);
    }
    this.sleeper = sleeper;
    this.interval = interval;
    this.budget = budget;
  }

  /** One status check. */
  @FunctionalInterface
  public interface Poll<T> {
    /**
     * Checks the job.
     *
     * @return the final outcome once the job is finished, or null while it
     *     is still running
     */
    @Nullable T poll();
  }

  /**
   * Polls until the job finishes.
   *
   * @param description job name for the timeout message
   * @throws QueryTimeoutException if the job is still running when the
   *     budget is spent
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  public <T> T await(String description, Poll<T> poll) throws InterruptedException {
    Duration elapsed = Duration.ZERO;
    while (true) {
      T outcome = poll.poll();
      if (outcome != null) {
        return outcome;
      }
      if (elapsed.plus(interval).compareTo(budget) > 0) {
        throw new QueryTimeoutException(
            description + " did not finish within " + budget.getSeconds() + " seconds", budget);
      }
      sleeper.sleep(interval);
      elapsed = elapsed.plus(interval);
    }
  }

  public Duration getInterval() {
    return interval;
  }

  public Duration getBudget() {
    return budget;
  }
}
