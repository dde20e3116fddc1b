package io.nosqlbench.bulkfetch.downloader;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Duration;
import java.util.Objects;

/// How many attempts a task gets and how long it waits between them.
///
/// `maxRetries` counts total attempts, not retries after the first: a task makes at most
/// `maxRetries` attempts, and a value of 0 or 1 means a single attempt.
///
/// @param maxRetries the maximum number of attempts
/// @param baseDelay the unit of backoff handed to the backoff function
/// @param backoff maps the number of the failed attempt to the wait before the next one
public record RetryPolicy(int maxRetries, Duration baseDelay, BackoffFunction backoff) {

    /// Default number of attempts
    public static final int DEFAULT_MAX_RETRIES = 3;
    /// Default backoff unit
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(backoff, "backoff");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative: " + baseDelay);
        }
    }

    /// A policy that waits `attempt * baseDelay` after the given failed attempt.
    ///
    /// @param maxRetries the maximum number of attempts
    /// @param baseDelay the backoff unit
    /// @return the policy
    public static RetryPolicy linear(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, BackoffFunction.LINEAR);
    }

    /// A policy that retries immediately, mostly useful in tests.
    ///
    /// @param maxRetries the maximum number of attempts
    /// @return the policy
    public static RetryPolicy noDelay(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, BackoffFunction.LINEAR);
    }

    /// @return the default policy, 3 attempts with 1s linear backoff
    public static RetryPolicy defaults() {
        return linear(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    /// @param attempt the 1-based number of the attempt that just failed
    /// @return true if another attempt is allowed
    public boolean shouldRetry(int attempt) {
        return attempt < maxRetries;
    }

    /// @param attempt the 1-based number of the attempt that just failed
    /// @return how long to wait before the next attempt
    public Duration delayAfter(int attempt) {
        return backoff.delay(attempt, baseDelay);
    }

    /// Computes the wait after a failed attempt.
    @FunctionalInterface
    public interface BackoffFunction {

        /// `attempt * baseDelay`
        BackoffFunction LINEAR = (attempt, baseDelay) -> baseDelay.multipliedBy(attempt);

        /// `2^(attempt-1) * baseDelay`
        BackoffFunction EXPONENTIAL =
            (attempt, baseDelay) -> baseDelay.multipliedBy(1L << Math.min(30, Math.max(0, attempt - 1)));

        /// @param attempt the 1-based number of the attempt that just failed
        /// @param baseDelay the backoff unit
        /// @return the wait before the next attempt
        Duration delay(int attempt, Duration baseDelay);
    }
}
