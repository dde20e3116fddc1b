package io.nosqlbench.bulkfetch.downloader.config;

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

import io.nosqlbench.bulkfetch.downloader.RetryPolicy;
import io.nosqlbench.bulkfetch.downloader.StreamingWriter;

import java.time.Duration;
import java.util.Objects;

/// Tunables for a download batch.
///
/// @param concurrency the most downloads in flight at once
/// @param timeout the attempt-scoped transport timeout
/// @param maxRetries the maximum number of attempts per URL
/// @param retryBaseDelay the linear backoff unit
/// @param progressThresholdPercent the percentage step between progress events
/// @param maxRedirects the most redirects one attempt may follow, or -1 for no limit
/// @param bufferSize the streaming copy buffer size in bytes
public record DownloadSettings(
    int concurrency,
    Duration timeout,
    int maxRetries,
    Duration retryBaseDelay,
    int progressThresholdPercent,
    int maxRedirects,
    int bufferSize
) {

    public static final int DEFAULT_CONCURRENCY = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(30_000);
    public static final int DEFAULT_PROGRESS_THRESHOLD_PERCENT = 5;
    public static final int UNLIMITED_REDIRECTS = -1;

    public DownloadSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, was " + concurrency);
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
        if (retryBaseDelay.isNegative()) {
            throw new IllegalArgumentException("retryBaseDelay must not be negative, was " + retryBaseDelay);
        }
        if (progressThresholdPercent < 1 || progressThresholdPercent > 100) {
            throw new IllegalArgumentException(
                "progressThresholdPercent must be in 1..100, was " + progressThresholdPercent);
        }
        if (maxRedirects < UNLIMITED_REDIRECTS) {
            throw new IllegalArgumentException("maxRedirects must be >= -1, was " + maxRedirects);
        }
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive, was " + bufferSize);
        }
    }

    /// @return the built-in defaults
    public static DownloadSettings defaults() {
        return new DownloadSettings(
            DEFAULT_CONCURRENCY,
            DEFAULT_TIMEOUT,
            RetryPolicy.DEFAULT_MAX_RETRIES,
            RetryPolicy.DEFAULT_BASE_DELAY,
            DEFAULT_PROGRESS_THRESHOLD_PERCENT,
            UNLIMITED_REDIRECTS,
            StreamingWriter.DEFAULT_BUFFER_SIZE
        );
    }

    /// @return a linear retry policy built from [#maxRetries()] and [#retryBaseDelay()]
    public RetryPolicy retryPolicy() {
        return RetryPolicy.linear(maxRetries, retryBaseDelay);
    }

    /// @return true if redirect depth is capped
    public boolean hasRedirectLimit() {
        return maxRedirects >= 0;
    }

    public DownloadSettings withConcurrency(int concurrency) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withTimeout(Duration timeout) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withMaxRetries(int maxRetries) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withRetryBaseDelay(Duration retryBaseDelay) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withProgressThresholdPercent(int progressThresholdPercent) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withMaxRedirects(int maxRedirects) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }

    public DownloadSettings withBufferSize(int bufferSize) {
        return new DownloadSettings(concurrency, timeout, maxRetries, retryBaseDelay,
            progressThresholdPercent, maxRedirects, bufferSize);
    }
}
