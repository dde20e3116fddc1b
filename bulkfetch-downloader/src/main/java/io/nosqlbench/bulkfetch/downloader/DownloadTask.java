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

import io.nosqlbench.bulkfetch.api.transport.CancellationToken;
import io.nosqlbench.bulkfetch.api.transport.FetchCancelledException;
import io.nosqlbench.bulkfetch.api.transport.FetchConnectionException;
import io.nosqlbench.bulkfetch.api.transport.FetchException;
import io.nosqlbench.bulkfetch.api.transport.HttpStatusException;
import io.nosqlbench.bulkfetch.api.transport.RedirectLimitException;
import io.nosqlbench.bulkfetch.api.transport.TransportClient;
import io.nosqlbench.bulkfetch.api.transport.TransportResponse;
import io.nosqlbench.bulkfetch.downloader.config.DownloadSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/// Drives one [DownloadRequest] to a terminal outcome.
///
/// Each attempt issues a request through the [TransportClient]. A 301 or 302 is followed within
/// the same attempt and does not count against the retry budget. A 200 is streamed to the
/// destination by the [StreamingWriter]. Connection failures and timeouts are retried after a
/// backoff while the [RetryPolicy] allows; every other failure is final.
///
/// [#call()] never throws. Whatever happens, including bugs surfacing as runtime exceptions, the
/// result is a [DownloadOutcome], so one task cannot take its siblings down with it.
public class DownloadTask implements Callable<DownloadOutcome> {

    private static final Logger logger = LogManager.getLogger(DownloadTask.class);

    private final DownloadTaskState state;
    private final TransportClient transport;
    private final StreamingWriter writer;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final int maxRedirects;
    private final int progressThresholdPercent;
    private final ProgressListener progressListener;
    private final CancellationToken cancellation;

    /// Creates a task with every knob spelled out.
    ///
    /// @param request the request to fulfil
    /// @param transport the single-attempt transport
    /// @param writer streams bodies to disk
    /// @param retryPolicy attempt budget and backoff
    /// @param timeout the attempt-scoped transport timeout
    /// @param maxRedirects the most redirects one attempt may follow, or -1 for no limit
    /// @param progressThresholdPercent the percentage step between progress events
    /// @param progressListener receives progress events
    /// @param cancellation aborts the task at its next suspension point when cancelled
    public DownloadTask(
        DownloadRequest request,
        TransportClient transport,
        StreamingWriter writer,
        RetryPolicy retryPolicy,
        Duration timeout,
        int maxRedirects,
        int progressThresholdPercent,
        ProgressListener progressListener,
        CancellationToken cancellation
    )
    {
        this.state = new DownloadTaskState(Objects.requireNonNull(request, "request"));
        this.transport = Objects.requireNonNull(transport, "transport");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.maxRedirects = maxRedirects;
        this.progressThresholdPercent = progressThresholdPercent;
        this.progressListener = progressListener != null ? progressListener : ProgressListener.NONE;
        this.cancellation = cancellation != null ? cancellation : CancellationToken.none();
    }

    /// Creates a task configured from batch settings.
    ///
    /// @param request the request to fulfil
    /// @param transport the single-attempt transport
    /// @param settings the batch settings
    /// @param progressListener receives progress events
    /// @param cancellation the batch cancellation token
    public DownloadTask(
        DownloadRequest request,
        TransportClient transport,
        DownloadSettings settings,
        ProgressListener progressListener,
        CancellationToken cancellation
    )
    {
        this(request, transport, new StreamingWriter(settings.bufferSize()), settings.retryPolicy(),
            settings.timeout(), settings.maxRedirects(), settings.progressThresholdPercent(),
            progressListener, cancellation);
    }

    @Override
    public DownloadOutcome call() {
        try {
            return runAttempts();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure downloading {}", state.request().url(), e);
            if (!state.status().isTerminal()) {
                state.failed();
            }
            return DownloadOutcome.failed(state.request(), DownloadOutcome.reasonOf(e));
        }
    }

    private DownloadOutcome runAttempts() {
        DownloadRequest request = state.request();
        while (true) {
            try {
                cancellation.throwIfCancelled(request.url());
                state.beginAttempt();
                logger.debug("Attempt {} for {}", state.attempt(), state.currentUrl());
                long bytes = attempt();
                state.succeeded(bytes);
                logger.debug("Downloaded {} ({} bytes) to {}", request.url(), bytes, request.destination());
                return DownloadOutcome.succeeded(request, bytes);
            } catch (FetchException e) {
                if (!e.isRetriable() || !retryPolicy.shouldRetry(state.attempt()) || cancellation.isCancelled()) {
                    return fail(e);
                }
                Duration delay = retryPolicy.delayAfter(state.attempt());
                logger.warn("Attempt {}/{} for {} failed: {}. Retrying in {}ms",
                    state.attempt(), retryPolicy.maxRetries(), state.currentUrl(), e.getMessage(), delay.toMillis());
                state.retrying();
                try {
                    if (cancellation.awaitCancellation(delay)) {
                        return fail(new FetchCancelledException(request.url()));
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(new FetchCancelledException(request.url()));
                }
            }
        }
    }

    /// One attempt: follow redirects until a non-redirect status, then stream or fail.
    private long attempt() throws FetchException {
        int hops = 0;
        while (true) {
            URI url = state.currentUrl();
            TransportResponse response = transport.fetch(url, timeout, cancellation);
            try {
                int status = response.statusCode();
                if (status == 301 || status == 302) {
                    URI target = redirectTarget(url, response);
                    hops++;
                    if (maxRedirects >= 0 && hops > maxRedirects) {
                        throw new RedirectLimitException(state.request().url(), hops);
                    }
                    logger.info("Redirect {} {} -> {}", status, url, target);
                    state.redirectTo(target);
                    continue;
                }
                if (status != 200) {
                    throw new HttpStatusException(url, status);
                }
                return stream(url, response);
            } finally {
                release(response);
            }
        }
    }

    private long stream(URI url, TransportResponse response) throws FetchException {
        DownloadRequest request = state.request();
        long total = response.contentLength();
        state.beginBody(total);
        ProgressEmitter emitter = new ProgressEmitter(request.url(), total, progressThresholdPercent, progressListener);

        long written = writer.writeStream(url, response.body(), request.destination(), bytes -> {
            cancellation.throwIfCancelled(request.url());
            state.progress(bytes);
            logger.trace("{}: {} of {} bytes", request.url(), bytes, total);
            emitter.onBytes(bytes);
        });

        if (total >= 0 && written != total) {
            FetchConnectionException truncated = new FetchConnectionException(
                "body ended after " + written + " of " + total + " bytes", url, null);
            try {
                Files.deleteIfExists(request.destination());
            } catch (IOException e) {
                truncated.addSuppressed(e);
            }
            throw truncated;
        }
        emitter.complete(written);
        return written;
    }

    private URI redirectTarget(URI url, TransportResponse response) throws HttpStatusException {
        int status = response.statusCode();
        String location = response.header("Location")
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElseThrow(() -> new HttpStatusException(url, status, "HTTP " + status + " without Location header"));
        URI target;
        try {
            target = url.resolve(location);
        } catch (IllegalArgumentException e) {
            throw new HttpStatusException(url, status, "HTTP " + status + " with invalid Location '" + location + "'");
        }
        String scheme = target.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new HttpStatusException(url, status, "HTTP " + status + " to unsupported location " + target);
        }
        return target;
    }

    private void release(TransportResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            logger.debug("Releasing response for {} failed: {}", response.url(), e.getMessage());
        }
    }

    private DownloadOutcome fail(FetchException e) {
        state.failed();
        logger.warn("Download of {} failed after {} attempt(s): {}",
            state.request().url(), state.attempt(), e.getMessage());
        return DownloadOutcome.failed(state.request(), e);
    }

    /// @return the task's state, for inspection after [#call()] returns
    public DownloadTaskState getState() {
        return state;
    }
}
