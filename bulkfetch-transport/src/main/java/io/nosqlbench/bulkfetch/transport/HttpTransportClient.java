package io.nosqlbench.bulkfetch.transport;

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
import io.nosqlbench.bulkfetch.api.transport.FetchTimeoutException;
import io.nosqlbench.bulkfetch.api.transport.TransportClient;
import io.nosqlbench.bulkfetch.api.transport.TransportResponse;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/// HTTP-based implementation of [TransportClient] using the OkHttp client.
///
/// Each call to [#fetch(URI, Duration, CancellationToken)] is one attempt:
/// - redirects are not followed; a 301/302 comes back to the caller with its `Location` header
/// - OkHttp's own silent retry on connection failure is switched off
/// - a watchdog cancels the call if the response headers have not arrived within the timeout,
///   which tears down the socket instead of just giving up on it
/// - once headers are in, the same timeout is applied as the read timeout for body reads
///
/// Connections are pooled across calls, so one instance should be shared by all tasks of a
/// batch and closed when the batch is done. Closing only releases the pool and dispatcher when
/// this instance created them.
public class HttpTransportClient implements TransportClient {
    private static final Logger logger = LogManager.getLogger(HttpTransportClient.class);

    private static final AtomicInteger WATCHDOG_SEQ = new AtomicInteger();

    /// Base HTTP client; per-call timeouts are applied through [OkHttpClient#newBuilder()],
    /// which shares this client's pool and dispatcher
    private final OkHttpClient httpClient;

    /// Fires header deadlines
    private final ScheduledExecutorService watchdog;

    /// Whether the pool and dispatcher belong to this instance
    private final boolean ownsHttpClient;

    /// Flag to track if this client has been closed
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// Creates a transport client with a default connection pool.
    public HttpTransportClient() {
        this(createHttpClient(), true);
    }

    /// Creates a transport client on top of an existing OkHttp client. Redirect following and
    /// connection retry are switched off regardless of how the given client was configured.
    /// The caller keeps ownership of the pool and dispatcher; [#close()] leaves them running.
    ///
    /// @param baseClient the client whose pool and dispatcher will be shared
    public HttpTransportClient(OkHttpClient baseClient) {
        this(baseClient, false);
    }

    private HttpTransportClient(OkHttpClient baseClient, boolean ownsHttpClient) {
        this.ownsHttpClient = ownsHttpClient;
        this.httpClient = baseClient.newBuilder()
            .followRedirects(false)
            .followSslRedirects(false)
            .retryOnConnectionFailure(false)
            .build();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bulkfetch-http-watchdog-" + WATCHDOG_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /// Creates the default OkHttp client.
    ///
    /// @return a client with a modest keep-alive pool and HTTP/2 enabled
    private static OkHttpClient createHttpClient() {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
            .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
            .build();
    }

    @Override
    public TransportResponse fetch(URI url, Duration timeout, CancellationToken cancellation)
        throws FetchException
    {
        validateNotClosed();
        validateUrl(url);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        cancellation.throwIfCancelled(url);

        OkHttpClient client = httpClient.newBuilder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .build();
        Request request = new Request.Builder().url(url.toString()).get().build();
        Call call = client.newCall(request);

        AtomicBoolean deadlineFired = new AtomicBoolean(false);
        ScheduledFuture<?> deadline = watchdog.schedule(() -> {
            deadlineFired.set(true);
            call.cancel();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        CancellationToken.Registration registration = cancellation.onCancel(call::cancel);

        logger.trace("GET {} (timeout {}ms)", url, timeout.toMillis());
        Response response;
        try {
            response = call.execute();
        } catch (IOException e) {
            deadline.cancel(false);
            registration.close();
            throw translate(url, timeout, e, deadlineFired.get(), cancellation);
        }

        deadline.cancel(false);
        if (deadlineFired.get() || cancellation.isCancelled()) {
            // the watchdog or the token won the race against the status line
            registration.close();
            response.close();
            if (cancellation.isCancelled()) {
                throw new FetchCancelledException(url);
            }
            throw new FetchTimeoutException(url, timeout, null);
        }

        logger.debug("GET {} -> {}", url, response.code());
        return new HttpTransportResponse(url, response, timeout, cancellation, registration);
    }

    /// Maps an OkHttp failure onto the fetch error taxonomy.
    ///
    /// @param url the URL being fetched
    /// @param timeout the attempt timeout
    /// @param e the failure
    /// @param deadlineFired whether the header watchdog cancelled the call
    /// @param cancellation the batch cancellation token
    /// @return the exception to throw
    static FetchException translate(
        URI url,
        Duration timeout,
        IOException e,
        boolean deadlineFired,
        CancellationToken cancellation
    )
    {
        if (e instanceof FetchException) {
            return (FetchException) e;
        }
        if (cancellation.isCancelled()) {
            return new FetchCancelledException(url);
        }
        if (deadlineFired || e instanceof InterruptedIOException) {
            // SocketTimeoutException is an InterruptedIOException too
            return new FetchTimeoutException(url, timeout, e);
        }
        return new FetchConnectionException(url, e);
    }

    /// Validates that the URL is an absolute http or https URL.
    ///
    /// @param url the URL to check
    private static void validateUrl(URI url) {
        if (url == null) {
            throw new IllegalArgumentException("URL cannot be null");
        }
        String scheme = url.getScheme();
        if (scheme == null) {
            throw new IllegalArgumentException("URL must be absolute: " + url);
        }
        String lower = scheme.toLowerCase(Locale.ROOT);
        if (!lower.equals("http") && !lower.equals("https")) {
            throw new IllegalArgumentException("URL must be HTTP or HTTPS: " + url);
        }
    }

    /// Validates that this client has not been closed.
    private void validateNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("HttpTransportClient has been closed");
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            watchdog.shutdownNow();
            if (ownsHttpClient) {
                httpClient.dispatcher().executorService().shutdown();
                httpClient.connectionPool().evictAll();
            }
        }
    }
}
