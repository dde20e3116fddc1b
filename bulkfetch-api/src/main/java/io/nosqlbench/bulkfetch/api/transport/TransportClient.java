package io.nosqlbench.bulkfetch.api.transport;

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

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;

/// A single-attempt HTTP(S) GET primitive.
///
/// A transport client issues exactly one request per call. It does not retry and it does not
/// follow redirects; a 301 or 302 is handed back to the caller like any other status, with its
/// `Location` header intact. Retry, backoff and redirect policy live one level up, in the
/// download task.
///
/// The timeout covers the whole attempt up to the point where the response headers have been
/// received: name resolution, connect, request write and waiting for the status line. When it
/// fires, the underlying connection is aborted rather than abandoned. While the body is being
/// read, the same duration bounds how long a single read may stall.
///
/// Implementations must be safe for concurrent use by multiple download tasks.
public interface TransportClient extends Closeable {

    /// Issues one GET request.
    ///
    /// @param url the absolute http or https URL to fetch
    /// @param timeout the attempt-scoped timeout
    /// @param cancellation a token which, when cancelled, aborts the in-flight call
    /// @return the response; the caller owns it and must close it
    /// @throws FetchConnectionException if the connection could not be established or broke
    /// @throws FetchTimeoutException if the attempt exceeded the timeout
    /// @throws FetchCancelledException if the token was cancelled before or during the call
    TransportResponse fetch(URI url, Duration timeout, CancellationToken cancellation)
        throws FetchException;

    /// Issues one GET request that cannot be cancelled.
    ///
    /// @param url the absolute http or https URL to fetch
    /// @param timeout the attempt-scoped timeout
    /// @return the response; the caller owns it and must close it
    /// @throws FetchException if the request fails
    default TransportResponse fetch(URI url, Duration timeout) throws FetchException {
        return fetch(url, timeout, CancellationToken.none());
    }

    /// Releases pooled connections and worker threads. The default does nothing.
    @Override
    default void close() {
    }
}
