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

import java.net.URI;
import java.time.Duration;

/// The attempt did not receive response headers within its timeout, or a body read stalled for
/// longer than the timeout.
public class FetchTimeoutException extends FetchException {

    private final Duration timeout;

    /// @param url the URL being fetched
    /// @param timeout the timeout that elapsed
    /// @param cause the underlying failure, or null
    public FetchTimeoutException(URI url, Duration timeout, Throwable cause) {
        super("request timeout after " + timeout.toMillis() + "ms", url, cause);
        this.timeout = timeout;
    }

    /// @return the timeout that elapsed
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
