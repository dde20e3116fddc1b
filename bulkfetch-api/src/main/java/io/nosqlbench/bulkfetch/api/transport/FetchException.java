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

import java.io.IOException;
import java.net.URI;

/// Base type for everything that can end a fetch attempt.
///
/// Each subtype decides whether the attempt may be retried. Retriable failures stay inside the
/// download task until its retry budget runs out; terminal failures end the task immediately.
/// Either way the message of the final exception becomes the failure reason in the batch result.
public abstract class FetchException extends IOException {

    private final URI url;

    /// @param message the failure reason
    /// @param url the URL of the attempt that failed
    /// @param cause the underlying failure, or null
    protected FetchException(String message, URI url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /// @return the URL of the attempt that failed
    public URI getUrl() {
        return url;
    }

    /// @return true if another attempt at the same URL may succeed
    public abstract boolean isRetriable();
}
