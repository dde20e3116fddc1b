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

/// The server answered with a status that is neither 200 nor a usable 301/302 redirect.
/// Never retried.
public class HttpStatusException extends FetchException {

    private final int statusCode;

    /// @param url the URL that answered
    /// @param statusCode the status it answered with
    public HttpStatusException(URI url, int statusCode) {
        this(url, statusCode, "HTTP " + statusCode);
    }

    /// @param url the URL that answered
    /// @param statusCode the status it answered with
    /// @param message the failure reason
    public HttpStatusException(URI url, int statusCode, String message) {
        super(message, url, null);
        this.statusCode = statusCode;
    }

    /// @return the HTTP status code
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
