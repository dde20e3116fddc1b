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

/// The connection could not be established, or it broke while the body was being read.
/// Covers DNS failures, refused or reset connections and bodies that end before their declared
/// length.
public class FetchConnectionException extends FetchException {

    /// @param url the URL being fetched
    /// @param cause the underlying network failure
    public FetchConnectionException(URI url, Throwable cause) {
        super(describe(cause), url, cause);
    }

    /// @param message the failure reason
    /// @param url the URL being fetched
    /// @param cause the underlying network failure
    public FetchConnectionException(String message, URI url, Throwable cause) {
        super(message, url, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return "connection failed";
        }
        return "connection failed: " + cause.getMessage();
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
