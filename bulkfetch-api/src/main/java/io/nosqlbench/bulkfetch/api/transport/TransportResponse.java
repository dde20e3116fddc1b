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
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Optional;

/// The status, headers and streaming body of one transport attempt.
///
/// The body is exposed as an [InputStream] so that it can be drained incrementally. Closing the
/// response releases the connection, whether or not the body was fully consumed.
public interface TransportResponse extends Closeable {

    /// @return the URL this response was fetched from
    URI url();

    /// @return the HTTP status code
    int statusCode();

    /// Looks up a response header, case-insensitively.
    ///
    /// @param name the header name
    /// @return the first value of the header, if present
    Optional<String> header(String name);

    /// @return the declared body length in bytes, or -1 if the server did not declare one
    long contentLength();

    /// @return the response body; reading it may block on the network
    InputStream body();

    /// Releases the underlying connection.
    ///
    /// @throws IOException if the connection could not be released cleanly
    @Override
    void close() throws IOException;
}
