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
import io.nosqlbench.bulkfetch.api.transport.TransportResponse;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/// HTTP-specific implementation of [TransportResponse].
///
/// Wraps an OkHttp [Response] and owns it until closed. The body stream translates read
/// failures into the fetch error taxonomy, so a stall surfaces as a timeout and a dropped
/// connection as a connection failure, both distinguishable from local write failures.
public class HttpTransportResponse implements TransportResponse {

    private final URI url;
    private final Response response;
    private final Duration timeout;
    private final CancellationToken cancellation;
    private final CancellationToken.Registration registration;
    private final InputStream body;
    private volatile boolean closed = false;

    /// Creates a new HttpTransportResponse.
    ///
    /// @param url the URL the response was fetched from
    /// @param response the OkHttp response (ownership is transferred to this object)
    /// @param timeout the attempt timeout, reported when a body read stalls
    /// @param cancellation the token of the batch this response belongs to
    /// @param registration the abort action registered for the underlying call, released on close
    public HttpTransportResponse(
        URI url,
        Response response,
        Duration timeout,
        CancellationToken cancellation,
        CancellationToken.Registration registration
    )
    {
        this.url = url;
        this.response = response;
        this.timeout = timeout;
        this.cancellation = cancellation;
        this.registration = registration;
        ResponseBody responseBody = response.body();
        InputStream raw = responseBody != null ? responseBody.byteStream() : InputStream.nullInputStream();
        this.body = new TranslatingInputStream(raw);
    }

    @Override
    public URI url() {
        return url;
    }

    @Override
    public int statusCode() {
        return response.code();
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(response.header(name));
    }

    @Override
    public long contentLength() {
        ResponseBody responseBody = response.body();
        if (responseBody != null && responseBody.contentLength() >= 0) {
            return responseBody.contentLength();
        }
        String declared = response.header("Content-Length");
        if (declared != null) {
            try {
                return Long.parseLong(declared.trim());
            } catch (NumberFormatException ignored) {
                // fall through to unknown
            }
        }
        return -1;
    }

    @Override
    public InputStream body() {
        if (closed) {
            throw new IllegalStateException("HttpTransportResponse has been closed");
        }
        return body;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            try {
                response.close();
            } finally {
                registration.close();
            }
        }
    }

    /// Body stream which rethrows OkHttp read failures as fetch exceptions.
    private final class TranslatingInputStream extends FilterInputStream {

        private TranslatingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (IOException e) {
                throw HttpTransportClient.translate(url, timeout, e, false, cancellation);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (IOException e) {
                throw HttpTransportClient.translate(url, timeout, e, false, cancellation);
            }
        }
    }
}
