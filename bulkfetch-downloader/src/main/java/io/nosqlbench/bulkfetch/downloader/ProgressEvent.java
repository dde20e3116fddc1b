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

import java.net.URI;

/// A snapshot of how far one download has come.
///
/// @param url the requested URL (not a redirect target)
/// @param bytesWritten body bytes written to the destination so far
/// @param totalBytes declared body length, or -1 if the server did not declare one
/// @param percent rounded completion percentage, or -1 if the total is unknown
public record ProgressEvent(URI url, long bytesWritten, long totalBytes, int percent) {

    /// Builds an event, deriving the percentage from the byte counts.
    ///
    /// @param url the requested URL
    /// @param bytesWritten body bytes written so far
    /// @param totalBytes declared body length, or -1
    /// @return the event
    public static ProgressEvent of(URI url, long bytesWritten, long totalBytes) {
        int percent = totalBytes > 0
            ? (int) Math.round(bytesWritten * 100.0 / totalBytes)
            : (totalBytes == 0 ? 100 : -1);
        return new ProgressEvent(url, bytesWritten, totalBytes, percent);
    }

    /// @return true if the server declared the body length
    public boolean hasKnownTotal() {
        return totalBytes >= 0;
    }

    /// @return true if this event reports a fully written body of known length
    public boolean isComplete() {
        return hasKnownTotal() && bytesWritten >= totalBytes;
    }
}
