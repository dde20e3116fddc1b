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

/// Mutable bookkeeping for one running [DownloadTask].
///
/// Only the task that owns the state touches it, so it is not thread-safe. Transitions that the
/// lifecycle in [DownloadTaskStatus] does not allow throw [IllegalStateException].
public final class DownloadTaskState {

    private final DownloadRequest request;
    private volatile DownloadTaskStatus status = DownloadTaskStatus.PENDING;
    private int attempt = 0;
    private int redirects = 0;
    private URI currentUrl;
    private long bytesWritten = 0;
    private long totalBytes = -1;

    /// @param request the request this state tracks
    public DownloadTaskState(DownloadRequest request) {
        this.request = request;
        this.currentUrl = request.url();
    }

    /// Starts an attempt. From PENDING this is attempt 1; from RETRYING the attempt counter
    /// advances by one.
    public void beginAttempt() {
        switch (status) {
            case PENDING:
            case RETRYING:
                attempt++;
                status = DownloadTaskStatus.IN_FLIGHT;
                bytesWritten = 0;
                totalBytes = -1;
                break;
            default:
                throw illegal("begin an attempt");
        }
    }

    /// Follows a redirect within the current attempt. The attempt counter does not change.
    ///
    /// @param target the resolved redirect target
    public void redirectTo(URI target) {
        requireStatus(DownloadTaskStatus.IN_FLIGHT, "follow a redirect");
        redirects++;
        currentUrl = target;
    }

    /// Records the declared length of the body about to be streamed.
    ///
    /// @param totalBytes the declared length, or -1 if unknown
    public void beginBody(long totalBytes) {
        requireStatus(DownloadTaskStatus.IN_FLIGHT, "begin a body");
        this.totalBytes = totalBytes;
        this.bytesWritten = 0;
    }

    /// @param bytesWritten the cumulative number of body bytes written so far
    public void progress(long bytesWritten) {
        requireStatus(DownloadTaskStatus.IN_FLIGHT, "record progress");
        this.bytesWritten = bytesWritten;
    }

    /// Moves to RETRYING after a retriable failure.
    public void retrying() {
        requireStatus(DownloadTaskStatus.IN_FLIGHT, "retry");
        status = DownloadTaskStatus.RETRYING;
    }

    /// Moves to SUCCEEDED.
    ///
    /// @param bytesWritten the final size of the destination file
    public void succeeded(long bytesWritten) {
        requireStatus(DownloadTaskStatus.IN_FLIGHT, "succeed");
        this.bytesWritten = bytesWritten;
        status = DownloadTaskStatus.SUCCEEDED;
    }

    /// Moves to FAILED. Allowed from any non-terminal state, since cancellation can strike
    /// before the first attempt.
    public void failed() {
        if (status.isTerminal()) {
            throw illegal("fail");
        }
        status = DownloadTaskStatus.FAILED;
    }

    private void requireStatus(DownloadTaskStatus required, String action) {
        if (status != required) {
            throw illegal(action);
        }
    }

    private IllegalStateException illegal(String action) {
        return new IllegalStateException(
            "cannot " + action + " while " + status + " for " + request.url());
    }

    /// @return the request this state tracks
    public DownloadRequest request() {
        return request;
    }

    /// @return the current lifecycle state
    public DownloadTaskStatus status() {
        return status;
    }

    /// @return the 1-based number of the current or last attempt, 0 before the first
    public int attempt() {
        return attempt;
    }

    /// @return how many redirects have been followed across all attempts
    public int redirects() {
        return redirects;
    }

    /// @return the URL the current or next attempt talks to
    public URI currentUrl() {
        return currentUrl;
    }

    /// @return body bytes written by the current attempt
    public long bytesWritten() {
        return bytesWritten;
    }

    /// @return declared body length of the current attempt, or -1 if unknown
    public long totalBytes() {
        return totalBytes;
    }

    @Override
    public String toString() {
        return "DownloadTaskState{" + request.url() + " " + status + " attempt=" + attempt
               + " bytes=" + bytesWritten + "/" + totalBytes + "}";
    }
}
