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

import io.nosqlbench.bulkfetch.api.transport.FetchCancelledException;
import io.nosqlbench.bulkfetch.api.transport.FetchException;

import java.util.Objects;

/// The terminal outcome of one [DownloadTask].
///
/// @param request the request the outcome belongs to
/// @param status either [DownloadTaskStatus#SUCCEEDED] or [DownloadTaskStatus#FAILED]
/// @param bytes bytes written to the destination, 0 for failures
/// @param reason the failure reason, null for successes
/// @param error the exception that ended the task, if there was one
public record DownloadOutcome(
    DownloadRequest request,
    DownloadTaskStatus status,
    long bytes,
    String reason,
    FetchException error
) {

    public DownloadOutcome {
        Objects.requireNonNull(request, "request");
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal, was " + status);
        }
        if (status == DownloadTaskStatus.FAILED && reason == null) {
            throw new IllegalArgumentException("a failed outcome needs a reason");
        }
    }

    /// @param request the request
    /// @param bytes bytes written
    /// @return a successful outcome
    public static DownloadOutcome succeeded(DownloadRequest request, long bytes) {
        return new DownloadOutcome(request, DownloadTaskStatus.SUCCEEDED, bytes, null, null);
    }

    /// @param request the request
    /// @param error the exception that ended the task
    /// @return a failed outcome whose reason is the exception message
    public static DownloadOutcome failed(DownloadRequest request, FetchException error) {
        return new DownloadOutcome(request, DownloadTaskStatus.FAILED, 0, reasonOf(error), error);
    }

    /// @param request the request
    /// @param reason why it failed
    /// @return a failed outcome without an associated [FetchException]
    public static DownloadOutcome failed(DownloadRequest request, String reason) {
        return new DownloadOutcome(request, DownloadTaskStatus.FAILED, 0, reason, null);
    }

    /// @param request a request that was never admitted, or was aborted, because its batch was cancelled
    /// @return a failed outcome with reason `cancelled`
    public static DownloadOutcome cancelled(DownloadRequest request) {
        return failed(request, new FetchCancelledException(request.url()));
    }

    /// @return true if the body was fully written
    public boolean isSuccess() {
        return status == DownloadTaskStatus.SUCCEEDED;
    }

    static String reasonOf(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
