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

/// Lifecycle of a single download task.
///
/// ```
/// PENDING -> IN_FLIGHT -> SUCCEEDED
///                      -> FAILED
///                      -> RETRYING -> IN_FLIGHT
/// ```
public enum DownloadTaskStatus {
    /// Admitted, no attempt started yet
    PENDING,
    /// An attempt is talking to the server or streaming the body
    IN_FLIGHT,
    /// The last attempt failed in a retriable way; waiting out the backoff
    RETRYING,
    /// The body was fully written to the destination
    SUCCEEDED,
    /// Gave up; the destination holds no partial file
    FAILED;

    /// @return true for the states no transition leaves
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
