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
import java.nio.file.Path;
import java.util.List;

/// The outcome of a whole batch, split into successes and failures.
///
/// Both lists are in completion order, which need not match request order. Every request of the
/// batch appears in exactly one of them.
///
/// @param successful the downloads that completed
/// @param failed the downloads that did not, each with its reason
public record AggregateResult(List<Success> successful, List<Failure> failed) {

    public AggregateResult {
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
    }

    /// @return the number of requests covered
    public int total() {
        return successful.size() + failed.size();
    }

    /// @return true if at least one download failed
    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /// @return the total number of bytes written by the successful downloads
    public long totalBytes() {
        return successful.stream().mapToLong(Success::bytes).sum();
    }

    /// @param url the requested URL
    /// @param path the file it was written to
    /// @param bytes the size of the file
    public record Success(URI url, Path path, long bytes) {
    }

    /// @param url the requested URL
    /// @param reason why it failed
    public record Failure(URI url, String reason) {
    }
}
