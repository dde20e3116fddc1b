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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/// Collects exactly one [DownloadOutcome] per request of a batch.
///
/// Outcomes are keyed by the request's position in the batch, so the same URL requested twice
/// still yields two entries. Recording a position twice is a bug and throws.
public final class ResultAggregator {

    private final int expected;
    private final BitSet recorded;
    private final List<AggregateResult.Success> successful = new ArrayList<>();
    private final List<AggregateResult.Failure> failed = new ArrayList<>();

    /// @param expected the number of requests in the batch
    public ResultAggregator(int expected) {
        if (expected < 0) {
            throw new IllegalArgumentException("expected must be >= 0, was " + expected);
        }
        this.expected = expected;
        this.recorded = new BitSet(expected);
    }

    /// Records the outcome for one request.
    ///
    /// @param index the request's position in the batch
    /// @param outcome its terminal outcome
    /// @throws IllegalStateException if this position already has an outcome
    public synchronized void record(int index, DownloadOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (index < 0 || index >= expected) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for " + expected + " requests");
        }
        if (recorded.get(index)) {
            throw new IllegalStateException(
                "outcome for request " + index + " (" + outcome.request().url() + ") already recorded");
        }
        recorded.set(index);
        DownloadRequest request = outcome.request();
        if (outcome.isSuccess()) {
            successful.add(new AggregateResult.Success(request.url(), request.destination(), outcome.bytes()));
        } else {
            failed.add(new AggregateResult.Failure(request.url(), outcome.reason()));
        }
    }

    /// @return how many outcomes have been recorded
    public synchronized int recordedCount() {
        return recorded.cardinality();
    }

    /// @return true once every request has an outcome
    public synchronized boolean isComplete() {
        return recorded.cardinality() == expected;
    }

    /// @return the aggregate result
    /// @throws IllegalStateException if some requests have no outcome yet
    public synchronized AggregateResult toResult() {
        if (!isComplete()) {
            throw new IllegalStateException(
                "only " + recorded.cardinality() + " of " + expected + " outcomes recorded");
        }
        return new AggregateResult(successful, failed);
    }
}
