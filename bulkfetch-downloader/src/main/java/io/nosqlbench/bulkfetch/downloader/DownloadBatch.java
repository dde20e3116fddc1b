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

import io.nosqlbench.bulkfetch.api.transport.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/// A handle on a running batch, returned by [DownloadScheduler#start].
public final class DownloadBatch {

    private final int total;
    private final CancellationToken cancellation;
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final CompletableFuture<AggregateResult> result = new CompletableFuture<>();

    DownloadBatch(int total, CancellationToken cancellation) {
        this.total = total;
        this.cancellation = cancellation;
    }

    void onAdmitted() {
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
    }

    void onFinished(boolean wasActive) {
        if (wasActive) {
            active.decrementAndGet();
        }
        completed.incrementAndGet();
    }

    void complete(AggregateResult aggregate) {
        result.complete(aggregate);
    }

    void fail(Throwable error) {
        result.completeExceptionally(error);
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    /// Cancels the batch. Requests not yet admitted fail with reason `cancelled`, in-flight
    /// transfers are aborted and backoff waits end early. The result still covers every request.
    public void cancel() {
        cancellation.cancel();
    }

    /// @return true once [#cancel()] has been called
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /// @return the number of requests in the batch
    public int total() {
        return total;
    }

    /// @return the number of requests with a terminal outcome so far
    public int completed() {
        return completed.get();
    }

    /// @return the number of tasks running right now
    public int activeCount() {
        return active.get();
    }

    /// @return the most tasks that ran at the same time
    public int peakActiveCount() {
        return peakActive.get();
    }

    /// @return a future completed with the aggregate once every request has an outcome
    public CompletableFuture<AggregateResult> result() {
        return result;
    }

    /// @return true once the aggregate is available
    public boolean isDone() {
        return result.isDone();
    }

    /// Waits for the batch to finish.
    ///
    /// @return the aggregate result
    public AggregateResult join() {
        return result.join();
    }

    /// Waits for the batch to finish, up to a limit.
    ///
    /// @param timeout how long to wait
    /// @return the aggregate result
    /// @throws InterruptedException if the waiting thread is interrupted
    /// @throws ExecutionException if the batch coordinator itself failed
    /// @throws TimeoutException if the batch is still running after `timeout`
    public AggregateResult get(Duration timeout)
        throws InterruptedException, ExecutionException, TimeoutException
    {
        return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "DownloadBatch{" + completed.get() + "/" + total + " active=" + active.get()
               + (isCancelled() ? " cancelled" : "") + "}";
    }
}
