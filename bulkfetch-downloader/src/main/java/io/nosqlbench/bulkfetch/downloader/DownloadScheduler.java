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
import io.nosqlbench.bulkfetch.api.transport.TransportClient;
import io.nosqlbench.bulkfetch.downloader.config.DownloadSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs a batch of [DownloadRequest]s with at most `concurrencyLimit` in flight.
///
/// Each batch gets a coordinator thread that alone owns the pending queue and the active count.
/// Requests are admitted in input order. The coordinator blocks until some task finishes, records
/// its outcome and then fills every free slot before blocking again. Tasks run on a fixed pool of
/// `concurrencyLimit` worker threads, so the limit also holds at the thread level.
///
/// A failed request frees its slot like any other, and the batch ends only when nothing is
/// pending and nothing is active. Every request gets exactly one outcome.
///
/// ```java
/// DownloadScheduler scheduler = new DownloadScheduler(settings, transport, listener);
/// AggregateResult result = scheduler.run(requests);
/// ```
public class DownloadScheduler {

    private static final Logger logger = LogManager.getLogger(DownloadScheduler.class);
    private static final AtomicInteger BATCH_SEQ = new AtomicInteger();

    private final DownloadSettings settings;
    private final TransportClient transport;
    private final ProgressListener progressListener;

    /// @param settings batch settings; `concurrency` is the default limit
    /// @param transport the transport all tasks share
    /// @param progressListener receives progress from every task
    public DownloadScheduler(DownloadSettings settings, TransportClient transport, ProgressListener progressListener) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.progressListener = progressListener != null ? progressListener : ProgressListener.NONE;
    }

    /// @param settings batch settings
    /// @param transport the transport all tasks share
    public DownloadScheduler(DownloadSettings settings, TransportClient transport) {
        this(settings, transport, ProgressListener.NONE);
    }

    /// Runs the batch with the configured concurrency and waits for it.
    ///
    /// @param requests the requests, admitted in this order
    /// @return the aggregate result
    public AggregateResult run(List<DownloadRequest> requests) {
        return start(requests).join();
    }

    /// Runs the batch and waits for it.
    ///
    /// @param requests the requests, admitted in this order
    /// @param concurrencyLimit the most downloads in flight at once
    /// @return the aggregate result
    public AggregateResult run(List<DownloadRequest> requests, int concurrencyLimit) {
        return start(requests, concurrencyLimit).join();
    }

    /// Starts the batch with the configured concurrency.
    ///
    /// @param requests the requests, admitted in this order
    /// @return a handle on the running batch
    public DownloadBatch start(List<DownloadRequest> requests) {
        return start(requests, settings.concurrency());
    }

    /// Starts the batch in the background.
    ///
    /// @param requests the requests, admitted in this order
    /// @param concurrencyLimit the most downloads in flight at once
    /// @return a handle on the running batch
    public DownloadBatch start(List<DownloadRequest> requests, int concurrencyLimit) {
        Objects.requireNonNull(requests, "requests");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, was " + concurrencyLimit);
        }
        List<DownloadRequest> batchRequests = List.copyOf(requests);
        DownloadBatch batch = new DownloadBatch(batchRequests.size(), new CancellationToken());
        if (batchRequests.isEmpty()) {
            batch.complete(new AggregateResult(List.of(), List.of()));
            return batch;
        }

        int batchId = BATCH_SEQ.incrementAndGet();
        BatchRun run = new BatchRun(batchId, batchRequests, concurrencyLimit, batch);
        Thread coordinator = new Thread(run, "bulkfetch-batch-" + batchId);
        coordinator.setDaemon(true);
        coordinator.start();
        return batch;
    }

    private record Completion(int index, DownloadOutcome outcome) {
    }

    /// The coordinator loop for one batch. Only the coordinator thread touches `pending` and
    /// `active`; workers hand their outcomes back through `completions`.
    private final class BatchRun implements Runnable {

        private final int batchId;
        private final List<DownloadRequest> requests;
        private final int limit;
        private final DownloadBatch batch;
        private final ResultAggregator aggregator;
        private final Deque<Integer> pending = new ArrayDeque<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private int active = 0;

        BatchRun(int batchId, List<DownloadRequest> requests, int limit, DownloadBatch batch) {
            this.batchId = batchId;
            this.requests = requests;
            this.limit = limit;
            this.batch = batch;
            this.aggregator = new ResultAggregator(requests.size());
            for (int i = 0; i < requests.size(); i++) {
                pending.add(i);
            }
        }

        @Override
        public void run() {
            int workerCount = Math.min(limit, requests.size());
            AtomicInteger workerSeq = new AtomicInteger();
            ExecutorService workers = Executors.newFixedThreadPool(workerCount, r -> {
                Thread t = new Thread(r, "bulkfetch-" + batchId + "-worker-" + workerSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            boolean interrupted = false;
            logger.debug("Batch {}: {} requests, concurrency {}", batchId, requests.size(), limit);
            try {
                admit(workers);
                while (active > 0) {
                    Completion completion;
                    try {
                        completion = completions.take();
                    } catch (InterruptedException e) {
                        interrupted = true;
                        logger.warn("Batch {} coordinator interrupted, cancelling", batchId);
                        batch.cancel();
                        continue;
                    }
                    active--;
                    record(completion, true);
                    admit(workers);
                }
                AggregateResult result = aggregator.toResult();
                logger.debug("Batch {} done: {} succeeded, {} failed",
                    batchId, result.successful().size(), result.failed().size());
                batch.complete(result);
            } catch (RuntimeException | Error e) {
                logger.error("Batch {} coordinator failed", batchId, e);
                batch.fail(e);
            } finally {
                workers.shutdownNow();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        private void admit(ExecutorService workers) {
            CancellationToken cancellation = batch.cancellation();
            while (!pending.isEmpty() && (active < limit || cancellation.isCancelled())) {
                int index = pending.poll();
                DownloadRequest request = requests.get(index);
                if (cancellation.isCancelled()) {
                    record(new Completion(index, DownloadOutcome.cancelled(request)), false);
                    continue;
                }
                DownloadTask task = new DownloadTask(request, transport, settings, progressListener, cancellation);
                active++;
                batch.onAdmitted();
                logger.debug("Batch {}: admitted {} ({} active)", batchId, request.url(), active);
                CompletableFuture.supplyAsync(task::call, workers)
                    .whenComplete((outcome, error) -> completions.add(new Completion(index,
                        outcome != null ? outcome : DownloadOutcome.failed(request, DownloadOutcome.reasonOf(error)))));
            }
        }

        private void record(Completion completion, boolean wasActive) {
            aggregator.record(completion.index(), completion.outcome());
            batch.onFinished(wasActive);
        }
    }
}
