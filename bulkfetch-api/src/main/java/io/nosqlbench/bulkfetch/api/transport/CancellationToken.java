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

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// A one-way cancellation flag shared between a batch and everything working on its behalf.
///
/// Work checks [#isCancelled()] or [#throwIfCancelled(URI)] at its suspension points. Blocking
/// calls that cannot poll, like an in-flight HTTP call, register an abort action with
/// [#onCancel(Runnable)] for the duration of the call.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch released = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /// Creates a token which has not been cancelled.
    public CancellationToken() {
    }

    /// @return a fresh token that nothing else holds, so it will never be cancelled
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /// Cancels the token and runs every registered abort action once.
    ///
    /// Calling this more than once has no further effect.
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            released.countDown();
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    /// @return true once [#cancel()] has been called
    public boolean isCancelled() {
        return cancelled.get();
    }

    /// @param url the URL being worked on, for the exception message
    /// @throws FetchCancelledException if the token has been cancelled
    public void throwIfCancelled(URI url) throws FetchCancelledException {
        if (cancelled.get()) {
            throw new FetchCancelledException(url);
        }
    }

    /// Waits for the given time, returning early if the token is cancelled meanwhile.
    ///
    /// @param duration how long to wait
    /// @return true if the token was cancelled before the time was up
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean awaitCancellation(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return cancelled.get();
        }
        return released.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /// Registers an abort action. If the token is already cancelled the action runs immediately.
    ///
    /// @param action the action to run on cancellation
    /// @return a registration which removes the action when closed
    public Registration onCancel(Runnable action) {
        listeners.add(action);
        if (cancelled.get()) {
            listeners.remove(action);
            action.run();
        }
        return () -> listeners.remove(action);
    }

    /// A handle for an abort action registered with [#onCancel(Runnable)].
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
