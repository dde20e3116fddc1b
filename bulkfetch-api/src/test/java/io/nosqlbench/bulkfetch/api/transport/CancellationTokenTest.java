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

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CancellationTokenTest {

    private static final URI URL = URI.create("http://example.com/a.bin");

    @Test
    public void testCancelRunsRegisteredActionsOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger aborted = new AtomicInteger();
        token.onCancel(aborted::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(aborted.get()).isEqualTo(1);
    }

    @Test
    public void testClosedRegistrationIsNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger aborted = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(aborted::incrementAndGet);
        registration.close();

        token.cancel();

        assertThat(aborted.get()).isZero();
    }

    @Test
    public void testLateRegistrationRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger aborted = new AtomicInteger();

        token.onCancel(aborted::incrementAndGet);

        assertThat(aborted.get()).isEqualTo(1);
    }

    @Test
    public void testThrowIfCancelled() throws Exception {
        CancellationToken token = new CancellationToken();
        token.throwIfCancelled(URL);

        token.cancel();

        assertThatThrownBy(() -> token.throwIfCancelled(URL))
            .isInstanceOf(FetchCancelledException.class)
            .hasMessage("cancelled");
    }

    @Test
    public void testAwaitCancellationReturnsEarly() throws Exception {
        CancellationToken token = new CancellationToken();
        assertThat(token.awaitCancellation(java.time.Duration.ofMillis(20))).isFalse();

        java.util.concurrent.CompletableFuture.delayedExecutor(50, java.util.concurrent.TimeUnit.MILLISECONDS)
            .execute(token::cancel);
        long start = System.nanoTime();
        assertThat(token.awaitCancellation(java.time.Duration.ofSeconds(10))).isTrue();
        assertThat(System.nanoTime() - start).isLessThan(java.util.concurrent.TimeUnit.SECONDS.toNanos(5));
    }

    @Test
    public void testRetriableClassification() {
        assertThat(new FetchConnectionException(URL, new java.net.ConnectException("refused")).isRetriable()).isTrue();
        assertThat(new FetchTimeoutException(URL, java.time.Duration.ofMillis(50), null).isRetriable()).isTrue();
        assertThat(new HttpStatusException(URL, 404).isRetriable()).isFalse();
        assertThat(new HttpStatusException(URL, 404).getMessage()).isEqualTo("HTTP 404");
        assertThat(new RedirectLimitException(URL, 10).isRetriable()).isFalse();
        assertThat(new FetchCancelledException(URL).isRetriable()).isFalse();
    }
}
