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

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DownloadTaskStateTest {

    private final DownloadRequest request =
        new DownloadRequest(URI.create("https://files.test/x.bin"), Path.of("x.bin"));

    @Test
    void testRetryCycleAdvancesAttempt() {
        DownloadTaskState state = new DownloadTaskState(request);
        assertThat(state.status()).isEqualTo(DownloadTaskStatus.PENDING);
        assertThat(state.attempt()).isZero();

        state.beginAttempt();
        state.beginBody(100);
        state.progress(40);
        state.retrying();
        state.beginAttempt();

        assertThat(state.attempt()).isEqualTo(2);
        assertThat(state.status()).isEqualTo(DownloadTaskStatus.IN_FLIGHT);
        assertThat(state.bytesWritten()).isZero();
        assertThat(state.totalBytes()).isEqualTo(-1);

        state.succeeded(100);
        assertThat(state.status().isTerminal()).isTrue();
    }

    @Test
    void testRedirectKeepsAttemptAndMovesUrl() {
        DownloadTaskState state = new DownloadTaskState(request);
        state.beginAttempt();
        URI target = URI.create("https://mirror.test/x.bin");

        state.redirectTo(target);

        assertThat(state.attempt()).isEqualTo(1);
        assertThat(state.redirects()).isEqualTo(1);
        assertThat(state.currentUrl()).isEqualTo(target);
    }

    @Test
    void testIllegalTransitionsThrow() {
        DownloadTaskState state = new DownloadTaskState(request);
        assertThatThrownBy(state::retrying).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> state.succeeded(1)).isInstanceOf(IllegalStateException.class);

        state.beginAttempt();
        assertThatThrownBy(state::beginAttempt).isInstanceOf(IllegalStateException.class);

        state.failed();
        assertThatThrownBy(state::failed).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(state::beginAttempt).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testPendingTaskCanFailWithoutAttempt() {
        DownloadTaskState state = new DownloadTaskState(request);
        state.failed();
        assertThat(state.status()).isEqualTo(DownloadTaskStatus.FAILED);
        assertThat(state.attempt()).isZero();
    }
}
