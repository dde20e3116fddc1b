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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;

/// Thins out per-chunk byte counts into [ProgressEvent]s.
///
/// With a known total an event goes out each time the whole percentage advances by at least the
/// threshold, and once more on completion at 100%. With an unknown total only the completion
/// event is sent, carrying the final byte count and a percent of -1.
final class ProgressEmitter {

    private static final Logger logger = LogManager.getLogger(ProgressEmitter.class);

    private final URI url;
    private final long totalBytes;
    private final int thresholdPercent;
    private final ProgressListener listener;
    private int lastReportedPercent = 0;

    ProgressEmitter(URI url, long totalBytes, int thresholdPercent, ProgressListener listener) {
        this.url = url;
        this.totalBytes = totalBytes;
        this.thresholdPercent = Math.max(1, thresholdPercent);
        this.listener = listener;
    }

    void onBytes(long bytesWritten) {
        if (totalBytes <= 0) {
            return;
        }
        int percent = (int) Math.min(100, bytesWritten * 100 / totalBytes);
        if (percent >= 100) {
            return;
        }
        if (percent - lastReportedPercent >= thresholdPercent) {
            lastReportedPercent = percent;
            emit(new ProgressEvent(url, bytesWritten, totalBytes, percent));
        }
    }

    void complete(long bytesWritten) {
        lastReportedPercent = 100;
        emit(ProgressEvent.of(url, bytesWritten, totalBytes));
    }

    private void emit(ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed for {}: {}", url, e.toString());
        }
    }
}
