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

/// Receives [ProgressEvent]s from download tasks.
///
/// Called on worker threads, possibly from several tasks at once. Listeners are observers
/// only: an exception thrown from [#onProgress(ProgressEvent)] is logged and otherwise ignored.
@FunctionalInterface
public interface ProgressListener {

    /// A listener which ignores every event.
    ProgressListener NONE = event -> {
    };

    /// @param event the progress snapshot
    void onProgress(ProgressEvent event);
}
