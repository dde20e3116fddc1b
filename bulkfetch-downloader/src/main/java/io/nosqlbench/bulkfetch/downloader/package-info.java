/// Batch downloading on top of a single-attempt transport.
///
/// - [io.nosqlbench.bulkfetch.downloader.DownloadScheduler] admits requests under a concurrency cap
/// - [io.nosqlbench.bulkfetch.downloader.DownloadTask] runs the retry, backoff and redirect state machine for one request
/// - [io.nosqlbench.bulkfetch.downloader.StreamingWriter] copies bodies to disk and removes partial files
/// - [io.nosqlbench.bulkfetch.downloader.ResultAggregator] records one outcome per request
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
