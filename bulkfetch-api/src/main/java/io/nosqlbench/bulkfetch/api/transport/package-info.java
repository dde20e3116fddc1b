/// Contracts shared by the transport and the downloader.
///
/// A [io.nosqlbench.bulkfetch.api.transport.TransportClient] performs one GET per call and
/// returns a [io.nosqlbench.bulkfetch.api.transport.TransportResponse] whose body is read as a
/// stream. Failures are reported through the
/// [io.nosqlbench.bulkfetch.api.transport.FetchException] hierarchy:
///
/// | exception | retriable |
/// |---|---|
/// | `FetchConnectionException` | yes |
/// | `FetchTimeoutException` | yes |
/// | `HttpStatusException` | no |
/// | `DestinationWriteException` | no |
/// | `RedirectLimitException` | no |
/// | `FetchCancelledException` | no |
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
