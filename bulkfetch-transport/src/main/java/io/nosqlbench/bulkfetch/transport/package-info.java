/// OkHttp implementation of the single-attempt transport contract.
///
/// [io.nosqlbench.bulkfetch.transport.HttpTransportClient] issues one GET per call and never
/// follows redirects or retries on its own. Response bodies are streamed through
/// [io.nosqlbench.bulkfetch.transport.HttpTransportResponse], which reports stalls as
/// timeouts and broken connections as connection failures.
package io.nosqlbench.bulkfetch.transport;

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
