/// Jetty-based HTTP fixture for tests.
///
/// [io.nosqlbench.bulkfetch.testserver.JettyFileServerExtension] starts one
/// [io.nosqlbench.bulkfetch.testserver.JettyFileServerFixture] per test JVM. Besides plain file
/// serving, the fixture mounts endpoints that redirect, stall, truncate or answer with arbitrary
/// status codes, so failure handling can be tested over a real connection.
package io.nosqlbench.bulkfetch.testserver;

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
