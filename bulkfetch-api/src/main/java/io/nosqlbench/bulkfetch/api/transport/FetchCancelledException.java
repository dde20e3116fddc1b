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

/// The batch was cancelled while this fetch was pending, in flight, or backing off.
public class FetchCancelledException extends FetchException {

    /// @param url the URL whose fetch was cancelled
    public FetchCancelledException(URI url) {
        super("cancelled", url, null);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
