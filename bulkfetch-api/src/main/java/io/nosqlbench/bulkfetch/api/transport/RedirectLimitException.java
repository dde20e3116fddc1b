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

/// A redirect chain exceeded the configured hop limit. Only raised when a limit is configured;
/// by default redirect chains are followed without bound.
public class RedirectLimitException extends FetchException {

    private final int hops;

    /// @param url the URL the chain was at when the limit was hit
    /// @param hops the number of redirects already followed
    public RedirectLimitException(URI url, int hops) {
        super("too many redirects (" + hops + ")", url, null);
        this.hops = hops;
    }

    /// @return the number of redirects already followed
    public int getHops() {
        return hops;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
