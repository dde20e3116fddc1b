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
import java.nio.file.Path;

/// Writing the destination file failed. The partial file has already been removed by the time
/// this is thrown. Never retried.
public class DestinationWriteException extends FetchException {

    private final Path destination;

    /// @param url the URL whose body was being written
    /// @param destination the file that could not be written
    /// @param cause the filesystem failure
    public DestinationWriteException(URI url, Path destination, Throwable cause) {
        super("write to " + destination + " failed: " + cause.getMessage(), url, cause);
        this.destination = destination;
    }

    /// @return the file that could not be written
    public Path getDestination() {
        return destination;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
