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

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/// One resource to fetch and the file to store it in.
///
/// @param url the absolute http or https URL to fetch
/// @param destination the file the body is written to
public record DownloadRequest(URI url, Path destination) {

    /// Validates the request.
    ///
    /// @param url the absolute URL to fetch
    /// @param destination the file the body is written to
    public DownloadRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(destination, "destination");
        if (!url.isAbsolute()) {
            throw new IllegalArgumentException("URL must be absolute: " + url);
        }
    }

    /// Builds one request per URL, all placed in the same directory.
    ///
    /// @param urls the URLs, in the order they should be admitted
    /// @param outputDirectory the directory the files are written into
    /// @param fileNamer derives a file name from each URL
    /// @return the requests, in input order
    public static List<DownloadRequest> into(
        Path outputDirectory,
        Collection<URI> urls,
        Function<URI, String> fileNamer
    )
    {
        List<DownloadRequest> requests = new ArrayList<>(urls.size());
        for (URI url : urls) {
            requests.add(new DownloadRequest(url, outputDirectory.resolve(fileNamer.apply(url))));
        }
        return requests;
    }
}
