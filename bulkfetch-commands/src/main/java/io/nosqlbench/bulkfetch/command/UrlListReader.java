package io.nosqlbench.bulkfetch.command;

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

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Reads a list of URLs, one per line.
///
/// Lines are trimmed. Blank lines and lines starting with `#` are skipped, and so are lines that
/// are not absolute http or https URLs, with a warning.
public final class UrlListReader {

  private static final Logger logger = LogManager.getLogger(UrlListReader.class);

  private UrlListReader() {
  }

  /// @param file a UTF-8 text file
  /// @return the valid URLs, in file order
  /// @throws IOException if the file cannot be read
  public static List<URI> read(Path file) throws IOException {
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    List<URI> urls = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      Optional<URI> url = parse(line);
      if (url.isPresent()) {
        urls.add(url.get());
      } else {
        logger.warn("{}:{}: skipping invalid URL '{}'", file, i + 1, line);
      }
    }
    logger.debug("Read {} URLs from {}", urls.size(), file);
    return urls;
  }

  /// @param text a candidate URL
  /// @return the URL if it is an absolute http or https URL with a host
  public static Optional<URI> parse(String text) {
    try {
      URI uri = new URI(text.trim());
      String scheme = uri.getScheme();
      if (scheme == null || uri.getHost() == null) {
        return Optional.empty();
      }
      if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) {
        return Optional.empty();
      }
      return Optional.of(uri);
    } catch (URISyntaxException e) {
      logger.debug("Not a URI: '{}' ({})", text, e.getMessage());
      return Optional.empty();
    }
  }
}
