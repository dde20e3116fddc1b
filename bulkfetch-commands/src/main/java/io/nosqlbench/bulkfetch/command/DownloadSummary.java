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

import io.nosqlbench.bulkfetch.downloader.AggregateResult;

import java.io.PrintWriter;
import java.nio.file.Path;

/// Renders the end-of-run report.
public final class DownloadSummary {

  private static final String RULE = "=".repeat(50);

  private DownloadSummary() {
  }

  /// @param out where to print
  /// @param result the batch result
  /// @param outputDirectory where the files went
  public static void print(PrintWriter out, AggregateResult result, Path outputDirectory) {
    out.println();
    out.println(RULE);
    out.println("DOWNLOAD SUMMARY");
    out.println(RULE);
    out.println("Successful: " + result.successful().size());
    out.println("Failed: " + result.failed().size());
    out.println("Output directory: " + outputDirectory.toAbsolutePath().normalize());
    if (result.hasFailures()) {
      out.println();
      out.println("Failed downloads:");
      for (AggregateResult.Failure failure : result.failed()) {
        out.println("  - " + failure.url() + ": " + failure.reason());
      }
    }
    out.flush();
  }
}
