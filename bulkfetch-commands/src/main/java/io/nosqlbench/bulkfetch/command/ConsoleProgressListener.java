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

import io.nosqlbench.bulkfetch.downloader.ProgressEvent;
import io.nosqlbench.bulkfetch.downloader.ProgressListener;

import java.io.PrintWriter;
import java.net.URI;
import java.util.Locale;
import java.util.Map;

/// Prints one line per progress event, labelled with the local file name.
public class ConsoleProgressListener implements ProgressListener {

  private static final double MB = 1024.0 * 1024.0;

  private final PrintWriter out;
  private final Map<URI, String> labels;

  /// @param out where to print
  /// @param labels display names by requested URL; URLs without one are shown as-is
  public ConsoleProgressListener(PrintWriter out, Map<URI, String> labels) {
    this.out = out;
    this.labels = Map.copyOf(labels);
  }

  @Override
  public void onProgress(ProgressEvent event) {
    String label = labels.getOrDefault(event.url(), event.url().toString());
    String line;
    if (event.hasKnownTotal()) {
      line = String.format(Locale.ROOT, "%s: %d%% (%.2f/%.2f MB)",
          label, event.percent(), event.bytesWritten() / MB, event.totalBytes() / MB);
    } else {
      line = String.format(Locale.ROOT, "%s: %.2f MB", label, event.bytesWritten() / MB);
    }
    synchronized (out) {
      out.println(line);
      out.flush();
    }
  }
}
