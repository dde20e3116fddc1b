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
import io.nosqlbench.bulkfetch.downloader.DownloadRequest;
import io.nosqlbench.bulkfetch.downloader.DownloadScheduler;
import io.nosqlbench.bulkfetch.downloader.config.DownloadSettings;
import io.nosqlbench.bulkfetch.downloader.config.DownloadSettingsLoader;
import io.nosqlbench.bulkfetch.transport.HttpTransportClient;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.regex.Matcher;

/// Downloads a list of URLs into a directory, several at a time.
///
/// Usage:
/// ```
/// fetch [-u url]... [-f urls.txt] [-o dir] [-c n] [--timeout ms] [--retries n]
///       [--retry-delay ms] [--max-redirects n] [--filename-template name] [--config file] [-v]
/// ```
///
/// Exits with 0 when every download succeeded and 1 otherwise, including when no URLs were given.
@CommandLine.Command(name = "fetch",
    header = "Download files from HTTP(S) URLs with bounded concurrency and retries",
    description = """
        Downloads every URL given with --url or listed in a --file into the output
        directory. Connection failures and timeouts are retried with linear backoff,
        redirects are followed, and a summary of successes and failures is printed
        at the end.
        """,
    mixinStandardHelpOptions = true)
public class CMD_fetch implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_fetch.class);

  /// Exit code when every download succeeded
  public static final int EXIT_OK = 0;
  /// Exit code when a download failed or nothing could be attempted
  public static final int EXIT_FAILED = 1;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"--url", "-u"}, description = "A URL to download; may be repeated")
  private List<String> urls = new ArrayList<>();

  @CommandLine.Option(names = {"--file", "-f"}, description = "A file listing URLs, one per line")
  private Path urlFile;

  @CommandLine.Option(names = {"--output", "-o"},
      defaultValue = "./downloads",
      description = "Output directory (default: ${DEFAULT-VALUE})")
  private Path outputDir;

  @CommandLine.Option(names = {"--concurrency", "-c"},
      description = "Number of concurrent downloads (default: 3)")
  private Integer concurrency;

  @CommandLine.Option(names = {"--timeout"}, description = "Per-attempt timeout in milliseconds (default: 30000)")
  private Long timeoutMs;

  @CommandLine.Option(names = {"--retries"}, description = "Maximum attempts per URL (default: 3)")
  private Integer retries;

  @CommandLine.Option(names = {"--retry-delay"},
      description = "Backoff unit in milliseconds; attempt n waits n times this (default: 1000)")
  private Long retryDelayMs;

  @CommandLine.Option(names = {"--max-redirects"},
      description = "Most redirects to follow per attempt, -1 for no limit (default: -1)")
  private Integer maxRedirects;

  @CommandLine.Option(names = {"--filename-template"},
      defaultValue = "default",
      converter = FilenameTemplate.Converter.class,
      completionCandidates = FilenameTemplate.Candidates.class,
      description = "How local file names are derived: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private FilenameTemplate filenameTemplate = FilenameTemplate.DEFAULT;

  @CommandLine.Option(names = {"--config"},
      description = "Settings file (default: ~/.config/bulkfetch/settings.yaml, if present)")
  private Path configFile;

  @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log more; repeat for debug output")
  private boolean[] verbosity = new boolean[0];

  private Clock clock = Clock.systemUTC();

  /// Run the fetch command directly
  public static void main(String[] args) {
    int exitCode = new CommandLine(new CMD_fetch()).execute(args);
    System.exit(exitCode);
  }

  /// Create a fetch command using the system clock
  public CMD_fetch() {
  }

  /// Create a fetch command with a fixed clock for file name templates
  CMD_fetch(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Integer call() {
    configureLogging(verbosity.length);
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();

    List<URI> targets;
    try {
      targets = collectUrls();
    } catch (IOException e) {
      err.println("Error: cannot read URL file " + urlFile + ": " + e.getMessage());
      return EXIT_FAILED;
    }
    if (targets.isEmpty()) {
      err.println("No URLs provided. Use --url or --file option.");
      return EXIT_FAILED;
    }

    DownloadSettings settings;
    try {
      settings = applyOptions(loadSettings());
    } catch (IOException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILED;
    }

    String home = Matcher.quoteReplacement(System.getProperty("user.home"));
    Path output = Path.of(outputDir.toString().replaceFirst("^~", home));
    try {
      Files.createDirectories(output);
    } catch (IOException e) {
      err.println("Error: cannot create output directory " + output + ": " + e.getMessage());
      return EXIT_FAILED;
    }

    List<DownloadRequest> requests = DownloadRequest.into(output, targets, uniqueNamer());
    Map<URI, String> labels = new HashMap<>();
    for (DownloadRequest request : requests) {
      labels.putIfAbsent(request.url(), request.destination().getFileName().toString());
    }

    out.println("Found " + targets.size() + " URLs to download");
    out.println("Starting download of " + requests.size() + " files with concurrency "
                + settings.concurrency() + "...");
    out.flush();

    AggregateResult result;
    try (HttpTransportClient transport = new HttpTransportClient()) {
      DownloadScheduler scheduler =
          new DownloadScheduler(settings, transport, new ConsoleProgressListener(out, labels));
      result = scheduler.run(requests);
    }

    DownloadSummary.print(out, result, output);
    return result.hasFailures() ? EXIT_FAILED : EXIT_OK;
  }

  private List<URI> collectUrls() throws IOException {
    List<URI> collected = new ArrayList<>();
    for (String url : urls) {
      Optional<URI> parsed = UrlListReader.parse(url);
      if (parsed.isPresent()) {
        collected.add(parsed.get());
      } else {
        logger.warn("Skipping invalid URL '{}'", url);
      }
    }
    if (urlFile != null) {
      collected.addAll(UrlListReader.read(urlFile));
    }
    return collected;
  }

  private DownloadSettings loadSettings() throws IOException {
    DownloadSettings defaults = DownloadSettings.defaults();
    if (configFile != null) {
      return DownloadSettingsLoader.load(configFile, defaults);
    }
    return DownloadSettingsLoader.loadOptional(defaults);
  }

  private DownloadSettings applyOptions(DownloadSettings settings) {
    if (concurrency != null) {
      settings = settings.withConcurrency(concurrency);
    }
    if (timeoutMs != null) {
      settings = settings.withTimeout(Duration.ofMillis(timeoutMs));
    }
    if (retries != null) {
      settings = settings.withMaxRetries(retries);
    }
    if (retryDelayMs != null) {
      settings = settings.withRetryBaseDelay(Duration.ofMillis(retryDelayMs));
    }
    if (maxRedirects != null) {
      settings = settings.withMaxRedirects(maxRedirects);
    }
    logger.debug("Effective settings: {}", settings);
    return settings;
  }

  /// Derives file names from the template, suffixing repeats so no two requests of the batch
  /// share a destination. The returned function is meant to be called once per request, in order.
  Function<URI, String> uniqueNamer() {
    Set<String> used = new HashSet<>();
    long now = clock.millis();
    return url -> {
      String name = filenameTemplate.fileName(url, now);
      String candidate = name;
      int n = 1;
      while (!used.add(candidate)) {
        candidate = withSuffix(name, n++);
      }
      return candidate;
    };
  }

  private static String withSuffix(String name, int n) {
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      return name.substring(0, dot) + "_" + n + name.substring(dot);
    }
    return name + "_" + n;
  }

  private static void configureLogging(int verbose) {
    if (verbose >= 2) {
      Configurator.setLevel("io.nosqlbench.bulkfetch", Level.DEBUG);
    } else if (verbose == 1) {
      Configurator.setLevel("io.nosqlbench.bulkfetch", Level.INFO);
    }
  }
}
