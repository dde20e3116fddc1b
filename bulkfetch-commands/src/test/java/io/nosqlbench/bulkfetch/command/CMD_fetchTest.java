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

import io.nosqlbench.bulkfetch.testserver.JettyFileServerExtension;
import io.nosqlbench.bulkfetch.testserver.JettyFileServerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(JettyFileServerExtension.class)
public class CMD_fetchTest {

  @TempDir
  Path tempDir;

  private JettyFileServerFixture server;
  private Path emptyConfig;
  private StringWriter out;
  private StringWriter err;

  @BeforeEach
  public void setUp() throws Exception {
    server = JettyFileServerExtension.getServer();
    emptyConfig = tempDir.resolve("settings.yaml");
    Files.writeString(emptyConfig, "");
    out = new StringWriter();
    err = new StringWriter();
  }

  private int execute(String... args) {
    List<String> all = new ArrayList<>(List.of(args));
    all.add("--config");
    all.add(emptyConfig.toString());
    Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    CommandLine commandLine = new CommandLine(new CMD_fetch(clock));
    commandLine.setOut(new PrintWriter(out, true));
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(all.toArray(new String[0]));
  }

  private static byte[] text(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testDownloadsAllUrlsAndExitsZero() throws Exception {
    URI a = JettyFileServerExtension.publish("cli/ok/a.txt", text("alpha"));
    URI b = JettyFileServerExtension.publish("cli/ok/b.txt", text("bravo"));
    Path output = tempDir.resolve("out");

    int exit = execute("-u", a.toString(), "--url", b.toString(), "-o", output.toString(), "-c", "2");

    assertThat(exit).isEqualTo(0);
    assertThat(Files.readString(output.resolve("a.txt"))).isEqualTo("alpha");
    assertThat(Files.readString(output.resolve("b.txt"))).isEqualTo("bravo");
    assertThat(out.toString())
        .contains("Found 2 URLs to download")
        .contains("a.txt: 100%")
        .contains("DOWNLOAD SUMMARY")
        .contains("Successful: 2")
        .contains("Failed: 0")
        .contains("Output directory: " + output.toAbsolutePath().normalize())
        .doesNotContain("Failed downloads:");
  }

  @Test
  public void testFailureIsListedAndExitsOne() throws Exception {
    URI good = JettyFileServerExtension.publish("cli/mixed/good.txt", text("good"));
    URI missing = server.uri("status/404");
    Path output = tempDir.resolve("out");

    int exit = execute("-u", good.toString(), "-u", missing.toString(), "-o", output.toString(),
        "--retry-delay", "0");

    assertThat(exit).isEqualTo(1);
    assertThat(out.toString())
        .contains("Successful: 1")
        .contains("Failed: 1")
        .contains("Failed downloads:")
        .contains("  - " + missing + ": HTTP 404");
    assertThat(output.resolve("good.txt")).exists();
    assertThat(output.resolve("404")).doesNotExist();
  }

  @Test
  public void testNoUrlsExitsOne() {
    int exit = execute("-o", tempDir.resolve("out").toString());

    assertThat(exit).isEqualTo(1);
    assertThat(err.toString()).contains("No URLs provided");
  }

  @Test
  public void testReadsUrlFile() throws Exception {
    URI a = JettyFileServerExtension.publish("cli/list/one.txt", text("1"));
    URI b = JettyFileServerExtension.publish("cli/list/two.txt", text("22"));
    Path list = tempDir.resolve("urls.txt");
    Files.writeString(list, "# sample\n" + a + "\n\nnot-a-url\n" + b + "\n");
    Path output = tempDir.resolve("out");

    int exit = execute("-f", list.toString(), "-o", output.toString());

    assertThat(exit).isEqualTo(0);
    assertThat(output.resolve("one.txt")).hasContent("1");
    assertThat(output.resolve("two.txt")).hasContent("22");
  }

  @Test
  public void testDomainPathTemplate() throws Exception {
    URI a = JettyFileServerExtension.publish("cli/domain/a.txt", text("a"));
    Path output = tempDir.resolve("out");

    int exit = execute("-u", a.toString(), "-o", output.toString(), "--filename-template", "domain-path");

    assertThat(exit).isEqualTo(0);
    assertThat(output.resolve(a.getHost() + "_temp_cli_domain_a.txt")).hasContent("a");
  }

  @Test
  public void testCollidingNamesGetSuffixes() throws Exception {
    URI first = JettyFileServerExtension.publish("cli/x/same.txt", text("first"));
    URI second = JettyFileServerExtension.publish("cli/y/same.txt", text("second"));
    Path output = tempDir.resolve("out");

    int exit = execute("-u", first.toString(), "-u", second.toString(), "-o", output.toString(), "-c", "1");

    assertThat(exit).isEqualTo(0);
    assertThat(output.resolve("same.txt")).hasContent("first");
    assertThat(output.resolve("same_1.txt")).hasContent("second");
  }

  @Test
  public void testUnknownTemplateIsUsageError() {
    int exit = execute("-u", "http://example.com/a", "--filename-template", "random");

    assertThat(exit).isEqualTo(2);
    assertThat(err.toString()).contains("unknown filename template");
  }

  @Test
  public void testInvalidConfigExitsOne() throws Exception {
    Files.writeString(emptyConfig, "concurrency: 0\n");

    int exit = execute("-u", "http://example.com/a", "-o", tempDir.resolve("out").toString());

    assertThat(exit).isEqualTo(1);
    assertThat(err.toString()).contains("concurrency");
  }

  @Test
  public void testCommandLineOverridesConfigFile() throws Exception {
    Files.writeString(emptyConfig, "maxRetries: 1\n");
    JettyFileServerExtension.publish("cli/cut/cut.bin", new byte[10_000]);
    URI truncated = server.uri("truncated/temp/cli/cut/cut.bin");

    int exit = execute("-u", truncated.toString(), "-o", tempDir.resolve("out").toString(),
        "--retries", "2", "--retry-delay", "0");

    assertThat(exit).isEqualTo(1);
    assertThat(server.requestCount("/truncated/temp/cli/cut/cut.bin")).isEqualTo(2);
  }

  @Test
  public void testUniqueNamerIsStable() {
    CMD_fetch command = new CMD_fetch();
    new CommandLine(command).parseArgs();
    Function<URI, String> namer = command.uniqueNamer();

    assertThat(namer.apply(URI.create("http://h/a/file.tar.gz"))).isEqualTo("file.tar.gz");
    assertThat(namer.apply(URI.create("http://h/b/file.tar.gz"))).isEqualTo("file.tar_1.gz");
    assertThat(namer.apply(URI.create("http://h/c/file.tar.gz"))).isEqualTo("file.tar_2.gz");
  }
}
