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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FilenameTemplateTest {

  private static final long NOW = 1_700_000_000_000L;

  private static String name(FilenameTemplate template, String url) {
    return template.fileName(URI.create(url), NOW);
  }

  @Test
  public void testDefaultUsesLastPathSegment() {
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/data/2024/report.csv")).isEqualTo("report.csv");
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/data/archive/")).isEqualTo("archive");
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/file.txt?version=2")).isEqualTo("file.txt");
  }

  @Test
  public void testDefaultFallsBackWhenPathIsEmpty() {
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com")).isEqualTo("download_" + NOW + ".bin");
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/")).isEqualTo("download_" + NOW + ".bin");
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/a/..")).isEqualTo("download_" + NOW + ".bin");
  }

  @Test
  public void testDefaultKeepsPercentEncoding() {
    assertThat(name(FilenameTemplate.DEFAULT, "https://example.com/a%2Fb.txt")).isEqualTo("a%2Fb.txt");
  }

  @Test
  public void testDomainPath() {
    assertThat(name(FilenameTemplate.DOMAIN_PATH, "https://example.com/data/2024/report.csv"))
        .isEqualTo("example.com_data_2024_report.csv");
    assertThat(name(FilenameTemplate.DOMAIN_PATH, "https://example.com/")).isEqualTo("example.com");
  }

  @Test
  public void testTimestampKeepsExtension() {
    assertThat(name(FilenameTemplate.TIMESTAMP, "https://example.com/data/report.csv"))
        .isEqualTo("file_" + NOW + ".csv");
    assertThat(name(FilenameTemplate.TIMESTAMP, "https://example.com/data/report"))
        .isEqualTo("file_" + NOW + ".bin");
    assertThat(name(FilenameTemplate.TIMESTAMP, "https://example.com/.hidden"))
        .isEqualTo("file_" + NOW + ".bin");
  }

  @Test
  public void testLabels() {
    assertThat(FilenameTemplate.fromLabel("domain-path")).isEqualTo(FilenameTemplate.DOMAIN_PATH);
    assertThat(FilenameTemplate.fromLabel("TIMESTAMP")).isEqualTo(FilenameTemplate.TIMESTAMP);
    assertThatThrownBy(() -> FilenameTemplate.fromLabel("random"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("default, domain-path, timestamp");
    assertThatThrownBy(() -> new FilenameTemplate.Converter().convert("random"))
        .isInstanceOf(CommandLine.TypeConversionException.class);
  }
}
