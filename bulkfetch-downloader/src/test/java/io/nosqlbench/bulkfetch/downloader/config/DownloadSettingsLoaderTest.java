package io.nosqlbench.bulkfetch.downloader.config;

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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DownloadSettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        DownloadSettings defaults = DownloadSettings.defaults();

        assertThat(defaults.concurrency()).isEqualTo(3);
        assertThat(defaults.timeout()).isEqualTo(Duration.ofMillis(30_000));
        assertThat(defaults.maxRetries()).isEqualTo(3);
        assertThat(defaults.retryBaseDelay()).isEqualTo(Duration.ofMillis(1000));
        assertThat(defaults.progressThresholdPercent()).isEqualTo(5);
        assertThat(defaults.maxRedirects()).isEqualTo(-1);
        assertThat(defaults.hasRedirectLimit()).isFalse();
    }

    @Test
    void testYamlOverridesOnlyNamedKeys() {
        String yaml = String.join("\n",
            "concurrency: 8",
            "timeout: 5000",
            "retryBaseDelay: '250'",
            "maxRedirects: 10",
            "");

        DownloadSettings settings = DownloadSettingsLoader.parse(yaml, DownloadSettings.defaults());

        assertThat(settings.concurrency()).isEqualTo(8);
        assertThat(settings.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.retryBaseDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(settings.maxRedirects()).isEqualTo(10);
        assertThat(settings.maxRetries()).isEqualTo(3);
        assertThat(settings.bufferSize()).isEqualTo(DownloadSettings.defaults().bufferSize());
    }

    @Test
    void testUnknownKeysAreIgnored() {
        DownloadSettings settings = DownloadSettingsLoader.parse("colour: blue\nmaxRetries: 5\n",
            DownloadSettings.defaults());
        assertThat(settings.maxRetries()).isEqualTo(5);
    }

    @Test
    void testEmptyDocumentKeepsBase() {
        DownloadSettings base = DownloadSettings.defaults().withConcurrency(7);
        assertThat(DownloadSettingsLoader.parse("", base)).isEqualTo(base);
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> DownloadSettingsLoader.parse("concurrency: 0\n", DownloadSettings.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> DownloadSettingsLoader.parse("timeout: soon\n", DownloadSettings.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout");
        assertThatThrownBy(() -> DownloadSettingsLoader.parse("- 1\n- 2\n", DownloadSettings.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("map");
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("settings.yaml");
        Files.writeString(file, "bufferSize: 65536\nprogressThresholdPercent: 10\n");

        DownloadSettings settings = DownloadSettingsLoader.load(file, DownloadSettings.defaults());

        assertThat(settings.bufferSize()).isEqualTo(65536);
        assertThat(settings.progressThresholdPercent()).isEqualTo(10);
    }

    @Test
    void testLoadReportsFileInErrors() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "maxRetries: -4\n");

        assertThatThrownBy(() -> DownloadSettingsLoader.load(file, DownloadSettings.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("broken.yaml");
    }

    @Test
    void testWithMethodsCopy() {
        DownloadSettings base = DownloadSettings.defaults();
        DownloadSettings changed = base.withMaxRetries(9).withTimeout(Duration.ofSeconds(2));

        assertThat(base.maxRetries()).isEqualTo(3);
        assertThat(changed.maxRetries()).isEqualTo(9);
        assertThat(changed.timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(changed.retryPolicy().maxRetries()).isEqualTo(9);
    }
}
