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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/// Reads [DownloadSettings] overrides from a YAML map.
///
/// ```yaml
/// concurrency: 6
/// timeout: 10000          # ms
/// maxRetries: 5
/// retryBaseDelay: 500     # ms
/// progressThresholdPercent: 10
/// maxRedirects: 20
/// bufferSize: 65536
/// ```
///
/// Keys that are absent keep the value of the settings passed in. Unknown keys are logged and
/// ignored.
public final class DownloadSettingsLoader {

    private static final Logger logger = LogManager.getLogger(DownloadSettingsLoader.class);

    /// The per-user settings file, relative to the home directory
    public static final String DEFAULT_RELATIVE_LOCATION = ".config/bulkfetch/settings.yaml";

    private DownloadSettingsLoader() {
    }

    /// @return `~/.config/bulkfetch/settings.yaml`
    public static Path defaultLocation() {
        return Path.of(System.getProperty("user.home")).resolve(DEFAULT_RELATIVE_LOCATION);
    }

    /// Applies the per-user settings file, if there is one, on top of `base`.
    ///
    /// @param base the settings to start from
    /// @return `base` with the file's values applied, or `base` itself if the file does not exist
    /// @throws IOException if the file exists but cannot be read
    public static DownloadSettings loadOptional(DownloadSettings base) throws IOException {
        Path location = defaultLocation();
        if (!Files.isRegularFile(location)) {
            logger.debug("No settings file at {}", location);
            return base;
        }
        return load(location, base);
    }

    /// Applies the given settings file on top of `base`.
    ///
    /// @param file the YAML file
    /// @param base the settings to start from
    /// @return the merged settings
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not a YAML map or holds invalid values
    public static DownloadSettings load(Path file, DownloadSettings base) throws IOException {
        String content = Files.readString(file);
        logger.debug("Loading settings from {}", file);
        try {
            return parse(content, base);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(file + ": " + e.getMessage(), e);
        }
    }

    /// Applies YAML content on top of `base`.
    ///
    /// @param yaml the YAML text
    /// @param base the settings to start from
    /// @return the merged settings
    /// @throws IllegalArgumentException if the text is not a YAML map or holds invalid values
    public static DownloadSettings parse(String yaml, DownloadSettings base) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load load = new Load(loadSettings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("invalid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return base;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("settings must be a YAML map");
        }

        DownloadSettings settings = base;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "concurrency":
                    settings = settings.withConcurrency(intValue(key, value));
                    break;
                case "timeout":
                    settings = settings.withTimeout(Duration.ofMillis(longValue(key, value)));
                    break;
                case "maxRetries":
                    settings = settings.withMaxRetries(intValue(key, value));
                    break;
                case "retryBaseDelay":
                    settings = settings.withRetryBaseDelay(Duration.ofMillis(longValue(key, value)));
                    break;
                case "progressThresholdPercent":
                    settings = settings.withProgressThresholdPercent(intValue(key, value));
                    break;
                case "maxRedirects":
                    settings = settings.withMaxRedirects(intValue(key, value));
                    break;
                case "bufferSize":
                    settings = settings.withBufferSize(intValue(key, value));
                    break;
                default:
                    logger.warn("Ignoring unknown settings key '{}'", key);
            }
        }
        return settings;
    }

    private static long longValue(String key, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, was '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException(key + " must be a number, was " + value);
    }

    private static int intValue(String key, Object value) {
        long result = longValue(key, value);
        if (result < Integer.MIN_VALUE || result > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range: " + result);
        }
        return (int) result;
    }
}
