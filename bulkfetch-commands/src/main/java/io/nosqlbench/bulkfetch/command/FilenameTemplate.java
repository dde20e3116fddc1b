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

import picocli.CommandLine;

import java.net.URI;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.stream.Collectors;

/// How a local file name is derived from a URL.
///
/// Names use the raw, still percent-encoded path, so they never contain a path separator.
public enum FilenameTemplate {

  /// The last path segment, or `download_<millis>.bin` when the path has none
  DEFAULT("default") {
    @Override
    public String fileName(URI url, long nowMillis) {
      String last = lastSegment(url);
      return last.isEmpty() ? "download_" + nowMillis + ".bin" : last;
    }
  },

  /// The host followed by the path, with `/` replaced by `_`
  DOMAIN_PATH("domain-path") {
    @Override
    public String fileName(URI url, long nowMillis) {
      String host = url.getHost() != null ? url.getHost() : "unknown-host";
      String path = rawPath(url).replace('/', '_').replaceAll("^_+", "");
      return path.isEmpty() ? host : host + "_" + path;
    }
  },

  /// `file_<millis>` plus the extension of the last path segment, or `.bin`
  TIMESTAMP("timestamp") {
    @Override
    public String fileName(URI url, long nowMillis) {
      String last = lastSegment(url);
      int dot = last.lastIndexOf('.');
      String ext = dot > 0 && dot < last.length() - 1 ? last.substring(dot) : ".bin";
      return "file_" + nowMillis + ext;
    }
  };

  private final String label;

  FilenameTemplate(String label) {
    this.label = label;
  }

  /// Derives a file name.
  ///
  /// @param url the URL being downloaded
  /// @param nowMillis the current time, for the templates that use it
  /// @return a single path element
  public abstract String fileName(URI url, long nowMillis);

  /// @return the name used on the command line
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }

  /// @param label a command line name such as `domain-path`
  /// @return the matching template
  /// @throws IllegalArgumentException if no template has that name
  public static FilenameTemplate fromLabel(String label) {
    String wanted = label.trim().toLowerCase(Locale.ROOT);
    for (FilenameTemplate template : values()) {
      if (template.label.equals(wanted) || template.name().equalsIgnoreCase(wanted)) {
        return template;
      }
    }
    throw new IllegalArgumentException("unknown filename template '" + label + "', expected one of "
                                       + Arrays.stream(values()).map(FilenameTemplate::label)
                                           .collect(Collectors.joining(", ")));
  }

  private static String rawPath(URI url) {
    String path = url.getRawPath();
    return path == null ? "" : path;
  }

  private static String lastSegment(URI url) {
    String path = rawPath(url);
    int end = path.length();
    while (end > 0 && path.charAt(end - 1) == '/') {
      end--;
    }
    String segment = path.substring(path.lastIndexOf('/', end - 1) + 1, end);
    if (segment.equals(".") || segment.equals("..")) {
      return "";
    }
    return segment;
  }

  /// Converts command line values for picocli.
  public static class Converter implements CommandLine.ITypeConverter<FilenameTemplate> {
    @Override
    public FilenameTemplate convert(String value) {
      try {
        return fromLabel(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(e.getMessage());
      }
    }
  }

  /// Lists the command line names for picocli help and completion.
  public static class Candidates implements Iterable<String> {
    @Override
    public Iterator<String> iterator() {
      return Arrays.stream(values()).map(FilenameTemplate::label).iterator();
    }
  }
}
