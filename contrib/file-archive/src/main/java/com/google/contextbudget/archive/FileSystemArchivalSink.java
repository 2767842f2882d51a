/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.contextbudget.archive;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.contextbudget.config.ContextBudgetProperties;
import com.google.contextbudget.context.ContextItem;
import io.reactivex.rxjava3.core.Single;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Archival sink writing each entry to the local file system.
 *
 * <p>An entry for consumer {@code c} becomes two files under {@code <root>/c/}: a JSON file holding
 * the {@link ArchiveEntry} losslessly, and a Markdown rendering for people browsing the archive.
 * The reference returned is the path of the JSON file, which {@link #read(Path)} loads back.
 *
 * <p>Files are opened with {@link StandardOpenOption#CREATE_NEW}, so an existing entry is never
 * overwritten.
 */
public final class FileSystemArchivalSink implements ArchivalSink {

  private static final Logger logger = LoggerFactory.getLogger(FileSystemArchivalSink.class);

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);
  private static final CharMatcher SAFE_PATH_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("._-"));
  private static final int MAX_NAME_ATTEMPTS = 1000;

  private final Path root;
  private final Clock clock;

  /** Creates a sink rooted at the configured archive directory. */
  public FileSystemArchivalSink() {
    this(defaultRoot(ContextBudgetProperties.getInstance()), Clock.systemUTC());
  }

  public FileSystemArchivalSink(Path root) {
    this(root, Clock.systemUTC());
  }

  public FileSystemArchivalSink(Path root, Clock clock) {
    this.root = Objects.requireNonNull(root, "root");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the {@code archive.directory} property, or {@code ~/.contextbudget/archive} if it is
   * not set.
   */
  static Path defaultRoot(ContextBudgetProperties properties) {
    return properties
        .getArchiveDirectory()
        .map(Paths::get)
        .orElseGet(() -> Paths.get(System.getProperty("user.home"), ".contextbudget", "archive"));
  }

  public Path root() {
    return root;
  }

  @Override
  public Single<String> write(String consumerId, List<ContextItem> items) {
    return Single.fromCallable(() -> writeEntry(consumerId, items));
  }

  private String writeEntry(String consumerId, List<ContextItem> items) throws IOException {
    Path directory = root.resolve(directoryName(consumerId));
    Files.createDirectories(directory);
    Instant now = clock.instant();
    String baseName = "context_" + FILE_TIMESTAMP.format(now);

    for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
      String name = attempt == 0 ? baseName : baseName + "_" + attempt;
      Path jsonFile = directory.resolve(name + ".json");
      ArchiveEntry entry =
          ArchiveEntry.builder()
              .reference(jsonFile.toString())
              .consumerId(consumerId)
              .timestamp(now)
              .items(items)
              .build();
      try {
        Files.write(jsonFile, entry.toJson().getBytes(UTF_8), StandardOpenOption.CREATE_NEW);
      } catch (FileAlreadyExistsException e) {
        // Taken by an entry written within the same millisecond.
        continue;
      }
      Files.write(
          directory.resolve(name + ".md"),
          renderMarkdown(entry).getBytes(UTF_8),
          StandardOpenOption.CREATE_NEW);
      logger.debug(
          "Archived {} items ({} tokens) for consumer {} to {}",
          items.size(),
          entry.totalTokens(),
          consumerId,
          jsonFile);
      return entry.reference();
    }
    throw new IOException(
        "No free archive file name for " + baseName + " in " + directory + " after "
            + MAX_NAME_ATTEMPTS + " attempts");
  }

  /**
   * Reads back the entry stored under {@code reference}.
   *
   * @throws UncheckedIOException if the file cannot be read
   */
  public static ArchiveEntry read(Path reference) {
    try {
      return ArchiveEntry.fromJson(new String(Files.readAllBytes(reference), UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read archive entry " + reference, e);
    }
  }

  /** Maps a consumer id to a single, safe path segment. */
  @VisibleForTesting
  static String directoryName(String consumerId) {
    String name = SAFE_PATH_CHARS.negate().replaceFrom(consumerId, '_');
    if (name.isEmpty() || name.equals(".") || name.equals("..")) {
      return "_" + name;
    }
    return name;
  }

  @VisibleForTesting
  static String renderMarkdown(ArchiveEntry entry) {
    StringBuilder markdown = new StringBuilder();
    markdown
        .append("---\n")
        .append("type: context_archive\n")
        .append("consumer: ")
        .append(entry.consumerId())
        .append('\n')
        .append("timestamp: ")
        .append(entry.timestamp())
        .append('\n')
        .append("items_count: ")
        .append(entry.items().size())
        .append('\n')
        .append("total_tokens: ")
        .append(entry.totalTokens())
        .append('\n')
        .append("---\n\n")
        .append("# Context Archive: ")
        .append(entry.consumerId())
        .append("\n\n");
    for (ContextItem item : entry.items()) {
      markdown
          .append("### ")
          .append(item.kind().name().toUpperCase(Locale.ROOT))
          .append(" (")
          .append(item.timestamp())
          .append(")\n")
          .append("Priority: ")
          .append(item.priority().level())
          .append(" | Tokens: ")
          .append(item.tokenCount())
          .append("\n\n")
          .append(item.content())
          .append("\n\n---\n\n");
    }
    return markdown.toString();
  }
}
