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

import com.google.common.collect.ImmutableList;
import com.google.contextbudget.context.ContextItem;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory archival sink for development and testing.
 *
 * <p>Entries live only as long as this instance. For archives that must survive a restart, use a
 * durable sink such as the file system one from the {@code file-archive} module.
 */
public class InMemoryArchivalSink implements ArchivalSink {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryArchivalSink.class);
  private static final String REFERENCE_SCHEME = "memory://";

  private final Clock clock;
  private final AtomicLong nextEntry = new AtomicLong();
  private final ConcurrentMap<String, ArchiveEntry> entriesByReference = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, List<ArchiveEntry>> entriesByConsumer =
      new ConcurrentHashMap<>();

  public InMemoryArchivalSink() {
    this(Clock.systemUTC());
  }

  public InMemoryArchivalSink(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Single<String> write(String consumerId, List<ContextItem> items) {
    return Single.fromCallable(
        () -> {
          String reference = REFERENCE_SCHEME + consumerId + "/" + nextEntry.incrementAndGet();
          ArchiveEntry entry =
              ArchiveEntry.builder()
                  .reference(reference)
                  .consumerId(consumerId)
                  .timestamp(clock.instant())
                  .items(items)
                  .build();
          entriesByReference.put(reference, entry);
          entriesByConsumer
              .computeIfAbsent(consumerId, k -> new CopyOnWriteArrayList<>())
              .add(entry);
          logger.debug(
              "Archived {} items ({} tokens) for consumer {} as {}",
              items.size(),
              entry.totalTokens(),
              consumerId,
              reference);
          return reference;
        });
  }

  /** Returns the entry written under {@code reference}, if any. */
  public Optional<ArchiveEntry> get(String reference) {
    return Optional.ofNullable(entriesByReference.get(reference));
  }

  /** Returns the entries written for a consumer, oldest first. */
  public ImmutableList<ArchiveEntry> entries(String consumerId) {
    List<ArchiveEntry> entries = entriesByConsumer.get(consumerId);
    return entries == null ? ImmutableList.of() : ImmutableList.copyOf(entries);
  }

  /** Returns the total number of entries held. */
  public int size() {
    return entriesByReference.size();
  }
}
