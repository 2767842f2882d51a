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

package com.google.contextbudget;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.contextbudget.archive.ArchivalSink;
import com.google.contextbudget.archive.ArchiveWriteResult;
import com.google.contextbudget.archive.ArchiveWriter;
import com.google.contextbudget.archive.InMemoryArchivalSink;
import com.google.contextbudget.compaction.CompactionEngine;
import com.google.contextbudget.compaction.CompactionResult;
import com.google.contextbudget.compaction.ContextCompactor;
import com.google.contextbudget.config.ContextBudgetConfig;
import com.google.contextbudget.config.ContextBudgetProperties;
import com.google.contextbudget.context.ArchiveFailure;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ContextState;
import com.google.contextbudget.context.ItemKind;
import com.google.contextbudget.context.ItemMetadata;
import com.google.contextbudget.context.Priority;
import com.google.contextbudget.store.ContextStore;
import com.google.contextbudget.summarizer.ContextSummarizer;
import com.google.contextbudget.summarizer.ExtractiveSummarizer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the context of each consumer within its token budget.
 *
 * <p>Callers add items tagged with a kind and a priority. Once a consumer's usage reaches its
 * threshold, the low-priority items are archived and replaced with an extractive summary, see
 * {@link CompactionEngine}. Consumers are independent: each has its own store and lock, and there
 * is no ordering across consumers.
 *
 * <pre>{@code
 * ContextBudgetService service =
 *     ContextBudgetService.builder().archivalSink(new InMemoryArchivalSink()).build();
 * service.addToContext("helper_ai", "Open the report please.", ItemKind.INPUT, Priority.HIGH);
 * String context = service.getOptimizedContext("helper_ai");
 * }</pre>
 */
public final class ContextBudgetService {

  private static final Logger logger = LoggerFactory.getLogger(ContextBudgetService.class);

  private final ConcurrentMap<String, ContextStore> stores = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ContextBudgetConfig> consumerConfigs;
  private final Function<String, ContextBudgetConfig> defaultConfigs;
  private final ContextCompactor compactor;
  private final ArchiveWriter archiveWriter;
  private final Clock clock;
  private final ItemIdGenerator idGenerator;

  private final AtomicLong summariesCreated = new AtomicLong();
  private final AtomicLong tokensSaved = new AtomicLong();
  private final AtomicLong contextsCleared = new AtomicLong();

  private ContextBudgetService(Builder builder) {
    this.clock = builder.clock;
    this.idGenerator = builder.idGenerator;
    this.archiveWriter = new ArchiveWriter(builder.archivalSink, builder.archiveScheduler);
    this.compactor =
        builder.compactor != null
            ? builder.compactor
            : new CompactionEngine(builder.summarizer, archiveWriter, clock, idGenerator);
    this.consumerConfigs = new ConcurrentHashMap<>(builder.consumerConfigs);
    this.defaultConfigs = builder.resolveDefaultConfigs();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Adds an item without metadata. */
  @CanIgnoreReturnValue
  public ContextItem addToContext(
      String consumerId, String content, ItemKind kind, Priority priority) {
    return addToContext(consumerId, content, kind, priority, ItemMetadata.empty());
  }

  /**
   * Adds an item to a consumer's context, compacting the context if it reaches its threshold.
   *
   * <p>The add, the threshold check and the compaction happen atomically for the consumer.
   *
   * @param consumerId Consumer the item belongs to
   * @param content Text of the item
   * @param kind Kind of the item
   * @param priority Priority assigned by the caller
   * @param metadata Metadata, restricted to the keys accepted by {@code kind}
   * @return The stored item
   * @throws IllegalArgumentException if {@code metadata} holds a key not accepted by {@code kind}
   */
  @CanIgnoreReturnValue
  public ContextItem addToContext(
      String consumerId,
      String content,
      ItemKind kind,
      Priority priority,
      ItemMetadata metadata) {
    Objects.requireNonNull(consumerId, "consumerId");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(metadata, "metadata");
    metadata.checkAllowedFor(kind);

    ContextStore store = storeFor(consumerId);
    return store.withWriteLock(
        () -> {
          Instant now = clock.instant();
          long sequence = store.nextSequence();
          ContextItem item =
              ContextItem.builder()
                  .id(idGenerator.generate(consumerId, content, now, sequence))
                  .content(content)
                  .kind(kind)
                  .priority(priority)
                  .timestamp(now)
                  .tokenCount(store.estimator().estimate(content))
                  .sequence(sequence)
                  .metadata(metadata)
                  .build();
          store.append(item);
          logger.debug(
              "Added {} item {} ({} tokens) to consumer {}, usage {}/{}",
              kind,
              item.id(),
              item.tokenCount(),
              consumerId,
              store.totalTokens(),
              store.config().limitTokens());
          if (store.needsCompaction()) {
            recordCompaction(compactor.compact(store));
          }
          return item;
        });
  }

  /** Returns the current state of a consumer's context, empty for an unknown consumer. */
  public ContextState getContextState(String consumerId) {
    Objects.requireNonNull(consumerId, "consumerId");
    ContextStore store = stores.get(consumerId);
    if (store == null) {
      return new ContextStore(consumerId, configFor(consumerId)).snapshotState();
    }
    return store.snapshotState();
  }

  /**
   * Returns the consumer's context as model input: one line per item, ordered by priority and then
   * newest first.
   */
  public String getOptimizedContext(String consumerId) {
    Objects.requireNonNull(consumerId, "consumerId");
    ContextStore store = stores.get(consumerId);
    return store == null ? "" : store.render();
  }

  /**
   * Archives every live item of a consumer, then empties its context.
   *
   * <p>If the archive write fails the context is emptied anyway and the failure is recorded in the
   * consumer's state.
   */
  public void clearContext(String consumerId) {
    Objects.requireNonNull(consumerId, "consumerId");
    ContextStore store = storeFor(consumerId);
    store.withWriteLock(
        () -> {
          ImmutableList<ContextItem> live = store.items();
          if (!live.isEmpty()) {
            ArchiveWriteResult archive =
                archiveWriter.write(consumerId, live, store.config().archiveWriteTimeout());
            if (!archive.succeeded()) {
              store.recordArchiveFailure(
                  ArchiveFailure.create(
                      clock.instant(), live.size(), archive.errorMessage().orElse("unknown")));
              ContextTelemetry.recordArchiveFailure(consumerId, "clear");
            }
          }
          store.clear();
          logger.info("Cleared {} items from consumer {}", live.size(), consumerId);
          return null;
        });
    contextsCleared.incrementAndGet();
    ContextTelemetry.recordClear(consumerId);
  }

  /**
   * Sets the configuration of a consumer. Live items are kept; if they reach the new threshold the
   * context is compacted right away.
   */
  public void configure(String consumerId, ContextBudgetConfig config) {
    Objects.requireNonNull(consumerId, "consumerId");
    Objects.requireNonNull(config, "config");
    consumerConfigs.put(consumerId, config);
    ContextStore store = stores.computeIfAbsent(consumerId, id -> new ContextStore(id, config));
    store.withWriteLock(
        () -> {
          store.reconfigure(config);
          if (store.needsCompaction()) {
            recordCompaction(compactor.compact(store));
          }
          return null;
        });
  }

  /** Compacts a consumer's context now, whether or not it reached its threshold. */
  @CanIgnoreReturnValue
  public CompactionResult compactNow(String consumerId) {
    Objects.requireNonNull(consumerId, "consumerId");
    CompactionResult result = compactor.compact(storeFor(consumerId));
    recordCompaction(result);
    return result;
  }

  /** Returns the service-wide counters and the state of every known consumer. */
  public ContextStatistics getStatistics() {
    ImmutableSortedMap.Builder<String, ContextState> consumers = ImmutableSortedMap.naturalOrder();
    long archiveFailures = 0;
    for (Map.Entry<String, ContextStore> entry : stores.entrySet()) {
      ContextState state = entry.getValue().snapshotState();
      consumers.put(entry.getKey(), state);
      archiveFailures += state.archiveFailureCount();
    }
    return ContextStatistics.create(
        summariesCreated.get(),
        tokensSaved.get(),
        contextsCleared.get(),
        archiveFailures,
        consumers.buildOrThrow());
  }

  private void recordCompaction(CompactionResult result) {
    if (result.compacted()) {
      summariesCreated.incrementAndGet();
      tokensSaved.addAndGet(result.tokensSaved());
    }
  }

  private ContextStore storeFor(String consumerId) {
    return stores.computeIfAbsent(consumerId, id -> new ContextStore(id, configFor(id)));
  }

  private ContextBudgetConfig configFor(String consumerId) {
    ContextBudgetConfig config = consumerConfigs.get(consumerId);
    return config != null ? config : defaultConfigs.apply(consumerId);
  }

  /** Builder for {@link ContextBudgetService}. */
  public static final class Builder {
    private ArchivalSink archivalSink;
    private Clock clock = Clock.systemUTC();
    private ItemIdGenerator idGenerator = ItemIdGenerator.contentHash();
    private Scheduler archiveScheduler = Schedulers.io();
    private ContextSummarizer summarizer = new ExtractiveSummarizer();
    @Nullable private ContextCompactor compactor;
    @Nullable private ContextBudgetConfig defaultConfig;
    @Nullable private ContextBudgetProperties properties;
    private final Map<String, ContextBudgetConfig> consumerConfigs = new HashMap<>();

    private Builder() {}

    /** Sink receiving archived items. Defaults to an {@link InMemoryArchivalSink}. */
    @CanIgnoreReturnValue
    public Builder archivalSink(ArchivalSink archivalSink) {
      this.archivalSink = Objects.requireNonNull(archivalSink, "archivalSink");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder idGenerator(ItemIdGenerator idGenerator) {
      this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
      return this;
    }

    /** Scheduler the archive writes are subscribed on. Defaults to {@link Schedulers#io()}. */
    @CanIgnoreReturnValue
    public Builder archiveScheduler(Scheduler archiveScheduler) {
      this.archiveScheduler = Objects.requireNonNull(archiveScheduler, "archiveScheduler");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder summarizer(ContextSummarizer summarizer) {
      this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
      return this;
    }

    /** Replaces the default {@link CompactionEngine}; the summarizer is then unused. */
    @CanIgnoreReturnValue
    public Builder compactor(ContextCompactor compactor) {
      this.compactor = Objects.requireNonNull(compactor, "compactor");
      return this;
    }

    /** Configuration of consumers without their own. Takes precedence over properties. */
    @CanIgnoreReturnValue
    public Builder defaultConfig(ContextBudgetConfig defaultConfig) {
      this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
      return this;
    }

    /**
     * Properties supplying the configuration of consumers without their own. Defaults to {@link
     * ContextBudgetProperties#getInstance()}.
     */
    @CanIgnoreReturnValue
    public Builder properties(ContextBudgetProperties properties) {
      this.properties = Objects.requireNonNull(properties, "properties");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder consumerConfig(String consumerId, ContextBudgetConfig config) {
      consumerConfigs.put(
          Objects.requireNonNull(consumerId, "consumerId"),
          Objects.requireNonNull(config, "config"));
      return this;
    }

    public ContextBudgetService build() {
      if (archivalSink == null) {
        archivalSink = new InMemoryArchivalSink(clock);
      }
      return new ContextBudgetService(this);
    }

    private Function<String, ContextBudgetConfig> resolveDefaultConfigs() {
      if (defaultConfig != null) {
        ContextBudgetConfig config = defaultConfig;
        return consumerId -> config;
      }
      ContextBudgetProperties source =
          properties != null ? properties : ContextBudgetProperties.getInstance();
      return source::configFor;
    }
  }
}
