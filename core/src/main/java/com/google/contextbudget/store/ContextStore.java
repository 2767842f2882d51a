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

package com.google.contextbudget.store;

import static com.google.common.base.Preconditions.checkState;
import static java.util.stream.Collectors.joining;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.contextbudget.config.ContextBudgetConfig;
import com.google.contextbudget.context.ArchiveFailure;
import com.google.contextbudget.context.CompactionPhase;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ContextState;
import com.google.contextbudget.context.Priority;
import com.google.contextbudget.tokens.CharacterTokenEstimator;
import com.google.contextbudget.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The live context items of a single consumer.
 *
 * <p>Every store is guarded by its own {@link ReentrantReadWriteLock}. Mutating methods require the
 * write lock to be held by the calling thread, see {@link #withWriteLock(Supplier)}; an append, the
 * threshold check and the compaction it triggers therefore run as one atomic unit. Reads take the
 * read lock and never observe a compaction in progress.
 */
public final class ContextStore {

  private static final Logger logger = LoggerFactory.getLogger(ContextStore.class);

  private final String consumerId;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  // Guarded by lock.
  private final List<ContextItem> items = new ArrayList<>();
  private ContextBudgetConfig config;
  private TokenEstimator estimator;
  private long nextSequence;
  private int totalTokens;
  private CompactionPhase phase = CompactionPhase.UNDER_THRESHOLD;
  private boolean overBudget;
  private int archiveFailureCount;
  @Nullable private ArchiveFailure lastArchiveFailure;

  public ContextStore(String consumerId, ContextBudgetConfig config) {
    this.consumerId = Objects.requireNonNull(consumerId, "consumerId");
    this.config = Objects.requireNonNull(config, "config");
    this.estimator = new CharacterTokenEstimator(config.charsPerToken());
  }

  public String consumerId() {
    return consumerId;
  }

  /** Runs {@code action} while holding this store's write lock. */
  public <T> T withWriteLock(Supplier<T> action) {
    lock.writeLock().lock();
    try {
      return action.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Runs {@code action} while holding this store's read lock. */
  public <T> T withReadLock(Supplier<T> action) {
    lock.readLock().lock();
    try {
      return action.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  public ContextBudgetConfig config() {
    return withReadLock(() -> config);
  }

  /** Estimator matching the configured characters per token. */
  public TokenEstimator estimator() {
    return withReadLock(() -> estimator);
  }

  /**
   * Replaces the configuration, re-estimating the live items if the characters per token changed.
   *
   * <p>Requires the write lock.
   */
  public void reconfigure(ContextBudgetConfig newConfig) {
    checkWriteLocked();
    Objects.requireNonNull(newConfig, "newConfig");
    if (newConfig.charsPerToken() != config.charsPerToken()) {
      estimator = new CharacterTokenEstimator(newConfig.charsPerToken());
      TokenEstimator newEstimator = estimator;
      items.replaceAll(
          item -> item.toBuilder().tokenCount(newEstimator.estimate(item.content())).build());
    }
    config = newConfig;
    recomputeTotal();
    transitionTo(
        needsCompaction() ? CompactionPhase.AT_THRESHOLD : CompactionPhase.UNDER_THRESHOLD);
    logger.info("Reconfigured consumer {}: {}", consumerId, newConfig);
  }

  /** Returns the sequence number for the next item. Requires the write lock. */
  public long nextSequence() {
    checkWriteLocked();
    return nextSequence++;
  }

  /**
   * Appends an item and recomputes usage, moving to {@link CompactionPhase#AT_THRESHOLD} when the
   * threshold is reached. Does not compact. Requires the write lock.
   */
  public void append(ContextItem item) {
    checkWriteLocked();
    items.add(item);
    totalTokens += item.tokenCount();
    if (needsCompaction()) {
      transitionTo(CompactionPhase.AT_THRESHOLD);
    }
  }

  /**
   * Replaces {@code removed} with {@code summary}, or just removes them when there is no summary.
   * Requires the write lock.
   *
   * @throws IllegalStateException if an item of {@code removed} is not live
   */
  public void replace(List<ContextItem> removed, @Nullable ContextItem summary) {
    checkWriteLocked();
    Set<ContextItem> toRemove = Collections.newSetFromMap(new IdentityHashMap<>());
    toRemove.addAll(removed);
    int before = items.size();
    items.removeIf(toRemove::contains);
    checkState(
        before - items.size() == toRemove.size(),
        "Only %s of %s items to replace are live in consumer %s",
        before - items.size(),
        toRemove.size(),
        consumerId);
    if (summary != null) {
      items.add(summary);
    }
    recomputeTotal();
  }

  /**
   * Removes every live item and resets the over-budget flag. Archive failures are kept. Requires
   * the write lock.
   *
   * @return the removed items, in insertion order
   */
  public ImmutableList<ContextItem> clear() {
    checkWriteLocked();
    ImmutableList<ContextItem> removed = ImmutableList.copyOf(items);
    items.clear();
    totalTokens = 0;
    overBudget = false;
    transitionTo(CompactionPhase.UNDER_THRESHOLD);
    return removed;
  }

  /** Live items in insertion order. */
  public ImmutableList<ContextItem> items() {
    return withReadLock(() -> ImmutableList.copyOf(items));
  }

  public int totalTokens() {
    return withReadLock(() -> totalTokens);
  }

  /** Whether usage is at or above the configured threshold. */
  public boolean needsCompaction() {
    return withReadLock(() -> totalTokens >= config.thresholdTokens());
  }

  public CompactionPhase phase() {
    return withReadLock(() -> phase);
  }

  /** Moves to {@code next}, logging the change. Requires the write lock. */
  public void transitionTo(CompactionPhase next) {
    checkWriteLocked();
    if (phase != next) {
      logger.debug("Consumer {} moved from {} to {}", consumerId, phase, next);
      phase = next;
    }
  }

  /** Records whether the last compaction left usage above the target. Requires the write lock. */
  public void setOverBudget(boolean overBudget) {
    checkWriteLocked();
    this.overBudget = overBudget;
  }

  /** Records an archive write that did not complete. Requires the write lock. */
  public void recordArchiveFailure(ArchiveFailure failure) {
    checkWriteLocked();
    archiveFailureCount++;
    lastArchiveFailure = failure;
  }

  /** Returns a consistent snapshot of this consumer's usage. */
  public ContextState snapshotState() {
    return withReadLock(
        () -> {
          Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
          for (ContextItem item : items) {
            byPriority.merge(item.priority(), 1, Integer::sum);
          }
          return ContextState.builder()
              .consumerId(consumerId)
              .totalTokens(totalTokens)
              .limit(config.limitTokens())
              .targetTokens(config.targetTokens())
              .usageRatio(totalTokens / (double) config.limitTokens())
              .itemCount(items.size())
              .itemsByPriority(ImmutableMap.copyOf(byPriority))
              .needsCompaction(totalTokens >= config.thresholdTokens())
              .phase(phase)
              .overBudget(overBudget)
              .archiveFailureCount(archiveFailureCount)
              .lastArchiveFailure(Optional.ofNullable(lastArchiveFailure))
              .build();
        });
  }

  /**
   * Renders the live items in context order, one line per item.
   *
   * @see ContextItem#CONTEXT_ORDER
   */
  public String render() {
    return withReadLock(
        () ->
            items.stream()
                .sorted(ContextItem.CONTEXT_ORDER)
                .map(ContextItem::render)
                .collect(joining("\n")));
  }

  private void recomputeTotal() {
    totalTokens = items.stream().mapToInt(ContextItem::tokenCount).sum();
  }

  private void checkWriteLocked() {
    checkState(
        lock.isWriteLockedByCurrentThread(),
        "Write lock of consumer %s must be held by the current thread",
        consumerId);
  }
}
