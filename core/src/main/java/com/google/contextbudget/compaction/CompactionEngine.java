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

package com.google.contextbudget.compaction;

import com.google.common.collect.ImmutableList;
import com.google.contextbudget.ContextTelemetry;
import com.google.contextbudget.ItemIdGenerator;
import com.google.contextbudget.archive.ArchiveWriteResult;
import com.google.contextbudget.archive.ArchiveWriter;
import com.google.contextbudget.config.ContextBudgetConfig;
import com.google.contextbudget.context.ArchiveFailure;
import com.google.contextbudget.context.CompactionPhase;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ItemKind;
import com.google.contextbudget.context.ItemMetadata;
import com.google.contextbudget.context.MetadataKey;
import com.google.contextbudget.context.Priority;
import com.google.contextbudget.context.SummaryOutcome;
import com.google.contextbudget.store.ContextStore;
import com.google.contextbudget.summarizer.ContextSummarizer;
import com.google.contextbudget.tokens.TokenEstimator;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compacts a consumer's context by summarizing its low-priority items.
 *
 * <p>Items of priority {@link Priority#HIGH} and above are kept. The rest, the candidates, are
 * written verbatim to the archive and replaced by one {@link ItemKind#SUMMARY} item of priority
 * {@link Priority#MEDIUM} that fits in what the kept items leave of the target:
 *
 * <pre>
 *   remaining = targetTokens - tokens(kept)
 * </pre>
 *
 * <p>When the kept items alone reach the target, the summary gets the reserved minimum budget
 * instead, so every compaction still makes progress. Usage then stays above the target and the
 * store is flagged over budget.
 *
 * <p>Compaction is skipped, leaving the store untouched, when there are no candidates or when the
 * candidates already fit their budget. In the reserved minimum case only candidates that are all
 * summaries count as fitting, which makes repeated compaction of an over-budget context a no-op.
 * It is also skipped when the summary would not be smaller than the candidates it replaces; the
 * archive is only written once compaction is certain to go ahead.
 *
 * <p>A failed archive write does not stop compaction: the summary is created without an archive
 * reference and the failure is recorded in the store.
 */
public final class CompactionEngine implements ContextCompactor {

  private static final Logger logger = LoggerFactory.getLogger(CompactionEngine.class);

  private final ContextSummarizer summarizer;
  private final ArchiveWriter archiveWriter;
  private final Clock clock;
  private final ItemIdGenerator idGenerator;

  public CompactionEngine(
      ContextSummarizer summarizer,
      ArchiveWriter archiveWriter,
      Clock clock,
      ItemIdGenerator idGenerator) {
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
    this.archiveWriter = Objects.requireNonNull(archiveWriter, "archiveWriter");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  @Override
  public CompactionResult compact(ContextStore store) {
    return store.withWriteLock(() -> compactLocked(store));
  }

  private CompactionResult compactLocked(ContextStore store) {
    String consumerId = store.consumerId();
    ContextBudgetConfig config = store.config();
    TokenEstimator estimator = store.estimator();
    int tokensBefore = store.totalTokens();
    logger.debug("Running compaction for consumer {} at {} tokens", consumerId, tokensBefore);

    ImmutableList<ContextItem> ordered =
        ImmutableList.sortedCopyOf(ContextItem.CONTEXT_ORDER, store.items());
    ImmutableList<ContextItem> kept =
        ordered.stream()
            .filter(item -> item.priority().isAtLeast(Priority.HIGH))
            .collect(ImmutableList.toImmutableList());
    ImmutableList<ContextItem> candidates =
        ordered.stream()
            .filter(item -> !item.priority().isAtLeast(Priority.HIGH))
            .collect(ImmutableList.toImmutableList());

    CompactionResult.Builder result =
        CompactionResult.builder()
            .consumerId(consumerId)
            .tokensBefore(tokensBefore)
            .keptItemCount(kept.size());

    if (candidates.isEmpty()) {
      logger.info(
          "Nothing to compact for consumer {}: all {} items are high priority or above",
          consumerId,
          kept.size());
      ContextTelemetry.recordSkippedCompaction(consumerId, "no_candidates");
      return skip(store, result, CompactionResult.Status.SKIPPED_NO_CANDIDATES);
    }

    int keptTokens = tokens(kept);
    int candidateTokens = tokens(candidates);
    int remaining = config.targetTokens() - keptTokens;
    boolean reservedBudget = remaining <= 0;
    if (reservedBudget) {
      remaining = config.reservedMinimumTokens();
      logger.debug(
          "Kept items of consumer {} use {} of {} target tokens, summarizing to reserved {}",
          consumerId,
          keptTokens,
          config.targetTokens(),
          remaining);
    }

    if (candidateTokens <= remaining
        && (!reservedBudget || candidates.stream().allMatch(ContextItem::summarized))) {
      logger.debug(
          "Candidates of consumer {} already fit: {} <= {} tokens",
          consumerId,
          candidateTokens,
          remaining);
      ContextTelemetry.recordSkippedCompaction(consumerId, "within_budget");
      return skip(store, result, CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    }

    String summaryText = summarizer.summarizeItems(candidates, remaining, estimator);
    int summaryTokens = estimator.estimate(summaryText);
    if (summaryTokens >= candidateTokens) {
      logger.debug(
          "Summary of consumer {} would not shrink its candidates: {} >= {} tokens",
          consumerId,
          summaryTokens,
          candidateTokens);
      ContextTelemetry.recordSkippedCompaction(consumerId, "within_budget");
      return skip(store, result, CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    }

    // Archive in insertion order so the entry reads like the original conversation.
    ImmutableList<ContextItem> toArchive =
        ImmutableList.sortedCopyOf(Comparator.comparingLong(ContextItem::sequence), candidates);
    ArchiveWriteResult archive =
        archiveWriter.write(consumerId, toArchive, config.archiveWriteTimeout());
    if (!archive.succeeded()) {
      store.recordArchiveFailure(
          ArchiveFailure.create(
              clock.instant(), toArchive.size(), archive.errorMessage().orElse("unknown")));
      ContextTelemetry.recordArchiveFailure(consumerId, "compaction");
    }
    @Nullable String archiveReference = archive.reference().orElse(null);

    @Nullable ContextItem summary = null;
    if (!summaryText.isEmpty()) {
      summary =
          newSummaryItem(
              store, estimator, summaryText, archiveReference, candidates.size(), candidateTokens);
    }

    store.transitionTo(CompactionPhase.COMPACTED);
    store.replace(candidates, summary);
    int tokensAfter = store.totalTokens();
    boolean overBudget = tokensAfter > config.targetTokens();
    store.setOverBudget(overBudget);
    settle(store);

    SummaryOutcome outcome =
        SummaryOutcome.create(
            candidateTokens,
            summary == null ? 0 : summary.tokenCount(),
            summaryText,
            archiveReference);
    logger.info(
        "Compacted {} items of consumer {} from {} to {} tokens (archive: {})",
        candidates.size(),
        consumerId,
        tokensBefore,
        tokensAfter,
        archiveReference == null ? "not preserved" : archiveReference);
    if (overBudget) {
      logger.info(
          "Consumer {} remains over its target of {} tokens: kept items use {}",
          consumerId,
          config.targetTokens(),
          keptTokens);
    }
    ContextTelemetry.recordCompaction(consumerId, Math.max(0, tokensBefore - tokensAfter));

    return result
        .status(CompactionResult.Status.COMPACTED)
        .tokensAfter(tokensAfter)
        .compactedItemCount(candidates.size())
        .overBudget(overBudget)
        .summaryOutcome(outcome)
        .build();
  }

  private ContextItem newSummaryItem(
      ContextStore store,
      TokenEstimator estimator,
      String summaryText,
      @Nullable String archiveReference,
      int compactedItemCount,
      int originalTokens) {
    Instant now = clock.instant();
    long sequence = store.nextSequence();
    return ContextItem.builder()
        .id(idGenerator.generate(store.consumerId(), summaryText, now, sequence))
        .content(summaryText)
        .kind(ItemKind.SUMMARY)
        .priority(Priority.MEDIUM)
        .timestamp(now)
        .tokenCount(estimator.estimate(summaryText))
        .summarized(true)
        .archiveReference(archiveReference)
        .sequence(sequence)
        .metadata(
            ItemMetadata.builder()
                .put(MetadataKey.COMPACTED_ITEM_COUNT, compactedItemCount)
                .put(MetadataKey.ORIGINAL_TOKENS, originalTokens)
                .build())
        .build();
  }

  private static CompactionResult skip(
      ContextStore store, CompactionResult.Builder result, CompactionResult.Status status) {
    int tokens = store.totalTokens();
    boolean overBudget = tokens > store.config().targetTokens();
    store.setOverBudget(overBudget);
    settle(store);
    return result.status(status).tokensAfter(tokens).overBudget(overBudget).build();
  }

  /** Folds the store back into the phase its usage calls for. */
  private static void settle(ContextStore store) {
    store.transitionTo(
        store.needsCompaction() ? CompactionPhase.AT_THRESHOLD : CompactionPhase.UNDER_THRESHOLD);
  }

  private static int tokens(List<ContextItem> items) {
    return items.stream().mapToInt(ContextItem::tokenCount).sum();
  }
}
