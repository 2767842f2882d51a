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

import static com.google.common.truth.Truth.assertThat;
import static com.google.contextbudget.testing.TestItems.EPOCH;
import static com.google.contextbudget.testing.TestItems.item;
import static com.google.contextbudget.testing.TestItems.text;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.contextbudget.ItemIdGenerator;
import com.google.contextbudget.archive.ArchivalSink;
import com.google.contextbudget.archive.ArchiveEntry;
import com.google.contextbudget.archive.ArchiveWriter;
import com.google.contextbudget.archive.InMemoryArchivalSink;
import com.google.contextbudget.config.ContextBudgetConfig;
import com.google.contextbudget.context.CompactionPhase;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ContextState;
import com.google.contextbudget.context.ItemKind;
import com.google.contextbudget.context.MetadataKey;
import com.google.contextbudget.context.Priority;
import com.google.contextbudget.context.SummaryOutcome;
import com.google.contextbudget.store.ContextStore;
import com.google.contextbudget.summarizer.ExtractiveSummarizer;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class CompactionEngineTest {

  private static final String CONSUMER = "helper_ai";

  @Rule public final MockitoRule mockito = MockitoJUnit.rule();
  @Mock private ArchivalSink mockSink;

  private final Clock clock = Clock.fixed(EPOCH.plusSeconds(3600), ZoneOffset.UTC);
  private final InMemoryArchivalSink sink = new InMemoryArchivalSink(clock);

  private CompactionEngine engine(ArchivalSink archivalSink) {
    return new CompactionEngine(
        new ExtractiveSummarizer(),
        new ArchiveWriter(archivalSink, Schedulers.trampoline()),
        clock,
        ItemIdGenerator.contentHash());
  }

  private static ContextStore store(ContextBudgetConfig config, List<ContextItem> items) {
    ContextStore store = new ContextStore(CONSUMER, config);
    store.withWriteLock(
        () -> {
          for (ContextItem item : items) {
            store.nextSequence();
            store.append(item);
          }
          return null;
        });
    return store;
  }

  /** One high priority item of 100 tokens and ten low priority items of 80 tokens. */
  private static List<ContextItem> highAndTenLow() {
    List<ContextItem> items = new ArrayList<>();
    items.add(
        item(
            0,
            text(400, "The user asked to keep the accessibility profile loaded."),
            ItemKind.INPUT,
            Priority.HIGH));
    for (int i = 1; i <= 10; i++) {
      items.add(
          item(
              i,
              text(320, "Knowledge note " + i + " explains one of the desktop settings."),
              ItemKind.KNOWLEDGE,
              Priority.LOW));
    }
    return items;
  }

  private static ContextBudgetConfig limit(int limitTokens) {
    return ContextBudgetConfig.builder().limitTokens(limitTokens).build();
  }

  @Test
  public void compact_allHighPriority_isNoop() {
    List<ContextItem> items = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      items.add(
          item(i, text(120, "Important instruction " + i + "."), ItemKind.INPUT, Priority.HIGH));
    }
    ContextStore store = store(limit(100), items);

    CompactionResult result = engine(mockSink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.SKIPPED_NO_CANDIDATES);
    assertThat(result.tokensBefore()).isEqualTo(90);
    assertThat(result.tokensAfter()).isEqualTo(90);
    assertThat(result.summaryOutcome()).isEmpty();
    ContextState state = store.snapshotState();
    assertThat(state.needsCompaction()).isTrue();
    assertThat(state.overBudget()).isTrue();
    assertThat(state.phase()).isEqualTo(CompactionPhase.AT_THRESHOLD);
    assertThat(store.items()).containsExactlyElementsIn(items);
    verify(mockSink, never()).write(anyString(), anyList());
  }

  @Test
  public void compact_keepsHighPriorityAndSummarizesRest() {
    List<ContextItem> items = highAndTenLow();
    ContextStore store = store(limit(1000), items);
    assertThat(store.totalTokens()).isEqualTo(900);

    CompactionResult result = engine(sink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.COMPACTED);
    assertThat(result.keptItemCount()).isEqualTo(1);
    assertThat(result.compactedItemCount()).isEqualTo(10);
    assertThat(result.tokensAfter()).isAtMost(500);
    assertThat(result.overBudget()).isFalse();
    SummaryOutcome outcome = result.summaryOutcome().orElseThrow();
    assertThat(outcome.originalTokens()).isEqualTo(800);
    assertThat(outcome.summarizedTokens()).isAtMost(400);
    assertThat(outcome.preservedInArchive()).isTrue();

    ImmutableList<ContextItem> live = store.items();
    assertThat(live).hasSize(2);
    assertThat(live).contains(items.get(0));
    ContextState state = store.snapshotState();
    assertThat(state.totalTokens()).isAtMost(500);
    assertThat(state.needsCompaction()).isFalse();
    assertThat(state.phase()).isEqualTo(CompactionPhase.UNDER_THRESHOLD);
  }

  @Test
  public void compact_archivesCandidatesVerbatim() {
    List<ContextItem> items = highAndTenLow();
    ContextStore store = store(limit(1000), items);

    CompactionResult result = engine(sink).compact(store);

    ImmutableList<ArchiveEntry> entries = sink.entries(CONSUMER);
    assertThat(entries).hasSize(1);
    assertThat(entries.get(0).items()).containsExactlyElementsIn(items.subList(1, 11)).inOrder();
    assertThat(result.summaryOutcome().orElseThrow().archiveReference())
        .hasValue(entries.get(0).reference());
  }

  @Test
  public void compact_summaryItemDescribesWhatItReplaced() {
    ContextStore store = store(limit(1000), highAndTenLow());

    engine(sink).compact(store);

    ContextItem summary =
        store.items().stream().filter(ContextItem::summarized).findFirst().orElseThrow();
    assertThat(summary.kind()).isEqualTo(ItemKind.SUMMARY);
    assertThat(summary.priority()).isEqualTo(Priority.MEDIUM);
    assertThat(summary.content()).startsWith("Knowledge: ");
    assertThat(summary.timestamp()).isEqualTo(clock.instant());
    assertThat(summary.sequence()).isEqualTo(11);
    assertThat(summary.archiveReference()).hasValue(sink.entries(CONSUMER).get(0).reference());
    assertThat(summary.metadata().getInt(MetadataKey.COMPACTED_ITEM_COUNT)).hasValue(10);
    assertThat(summary.metadata().getInt(MetadataKey.ORIGINAL_TOKENS)).hasValue(800);
    assertThat(store.render()).contains("[Summary] Knowledge: ");
  }

  @Test
  public void compact_twice_secondIsNoop() {
    ContextStore store = store(limit(1000), highAndTenLow());
    CompactionEngine engine = engine(sink);
    engine.compact(store);
    ImmutableList<ContextItem> afterFirst = store.items();

    CompactionResult second = engine.compact(store);

    assertThat(second.status()).isEqualTo(CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    assertThat(second.tokensSaved()).isEqualTo(0);
    assertThat(store.items()).isEqualTo(afterFirst);
    assertThat(sink.entries(CONSUMER)).hasSize(1);
  }

  @Test
  public void compact_keptItemsExceedTarget_usesReservedBudgetAndFlagsOverBudget() {
    // Target 50 tokens, reserved minimum 30 tokens.
    List<ContextItem> items =
        ImmutableList.of(
            item(0, text(240, "Critical instruction."), ItemKind.INPUT, Priority.HIGH),
            item(1, text(200, "Low priority background."), ItemKind.KNOWLEDGE, Priority.LOW),
            item(2, text(200, "More background detail."), ItemKind.KNOWLEDGE, Priority.LOW));
    ContextStore store = store(limit(100), items);

    CompactionResult result = engine(sink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.COMPACTED);
    assertThat(result.summaryOutcome().orElseThrow().summarizedTokens()).isAtMost(30);
    assertThat(result.tokensAfter()).isLessThan(result.tokensBefore());
    assertThat(result.overBudget()).isTrue();
    ContextState state = store.snapshotState();
    assertThat(state.overBudget()).isTrue();
    assertThat(state.totalTokens()).isAtMost(60 + 30);
  }

  @Test
  public void compact_overBudgetContextWithOnlySummaryLeft_isNoop() {
    List<ContextItem> items =
        ImmutableList.of(
            item(0, text(240, "Critical instruction."), ItemKind.INPUT, Priority.HIGH),
            item(1, text(200, "Low priority background."), ItemKind.KNOWLEDGE, Priority.LOW),
            item(2, text(200, "More background detail."), ItemKind.KNOWLEDGE, Priority.LOW));
    ContextStore store = store(limit(100), items);
    CompactionEngine engine = engine(sink);
    engine.compact(store);

    CompactionResult second = engine.compact(store);

    assertThat(second.status()).isEqualTo(CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    assertThat(second.overBudget()).isTrue();
    assertThat(sink.entries(CONSUMER)).hasSize(1);
  }

  @Test
  public void compact_reservedBudgetWithShortCandidates_neverGrowsUsage() {
    // Kept items use 60 of 50 target tokens; the 16 token candidate already fits the reserved 30.
    List<ContextItem> items =
        ImmutableList.of(
            item(0, text(240, "Critical instruction."), ItemKind.INPUT, Priority.HIGH),
            item(1, text(64, "Please open the notes app."), ItemKind.INPUT, Priority.LOW));
    ContextStore store = store(limit(100), items);
    assertThat(store.totalTokens()).isEqualTo(76);

    CompactionResult result = engine(mockSink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    assertThat(result.tokensAfter()).isAtMost(result.tokensBefore());
    assertThat(result.overBudget()).isTrue();
    assertThat(store.totalTokens()).isEqualTo(76);
    assertThat(store.items()).containsExactlyElementsIn(items);
    verify(mockSink, never()).write(anyString(), anyList());
  }

  @Test
  public void compact_archiveError_proceedsWithoutReference() {
    when(mockSink.write(anyString(), anyList()))
        .thenReturn(Single.error(new IOException("disk full")));
    ContextStore store = store(limit(1000), highAndTenLow());

    CompactionResult result = engine(mockSink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.COMPACTED);
    SummaryOutcome outcome = result.summaryOutcome().orElseThrow();
    assertThat(outcome.preservedInArchive()).isFalse();
    assertThat(outcome.archiveReference()).isEmpty();
    ContextState state = store.snapshotState();
    assertThat(state.totalTokens()).isAtMost(500);
    assertThat(state.archiveFailureCount()).isEqualTo(1);
    assertThat(state.lastArchiveFailure().orElseThrow().message()).contains("disk full");
    assertThat(state.lastArchiveFailure().orElseThrow().itemCount()).isEqualTo(10);
    assertThat(state.lastArchiveFailure().orElseThrow().timestamp()).isEqualTo(clock.instant());
  }

  @Test
  public void compact_archiveTimeout_proceedsWithoutReference() {
    when(mockSink.write(any(), any())).thenReturn(Single.never());
    ContextBudgetConfig config =
        ContextBudgetConfig.builder()
            .limitTokens(1000)
            .archiveWriteTimeout(Duration.ofMillis(50))
            .build();
    ContextStore store = store(config, highAndTenLow());

    CompactionResult result = engine(mockSink).compact(store);

    assertThat(result.compacted()).isTrue();
    ContextItem summary =
        store.items().stream().filter(ContextItem::summarized).findFirst().orElseThrow();
    assertThat(summary.archiveReference()).isEmpty();
    assertThat(store.snapshotState().lastArchiveFailure().orElseThrow().message())
        .isEqualTo("Archive write timed out after 50 ms");
  }

  @Test
  public void compact_withinBudget_isNoop() {
    List<ContextItem> items =
        ImmutableList.of(
            item(0, "Open the report.", ItemKind.INPUT, Priority.HIGH),
            item(1, "Report opened.", ItemKind.REPLY, Priority.LOW));
    ContextStore store = store(limit(1000), items);

    CompactionResult result = engine(mockSink).compact(store);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    assertThat(result.overBudget()).isFalse();
    assertThat(store.items()).containsExactlyElementsIn(items).inOrder();
    verify(mockSink, never()).write(anyString(), anyList());
  }
}
