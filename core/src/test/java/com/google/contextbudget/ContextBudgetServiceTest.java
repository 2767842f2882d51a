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

import static com.google.common.truth.Truth.assertThat;
import static com.google.contextbudget.testing.TestItems.EPOCH;
import static com.google.contextbudget.testing.TestItems.text;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.contextbudget.archive.ArchiveEntry;
import com.google.contextbudget.archive.InMemoryArchivalSink;
import com.google.contextbudget.compaction.CompactionResult;
import com.google.contextbudget.config.ContextBudgetConfig;
import com.google.contextbudget.context.CompactionPhase;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ContextState;
import com.google.contextbudget.context.ItemKind;
import com.google.contextbudget.context.ItemMetadata;
import com.google.contextbudget.context.MetadataKey;
import com.google.contextbudget.context.Priority;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContextBudgetServiceTest {

  private static final String CONSUMER = "helper_ai";

  private final Clock clock = Clock.fixed(EPOCH, ZoneOffset.UTC);
  private InMemoryArchivalSink sink;
  private ContextBudgetService service;
  private ExecutorService executor;

  @Before
  public void setUp() {
    sink = new InMemoryArchivalSink(clock);
    service = newService(ContextBudgetConfig.builder().limitTokens(1000).build());
  }

  @After
  public void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  private ContextBudgetService newService(ContextBudgetConfig defaultConfig) {
    return ContextBudgetService.builder()
        .archivalSink(sink)
        .clock(clock)
        .archiveScheduler(Schedulers.trampoline())
        .defaultConfig(defaultConfig)
        .build();
  }

  @Test
  public void addToContext_returnsStoredItem() {
    ItemMetadata metadata = ItemMetadata.builder().put(MetadataKey.INTENT, "file.open").build();

    ContextItem item =
        service.addToContext(
            CONSUMER, "Open the quarterly report.", ItemKind.INPUT, Priority.HIGH, metadata);

    assertThat(item.content()).isEqualTo("Open the quarterly report.");
    assertThat(item.tokenCount()).isEqualTo(7);
    assertThat(item.timestamp()).isEqualTo(EPOCH);
    assertThat(item.summarized()).isFalse();
    assertThat(item.archiveReference()).isEmpty();
    assertThat(item.metadata()).isEqualTo(metadata);
    assertThat(item.id()).hasLength(16);
    assertThat(service.getContextState(CONSUMER).totalTokens()).isEqualTo(7);
  }

  @Test
  public void addToContext_sameContentAndTime_getsDistinctIds() {
    ContextItem first = service.addToContext(CONSUMER, "Hi.", ItemKind.INPUT, Priority.HIGH);
    ContextItem second = service.addToContext(CONSUMER, "Hi.", ItemKind.INPUT, Priority.HIGH);

    assertThat(first.id()).isNotEqualTo(second.id());
    assertThat(second.sequence()).isGreaterThan(first.sequence());
  }

  @Test
  public void addToContext_metadataNotAcceptedByKind_throws() {
    ItemMetadata metadata = ItemMetadata.builder().put(MetadataKey.INTENT, "greeting").build();

    assertThrows(
        IllegalArgumentException.class,
        () -> service.addToContext(CONSUMER, "Hello!", ItemKind.REPLY, Priority.HIGH, metadata));
    assertThat(service.getContextState(CONSUMER).itemCount()).isEqualTo(0);
  }

  @Test
  public void addToContext_nullArguments_throw() {
    assertThrows(
        NullPointerException.class,
        () -> service.addToContext(null, "Hi.", ItemKind.INPUT, Priority.HIGH));
    assertThrows(
        NullPointerException.class,
        () -> service.addToContext(CONSUMER, null, ItemKind.INPUT, Priority.HIGH));
    assertThrows(
        NullPointerException.class,
        () -> service.addToContext(CONSUMER, "Hi.", null, Priority.HIGH));
    assertThrows(
        NullPointerException.class,
        () -> service.addToContext(CONSUMER, "Hi.", ItemKind.INPUT, null));
  }

  @Test
  public void addToContext_allHighPriorityOverThreshold_staysUncompacted() {
    service = newService(ContextBudgetConfig.builder().limitTokens(100).build());
    for (int i = 0; i < 3; i++) {
      service.addToContext(
          CONSUMER, text(120, "Keep this instruction."), ItemKind.INPUT, Priority.HIGH);
    }

    ContextState state = service.getContextState(CONSUMER);

    assertThat(state.totalTokens()).isEqualTo(90);
    assertThat(state.itemCount()).isEqualTo(3);
    assertThat(state.needsCompaction()).isTrue();
    assertThat(state.overBudget()).isTrue();
    assertThat(state.phase()).isEqualTo(CompactionPhase.AT_THRESHOLD);
    assertThat(sink.size()).isEqualTo(0);
    assertThat(service.getStatistics().summariesCreated()).isEqualTo(0);
  }

  @Test
  public void addToContext_reachingThreshold_compacts() {
    List<ContextItem> lowItems = new ArrayList<>();
    service.addToContext(
        CONSUMER, text(400, "Keep the screen reader running."), ItemKind.INPUT, Priority.HIGH);
    for (int i = 0; i < 9; i++) {
      lowItems.add(
          service.addToContext(
              CONSUMER,
              text(320, "Background note " + i + " about the file manager."),
              ItemKind.KNOWLEDGE,
              Priority.LOW));
    }

    ContextState state = service.getContextState(CONSUMER);
    assertThat(state.totalTokens()).isAtMost(500);
    assertThat(state.needsCompaction()).isFalse();
    assertThat(state.phase()).isEqualTo(CompactionPhase.UNDER_THRESHOLD);
    assertThat(state.itemsByPriority()).containsExactly(Priority.HIGH, 1, Priority.MEDIUM, 1);
    ImmutableList<ArchiveEntry> entries = sink.entries(CONSUMER);
    assertThat(entries).hasSize(1);
    assertThat(entries.get(0).items()).containsExactlyElementsIn(lowItems).inOrder();

    ContextStatistics statistics = service.getStatistics();
    assertThat(statistics.summariesCreated()).isEqualTo(1);
    assertThat(statistics.tokensSaved()).isGreaterThan(0L);
    assertThat(statistics.consumers().get(CONSUMER)).isEqualTo(state);
  }

  @Test
  public void getOptimizedContext_ordersByPriorityThenRecency() {
    service.addToContext(CONSUMER, "Files are in Documents.", ItemKind.KNOWLEDGE, Priority.LOW);
    service.addToContext(CONSUMER, "Open my notes.", ItemKind.INPUT, Priority.HIGH);
    service.addToContext(CONSUMER, "Voice mode active.", ItemKind.SYSTEM_NOTE, Priority.CRITICAL);
    service.addToContext(CONSUMER, "Opening your notes.", ItemKind.REPLY, Priority.HIGH);
    service.addToContext(CONSUMER, "Earlier chat.", ItemKind.INPUT, Priority.ARCHIVE);

    assertThat(service.getOptimizedContext(CONSUMER))
        .isEqualTo(
            "[System] Voice mode active.\n"
                + "Assistant: Opening your notes.\n"
                + "User: Open my notes.\n"
                + "Files are in Documents.\n"
                + "User: Earlier chat.");
  }

  @Test
  public void reads_areIdempotent() {
    service.addToContext(CONSUMER, "Open my notes.", ItemKind.INPUT, Priority.HIGH);
    service.addToContext(CONSUMER, "Opening your notes.", ItemKind.REPLY, Priority.MEDIUM);

    assertThat(service.getOptimizedContext(CONSUMER))
        .isEqualTo(service.getOptimizedContext(CONSUMER));
    assertThat(service.getContextState(CONSUMER)).isEqualTo(service.getContextState(CONSUMER));
  }

  @Test
  public void unknownConsumer_hasEmptyState() {
    ContextState state = service.getContextState("nobody");

    assertThat(state.itemCount()).isEqualTo(0);
    assertThat(state.totalTokens()).isEqualTo(0);
    assertThat(state.limit()).isEqualTo(1000);
    assertThat(service.getOptimizedContext("nobody")).isEmpty();
    assertThat(service.getStatistics().consumers()).doesNotContainKey("nobody");
  }

  @Test
  public void clearContext_archivesEveryLiveItemThenEmpties() {
    List<ContextItem> live = new ArrayList<>();
    live.add(service.addToContext(CONSUMER, "Open my notes.", ItemKind.INPUT, Priority.HIGH));
    live.add(service.addToContext(CONSUMER, "Opening.", ItemKind.REPLY, Priority.MEDIUM));
    live.add(service.addToContext(CONSUMER, "Notes app.", ItemKind.KNOWLEDGE, Priority.LOW));

    service.clearContext(CONSUMER);

    ContextState state = service.getContextState(CONSUMER);
    assertThat(state.itemCount()).isEqualTo(0);
    assertThat(state.totalTokens()).isEqualTo(0);
    assertThat(service.getOptimizedContext(CONSUMER)).isEmpty();
    ImmutableList<ArchiveEntry> entries = sink.entries(CONSUMER);
    assertThat(entries).hasSize(1);
    assertThat(entries.get(0).items()).containsExactlyElementsIn(live).inOrder();
    assertThat(service.getStatistics().contextsCleared()).isEqualTo(1);
  }

  @Test
  public void clearContext_emptyContext_writesNoArchive() {
    service.clearContext(CONSUMER);

    assertThat(sink.size()).isEqualTo(0);
    assertThat(service.getStatistics().contextsCleared()).isEqualTo(1);
  }

  @Test
  public void clearContext_leavesOtherConsumersAlone() {
    service.addToContext(CONSUMER, "Open my notes.", ItemKind.INPUT, Priority.HIGH);
    service.addToContext("guardian_ai", "Unusual login.", ItemKind.SYSTEM_NOTE, Priority.HIGH);

    service.clearContext(CONSUMER);

    assertThat(service.getContextState("guardian_ai").itemCount()).isEqualTo(1);
  }

  @Test
  public void compactNow_belowThreshold_compactsOnlyWhenNeeded() {
    service.addToContext(CONSUMER, "Open my notes.", ItemKind.INPUT, Priority.LOW);

    CompactionResult result = service.compactNow(CONSUMER);

    assertThat(result.status()).isEqualTo(CompactionResult.Status.SKIPPED_WITHIN_BUDGET);
    assertThat(service.getStatistics().summariesCreated()).isEqualTo(0);
  }

  @Test
  public void configure_lowerLimit_compactsImmediately() {
    for (int i = 0; i < 5; i++) {
      service.addToContext(
          CONSUMER, text(320, "Reference note " + i + "."), ItemKind.KNOWLEDGE, Priority.LOW);
    }
    assertThat(service.getContextState(CONSUMER).totalTokens()).isEqualTo(400);

    service.configure(CONSUMER, ContextBudgetConfig.builder().limitTokens(500).build());

    ContextState state = service.getContextState(CONSUMER);
    assertThat(state.limit()).isEqualTo(500);
    assertThat(state.totalTokens()).isAtMost(250);
    assertThat(service.getStatistics().summariesCreated()).isEqualTo(1);
  }

  @Test
  public void configure_unknownConsumer_appliesToNewItems() {
    service.configure("guardian_ai", ContextBudgetConfig.builder().limitTokens(4000).build());

    service.addToContext("guardian_ai", "Unusual login.", ItemKind.SYSTEM_NOTE, Priority.HIGH);

    assertThat(service.getContextState("guardian_ai").limit()).isEqualTo(4000);
    assertThat(service.getContextState(CONSUMER).limit()).isEqualTo(1000);
  }

  @Test
  public void builder_consumerConfigTakesPrecedence() {
    ContextBudgetService configured =
        ContextBudgetService.builder()
            .archivalSink(sink)
            .defaultConfig(ContextBudgetConfig.builder().limitTokens(1000).build())
            .consumerConfig(
                "orchestration_ai", ContextBudgetConfig.builder().limitTokens(16000).build())
            .build();

    assertThat(configured.getContextState("orchestration_ai").limit()).isEqualTo(16000);
    assertThat(configured.getContextState(CONSUMER).limit()).isEqualTo(1000);
  }

  @Test
  public void concurrentAdds_sameConsumer_neverArchiveAnItemTwice() throws Exception {
    executor = Executors.newFixedThreadPool(4);
    List<Callable<List<ContextItem>>> producers = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      int producer = p;
      producers.add(
          () -> {
            List<ContextItem> added = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
              added.add(
                  service.addToContext(
                      CONSUMER,
                      text(320, "Producer " + producer + " note " + i + "."),
                      ItemKind.KNOWLEDGE,
                      Priority.LOW));
            }
            return added;
          });
    }

    Set<String> addedIds = new HashSet<>();
    for (Future<List<ContextItem>> future : executor.invokeAll(producers)) {
      for (ContextItem item : future.get()) {
        addedIds.add(item.id());
      }
    }

    assertThat(addedIds).hasSize(100);
    assertThat(service.getContextState(CONSUMER).totalTokens()).isLessThan(750);

    // After a clear every original item sits in exactly one archive entry.
    service.clearContext(CONSUMER);
    List<String> archivedOriginals = new ArrayList<>();
    for (ArchiveEntry entry : sink.entries(CONSUMER)) {
      for (ContextItem item : entry.items()) {
        if (!item.summarized()) {
          archivedOriginals.add(item.id());
        }
      }
    }
    assertThat(archivedOriginals).containsNoDuplicates();
    assertThat(archivedOriginals).containsExactlyElementsIn(addedIds);
  }

  @Test
  public void concurrentAdds_differentConsumers_areIndependent() throws Exception {
    executor = Executors.newFixedThreadPool(4);
    List<Callable<Void>> producers = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      String consumer = "consumer_" + p;
      producers.add(
          () -> {
            for (int i = 0; i < 50; i++) {
              service.addToContext(
                  consumer, "Short note " + i + ".", ItemKind.INPUT, Priority.HIGH);
            }
            return null;
          });
    }

    for (Future<Void> future : executor.invokeAll(producers)) {
      future.get();
    }

    for (int p = 0; p < 4; p++) {
      assertThat(service.getContextState("consumer_" + p).itemCount()).isEqualTo(50);
    }
  }
}
