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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for context budgeting.
 *
 * <p>Counters are recorded through {@link GlobalOpenTelemetry}; without a registered SDK they are
 * no-ops. Recording never throws.
 */
public final class ContextTelemetry {

  private static final Logger log = LoggerFactory.getLogger(ContextTelemetry.class);

  private static final String METER_NAME = "com.google.contextbudget";
  private static final String METRIC_PREFIX = "contextbudget.";

  static final AttributeKey<String> CONSUMER_KEY = AttributeKey.stringKey("consumer.id");
  static final AttributeKey<String> SKIP_REASON_KEY = AttributeKey.stringKey("skip.reason");
  static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("archive.operation");

  private static volatile LongCounter compactionsCounter;
  private static volatile LongCounter skippedCompactionsCounter;
  private static volatile LongCounter tokensSavedCounter;
  private static volatile LongCounter archiveFailuresCounter;
  private static volatile LongCounter clearsCounter;

  private static LongCounter getCompactionsCounter() {
    if (compactionsCounter == null) {
      synchronized (ContextTelemetry.class) {
        if (compactionsCounter == null) {
          compactionsCounter =
              buildCounter("compactions", "Number of compactions that replaced items", "1");
        }
      }
    }
    return compactionsCounter;
  }

  private static LongCounter getSkippedCompactionsCounter() {
    if (skippedCompactionsCounter == null) {
      synchronized (ContextTelemetry.class) {
        if (skippedCompactionsCounter == null) {
          skippedCompactionsCounter =
              buildCounter(
                  "compactions.skipped", "Number of compactions that left the context as is", "1");
        }
      }
    }
    return skippedCompactionsCounter;
  }

  private static LongCounter getTokensSavedCounter() {
    if (tokensSavedCounter == null) {
      synchronized (ContextTelemetry.class) {
        if (tokensSavedCounter == null) {
          tokensSavedCounter =
              buildCounter("tokens.saved", "Tokens removed from contexts by compaction", "{token}");
        }
      }
    }
    return tokensSavedCounter;
  }

  private static LongCounter getArchiveFailuresCounter() {
    if (archiveFailuresCounter == null) {
      synchronized (ContextTelemetry.class) {
        if (archiveFailuresCounter == null) {
          archiveFailuresCounter =
              buildCounter("archive.failures", "Number of archive writes that failed", "1");
        }
      }
    }
    return archiveFailuresCounter;
  }

  private static LongCounter getClearsCounter() {
    if (clearsCounter == null) {
      synchronized (ContextTelemetry.class) {
        if (clearsCounter == null) {
          clearsCounter = buildCounter("clears", "Number of contexts cleared", "1");
        }
      }
    }
    return clearsCounter;
  }

  private static LongCounter buildCounter(String name, String description, String unit) {
    return GlobalOpenTelemetry.getMeter(METER_NAME)
        .counterBuilder(METRIC_PREFIX + name)
        .setDescription(description)
        .setUnit(unit)
        .build();
  }

  private ContextTelemetry() {}

  /**
   * Records a compaction that replaced items with a summary.
   *
   * @param consumerId Consumer whose context was compacted
   * @param tokensSaved Tokens removed from the context, never negative
   */
  public static void recordCompaction(String consumerId, long tokensSaved) {
    Attributes attributes = consumerAttributes(consumerId);
    recordMetric(getCompactionsCounter(), 1, attributes);
    if (tokensSaved > 0) {
      recordMetric(getTokensSavedCounter(), tokensSaved, attributes);
    }
  }

  /**
   * Records a compaction that had nothing to do.
   *
   * @param consumerId Consumer whose context was examined
   * @param reason Why the context was left as is, e.g. "no_candidates"
   */
  public static void recordSkippedCompaction(String consumerId, String reason) {
    recordMetric(
        getSkippedCompactionsCounter(),
        1,
        Attributes.of(CONSUMER_KEY, String.valueOf(consumerId), SKIP_REASON_KEY, reason));
  }

  /**
   * Records an archive write that failed or timed out.
   *
   * @param consumerId Consumer whose items could not be archived
   * @param operation What the write was for, "compaction" or "clear"
   */
  public static void recordArchiveFailure(String consumerId, String operation) {
    recordMetric(
        getArchiveFailuresCounter(),
        1,
        Attributes.of(CONSUMER_KEY, String.valueOf(consumerId), OPERATION_KEY, operation));
  }

  /** Records that a consumer's context was cleared. */
  public static void recordClear(String consumerId) {
    recordMetric(getClearsCounter(), 1, consumerAttributes(consumerId));
  }

  private static Attributes consumerAttributes(String consumerId) {
    return Attributes.of(CONSUMER_KEY, String.valueOf(consumerId));
  }

  private static void recordMetric(LongCounter counter, long value, Attributes attributes) {
    try {
      counter.add(value, attributes);
    } catch (Exception e) {
      log.debug("Failed to record context budget metric", e);
    }
  }

  /** Gets the OpenTelemetry Meter used for context budget metrics. */
  public static Meter getMeter() {
    return GlobalOpenTelemetry.getMeter(METER_NAME);
  }

  /**
   * Resets metric counters for testing.
   *
   * <p>Call after {@code GlobalOpenTelemetry.resetForTest()} so the counters are rebuilt against
   * the newly registered meter provider.
   */
  static void resetMetricsForTest() {
    synchronized (ContextTelemetry.class) {
      compactionsCounter = null;
      skippedCompactionsCounter = null;
      tokensSavedCounter = null;
      archiveFailuresCounter = null;
      clearsCounter = null;
    }
  }
}
