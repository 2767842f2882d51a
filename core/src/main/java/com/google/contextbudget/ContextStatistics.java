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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.contextbudget.context.ContextState;

/** Counters and per-consumer states of a {@link ContextBudgetService}. */
@AutoValue
public abstract class ContextStatistics {

  /** Number of compactions that replaced items with a summary. */
  public abstract long summariesCreated();

  /** Tokens removed from contexts by compaction. */
  public abstract long tokensSaved();

  public abstract long contextsCleared();

  /** Archive writes that failed, summed over all consumers. */
  public abstract long archiveFailures();

  /** Current state of every known consumer, keyed by consumer id. */
  public abstract ImmutableMap<String, ContextState> consumers();

  public static ContextStatistics create(
      long summariesCreated,
      long tokensSaved,
      long contextsCleared,
      long archiveFailures,
      ImmutableMap<String, ContextState> consumers) {
    return new AutoValue_ContextStatistics(
        summariesCreated, tokensSaved, contextsCleared, archiveFailures, consumers);
  }
}
