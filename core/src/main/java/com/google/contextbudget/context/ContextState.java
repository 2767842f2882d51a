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

package com.google.contextbudget.context;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Optional;

/**
 * Snapshot of a consumer's context usage.
 *
 * <p>Two conditions are reported as flags rather than errors: {@link #needsCompaction()} stays true
 * when there is nothing left to compact, and {@link #overBudget()} is true when the last compaction
 * could not bring usage down to {@link #targetTokens()}. In both cases callers keep receiving
 * best-effort context; raising the limit or reclassifying items resolves them.
 */
@AutoValue
public abstract class ContextState {

  public abstract String consumerId();

  public abstract int totalTokens();

  /** Configured token limit. */
  public abstract int limit();

  /** Usage after a compaction, derived from the target ratio. */
  public abstract int targetTokens();

  /** {@code totalTokens / limit}. */
  public abstract double usageRatio();

  public abstract int itemCount();

  /** Number of items per priority tier, tiers without items omitted. */
  public abstract ImmutableMap<Priority, Integer> itemsByPriority();

  /** Whether {@link #usageRatio()} is at or above the threshold ratio. */
  public abstract boolean needsCompaction();

  public abstract CompactionPhase phase();

  public abstract boolean overBudget();

  public abstract int archiveFailureCount();

  public abstract Optional<ArchiveFailure> lastArchiveFailure();

  public static Builder builder() {
    return new AutoValue_ContextState.Builder()
        .itemsByPriority(ImmutableMap.of())
        .overBudget(false)
        .archiveFailureCount(0);
  }

  /** Builder for {@link ContextState}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder consumerId(String consumerId);

    @CanIgnoreReturnValue
    public abstract Builder totalTokens(int totalTokens);

    @CanIgnoreReturnValue
    public abstract Builder limit(int limit);

    @CanIgnoreReturnValue
    public abstract Builder targetTokens(int targetTokens);

    @CanIgnoreReturnValue
    public abstract Builder usageRatio(double usageRatio);

    @CanIgnoreReturnValue
    public abstract Builder itemCount(int itemCount);

    @CanIgnoreReturnValue
    public abstract Builder itemsByPriority(ImmutableMap<Priority, Integer> itemsByPriority);

    @CanIgnoreReturnValue
    public abstract Builder needsCompaction(boolean needsCompaction);

    @CanIgnoreReturnValue
    public abstract Builder phase(CompactionPhase phase);

    @CanIgnoreReturnValue
    public abstract Builder overBudget(boolean overBudget);

    @CanIgnoreReturnValue
    public abstract Builder archiveFailureCount(int archiveFailureCount);

    @CanIgnoreReturnValue
    public abstract Builder lastArchiveFailure(Optional<ArchiveFailure> lastArchiveFailure);

    public abstract ContextState build();
  }

  @Override
  public final String toString() {
    return String.format(
        "ContextState(%s: %d/%d tokens, %.1f%%, %d items, phase=%s)",
        consumerId(), totalTokens(), limit(), usageRatio() * 100, itemCount(), phase());
  }
}
