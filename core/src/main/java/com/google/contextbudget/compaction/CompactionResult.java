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

import com.google.auto.value.AutoValue;
import com.google.contextbudget.context.SummaryOutcome;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Optional;

/** Outcome of one compaction of a consumer's context. */
@AutoValue
public abstract class CompactionResult {

  /** What a compaction did. */
  public enum Status {
    /** Low-priority items were archived and replaced with a summary. */
    COMPACTED,
    /** Every item is high priority or above; the context is unchanged. */
    SKIPPED_NO_CANDIDATES,
    /** The low-priority items already fit their budget; the context is unchanged. */
    SKIPPED_WITHIN_BUDGET
  }

  public abstract String consumerId();

  public abstract Status status();

  public abstract int tokensBefore();

  public abstract int tokensAfter();

  /** Number of items kept as they were. */
  public abstract int keptItemCount();

  /** Number of items replaced by the summary, 0 unless {@link Status#COMPACTED}. */
  public abstract int compactedItemCount();

  /** Whether usage is still above the target tokens afterwards. */
  public abstract boolean overBudget();

  /** Present if {@link Status#COMPACTED}. */
  public abstract Optional<SummaryOutcome> summaryOutcome();

  public boolean compacted() {
    return status() == Status.COMPACTED;
  }

  public int tokensSaved() {
    return Math.max(0, tokensBefore() - tokensAfter());
  }

  public static Builder builder() {
    return new AutoValue_CompactionResult.Builder().compactedItemCount(0);
  }

  /** Builder for {@link CompactionResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder consumerId(String consumerId);

    @CanIgnoreReturnValue
    public abstract Builder status(Status status);

    @CanIgnoreReturnValue
    public abstract Builder tokensBefore(int tokensBefore);

    @CanIgnoreReturnValue
    public abstract Builder tokensAfter(int tokensAfter);

    @CanIgnoreReturnValue
    public abstract Builder keptItemCount(int keptItemCount);

    @CanIgnoreReturnValue
    public abstract Builder compactedItemCount(int compactedItemCount);

    @CanIgnoreReturnValue
    public abstract Builder overBudget(boolean overBudget);

    @CanIgnoreReturnValue
    public abstract Builder summaryOutcome(SummaryOutcome summaryOutcome);

    public abstract CompactionResult build();
  }
}
