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
import java.util.Optional;
import javax.annotation.Nullable;

/** Result of summarizing a set of context items during compaction. */
@AutoValue
public abstract class SummaryOutcome {

  public abstract int originalTokens();

  public abstract int summarizedTokens();

  /** {@code summarizedTokens / originalTokens}, 1.0 when there was nothing to compress. */
  public abstract double compressionRatio();

  public abstract String summary();

  /** Whether the originals were written to the archive. */
  public abstract boolean preservedInArchive();

  public abstract Optional<String> archiveReference();

  /** Tokens removed from the context by this summary. */
  public int tokensSaved() {
    return Math.max(0, originalTokens() - summarizedTokens());
  }

  public static SummaryOutcome create(
      int originalTokens,
      int summarizedTokens,
      String summary,
      @Nullable String archiveReference) {
    double ratio = originalTokens > 0 ? summarizedTokens / (double) originalTokens : 1.0;
    return new AutoValue_SummaryOutcome(
        originalTokens,
        summarizedTokens,
        ratio,
        summary,
        archiveReference != null,
        Optional.ofNullable(archiveReference));
  }

  @Override
  public final String toString() {
    return String.format(
        "SummaryOutcome(%d -> %d tokens, %.1f%% of original, archived=%s)",
        originalTokens(), summarizedTokens(), compressionRatio() * 100, preservedInArchive());
  }
}
