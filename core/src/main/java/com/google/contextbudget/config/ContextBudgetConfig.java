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

package com.google.contextbudget.config;

import com.google.auto.value.AutoValue;
import com.google.contextbudget.tokens.CharacterTokenEstimator;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;

/**
 * Budget configuration for a single consumer of context.
 *
 * <p>A consumer's context is compacted once its usage reaches {@code limitTokens × thresholdRatio},
 * and compaction aims to bring it down to {@code limitTokens × targetRatio}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ContextBudgetConfig config = ContextBudgetConfig.builder()
 *     .limitTokens(16000)
 *     .thresholdRatio(0.8)
 *     .build();
 * }</pre>
 */
@AutoValue
public abstract class ContextBudgetConfig {

  public static final double DEFAULT_THRESHOLD_RATIO = 0.75;
  public static final double DEFAULT_TARGET_RATIO = 0.5;
  public static final double DEFAULT_RESERVED_MINIMUM_RATIO = 0.3;
  public static final int DEFAULT_LIMIT_TOKENS = 8000;
  public static final Duration DEFAULT_ARCHIVE_WRITE_TIMEOUT = Duration.ofSeconds(5);

  /** Maximum context size in tokens. */
  public abstract int limitTokens();

  /**
   * Fraction of the limit at which compaction fires.
   *
   * <p>Range: (0, 1], must be greater than {@link #targetRatio()}. Default: 0.75
   */
  public abstract double thresholdRatio();

  /**
   * Fraction of the limit that compaction aims for.
   *
   * <p>Range: (0, 1]. Default: 0.5
   */
  public abstract double targetRatio();

  /** Characters counted as one token. Default: 4 */
  public abstract int charsPerToken();

  /**
   * Fraction of the limit granted to the summary when the kept items alone already use up the
   * target, so that compaction always makes progress.
   *
   * <p>Range: (0, 1]. Default: 0.3
   */
  public abstract double reservedMinimumRatio();

  /** Upper bound on a single archive write. Default: 5 seconds */
  public abstract Duration archiveWriteTimeout();

  /** Usage, in tokens, at which compaction fires. */
  public int thresholdTokens() {
    // Strip floating point noise such as 1000 × 0.7 = 700.0000000000001 before rounding up.
    return (int) Math.ceil(limitTokens() * thresholdRatio() - 1e-9);
  }

  /** Usage, in tokens, that compaction aims for. */
  public int targetTokens() {
    return (int) (limitTokens() * targetRatio() + 1e-9);
  }

  /** Summary budget used when the kept items leave no room under the target. */
  public int reservedMinimumTokens() {
    return Math.max(1, (int) Math.ceil(limitTokens() * reservedMinimumRatio() - 1e-9));
  }

  public abstract Builder toBuilder();

  /**
   * Creates a new builder with default values.
   *
   * @return A new builder instance.
   */
  public static Builder builder() {
    return new AutoValue_ContextBudgetConfig.Builder()
        .limitTokens(DEFAULT_LIMIT_TOKENS)
        .thresholdRatio(DEFAULT_THRESHOLD_RATIO)
        .targetRatio(DEFAULT_TARGET_RATIO)
        .charsPerToken(CharacterTokenEstimator.DEFAULT_CHARS_PER_TOKEN)
        .reservedMinimumRatio(DEFAULT_RESERVED_MINIMUM_RATIO)
        .archiveWriteTimeout(DEFAULT_ARCHIVE_WRITE_TIMEOUT);
  }

  /** Builder for {@link ContextBudgetConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    /**
     * Sets the token limit.
     *
     * @param limitTokens Maximum context size (1+)
     * @return This builder
     */
    @CanIgnoreReturnValue
    public abstract Builder limitTokens(int limitTokens);

    @CanIgnoreReturnValue
    public abstract Builder thresholdRatio(double thresholdRatio);

    @CanIgnoreReturnValue
    public abstract Builder targetRatio(double targetRatio);

    @CanIgnoreReturnValue
    public abstract Builder charsPerToken(int charsPerToken);

    @CanIgnoreReturnValue
    public abstract Builder reservedMinimumRatio(double reservedMinimumRatio);

    @CanIgnoreReturnValue
    public abstract Builder archiveWriteTimeout(Duration archiveWriteTimeout);

    abstract ContextBudgetConfig autoBuild();

    /**
     * Builds and validates the ContextBudgetConfig.
     *
     * @return A validated ContextBudgetConfig instance.
     * @throws ContextBudgetConfigException if validation fails.
     */
    public final ContextBudgetConfig build() {
      ContextBudgetConfig config = autoBuild();

      if (config.limitTokens() <= 0) {
        throw new ContextBudgetConfigException(
            "limitTokens must be greater than 0, got: " + config.limitTokens());
      }

      checkRatio("thresholdRatio", config.thresholdRatio());
      checkRatio("targetRatio", config.targetRatio());
      checkRatio("reservedMinimumRatio", config.reservedMinimumRatio());

      if (config.thresholdRatio() <= config.targetRatio()) {
        throw new ContextBudgetConfigException(
            String.format(
                "thresholdRatio must be greater than targetRatio, got: %s <= %s",
                config.thresholdRatio(), config.targetRatio()));
      }

      if (config.charsPerToken() <= 0) {
        throw new ContextBudgetConfigException(
            "charsPerToken must be greater than 0, got: " + config.charsPerToken());
      }

      if (config.archiveWriteTimeout().isNegative() || config.archiveWriteTimeout().isZero()) {
        throw new ContextBudgetConfigException(
            "archiveWriteTimeout must be positive, got: " + config.archiveWriteTimeout());
      }

      return config;
    }

    private static void checkRatio(String name, double value) {
      if (!(value > 0.0 && value <= 1.0)) {
        throw new ContextBudgetConfigException(
            String.format("%s must be in (0, 1], got: %s", name, value));
      }
    }
  }

  @Override
  public final String toString() {
    return String.format(
        "ContextBudgetConfig(limit=%d, threshold=%.2f, target=%.2f, charsPerToken=%d)",
        limitTokens(), thresholdRatio(), targetRatio(), charsPerToken());
  }
}
