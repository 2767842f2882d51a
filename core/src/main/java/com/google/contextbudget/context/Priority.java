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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Priority tier of a {@link ContextItem}.
 *
 * <p>Tiers form a total order, {@code CRITICAL > HIGH > MEDIUM > LOW > ARCHIVE}. Items at {@link
 * #HIGH} or above are never compacted.
 */
public enum Priority {
  /** Never summarized: user intent, the current action. */
  CRITICAL(5),
  /** Kept verbatim: recent context. */
  HIGH(4),
  /** Background information. Compaction summaries are created at this tier. */
  MEDIUM(3),
  /** Old history, summarized aggressively. */
  LOW(2),
  /** May leave the context entirely. */
  ARCHIVE(1);

  private final int level;

  Priority(int level) {
    this.level = level;
  }

  /** Numeric level, higher is more important. */
  @JsonValue
  public int level() {
    return level;
  }

  public boolean isAtLeast(Priority other) {
    return level >= other.level;
  }

  @JsonCreator
  public static Priority fromLevel(int level) {
    return Arrays.stream(values())
        .filter(p -> p.level == level)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown priority level: " + level));
  }
}
