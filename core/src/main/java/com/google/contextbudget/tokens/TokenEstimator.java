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

package com.google.contextbudget.tokens;

import javax.annotation.Nullable;

/** Base interface for approximating the model-facing size of a text. */
public interface TokenEstimator {

  /**
   * Estimates the number of tokens in the given text.
   *
   * <p>Implementations must be pure and deterministic: the same text always yields the same count,
   * so that budget comparisons are reproducible.
   *
   * @param text Text to estimate, may be null.
   * @return 0 for null or empty text, otherwise a count of at least 1.
   */
  int estimate(@Nullable String text);

  /**
   * Returns the number of characters that {@link #estimate(String)} counts as one token.
   *
   * <p>Used when a text has to be cut down to a token budget.
   */
  int charsPerToken();
}
