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

/**
 * Token estimator using a fixed characters-per-token ratio.
 *
 * <p>Uses rough approximation: 1 token ≈ 4 characters for English text. The count is rounded up,
 * so a non-empty text is never estimated at 0 tokens.
 */
public final class CharacterTokenEstimator implements TokenEstimator {

  public static final int DEFAULT_CHARS_PER_TOKEN = 4;

  private final int charsPerToken;

  public CharacterTokenEstimator() {
    this(DEFAULT_CHARS_PER_TOKEN);
  }

  public CharacterTokenEstimator(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException(
          "charsPerToken must be greater than 0, got: " + charsPerToken);
    }
    this.charsPerToken = charsPerToken;
  }

  @Override
  public int estimate(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (int) Math.max(1, (text.length() + (long) charsPerToken - 1) / charsPerToken);
  }

  @Override
  public int charsPerToken() {
    return charsPerToken;
  }

  @Override
  public String toString() {
    return "CharacterTokenEstimator(charsPerToken=" + charsPerToken + ")";
  }
}
