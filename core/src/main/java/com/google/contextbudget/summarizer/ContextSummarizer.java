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

package com.google.contextbudget.summarizer;

import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.tokens.TokenEstimator;
import java.util.List;

/** Base interface for condensing context items during compaction. */
public interface ContextSummarizer {

  /**
   * Condenses a list of context items into a single text.
   *
   * <p>The estimated size of the returned text, as measured by {@code estimator}, must never exceed
   * {@code targetTokens}, whatever the items contain.
   *
   * @param items Items to condense, in any order.
   * @param targetTokens Token budget for the result.
   * @param estimator Estimator the budget is expressed in.
   * @return The condensed text, empty if there were no items.
   */
  String summarizeItems(List<ContextItem> items, int targetTokens, TokenEstimator estimator);
}
