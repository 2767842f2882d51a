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

import com.google.contextbudget.store.ContextStore;

/** Base interface for compacting a consumer's context. */
public interface ContextCompactor {

  /**
   * Compacts the context held by {@code store}.
   *
   * <p>Implementations run under the store's write lock, so compaction is atomic with respect to
   * other adds and reads for the same consumer. Failures of collaborators such as the archival
   * sink are reported in the result and the store's state, never thrown.
   *
   * @param store The consumer's store.
   * @return What the compaction did.
   */
  CompactionResult compact(ContextStore store);
}
